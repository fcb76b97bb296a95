package com.coparent.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The single recurring custody pattern of a family. Day numbers are 0 (Sunday) to 6.
 */
@Entity
@Table(name = "custody_schedules")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CustodySchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private Long familyId;

    @Column(length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private Pattern pattern;

    @Column(nullable = false)
    private Instant startDate;

    @Column
    private Instant endDate;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "custody_schedule_parent1_days", joinColumns = @JoinColumn(name = "schedule_id"))
    @OrderColumn(name = "position")
    @Column(name = "day_of_week")
    private List<Integer> parent1Days = new ArrayList<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "custody_schedule_parent2_days", joinColumns = @JoinColumn(name = "schedule_id"))
    @OrderColumn(name = "position")
    @Column(name = "day_of_week")
    private List<Integer> parent2Days = new ArrayList<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "custody_schedule_alt_parent1_days", joinColumns = @JoinColumn(name = "schedule_id"))
    @OrderColumn(name = "position")
    @Column(name = "day_of_week")
    private List<Integer> biweeklyAltParent1Days = new ArrayList<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "custody_schedule_alt_parent2_days", joinColumns = @JoinColumn(name = "schedule_id"))
    @OrderColumn(name = "position")
    @Column(name = "day_of_week")
    private List<Integer> biweeklyAltParent2Days = new ArrayList<>();

    @Builder.Default
    @Column(nullable = false)
    private Boolean isActive = true;

    @OneToOne(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @JoinColumn(name = "pending_approval_id")
    private CustodyApproval pendingApproval;

    @Version
    private Long version;

    @CreationTimestamp
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public enum Pattern {
        WEEKLY, BIWEEKLY, CUSTOM, WEEK_ON_WEEK_OFF;

        @JsonValue
        public String getValue() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Pattern fromValue(String value) {
            return Pattern.valueOf(value.trim().toUpperCase());
        }
    }
}
