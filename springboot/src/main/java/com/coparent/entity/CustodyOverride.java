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
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(name = "custody_overrides", indexes = {
        @Index(name = "idx_custody_overrides_family_start", columnList = "familyId,startDate")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CustodyOverride {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long familyId;

    @Column(length = 200)
    private String name;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Type type = Type.SPECIAL;

    @Column(nullable = false)
    private Instant startDate;

    @Column(nullable = false)
    private Instant endDate;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "custody_override_assignments", joinColumns = @JoinColumn(name = "override_id"))
    @MapKeyColumn(name = "assignment_date")
    @Enumerated(EnumType.STRING)
    @Column(name = "parent_slot", nullable = false, length = 10)
    private Map<LocalDate, ParentSlot> assignments = new LinkedHashMap<>();

    @Column(length = 500)
    private String note;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Status status = Status.PENDING;

    @Column(nullable = false, length = 128)
    private String requestedById;

    @Column
    private String requestedByName;

    // null when no approval was needed
    @Column(length = 128)
    private String requestedToId;

    @Column
    private String requestedToName;

    @Column(length = 500)
    private String responseNote;

    @Column(length = 128)
    private String respondedById;

    @Column
    private Instant respondedAt;

    @Version
    private Long version;

    @CreationTimestamp
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public enum Type {
        VACATION,
        HOLIDAY,
        SPECIAL,
        SWAP;

        @JsonValue
        public String getValue() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Type fromValue(String value) {
            return Type.valueOf(value.trim().toUpperCase());
        }
    }

    public enum Status {
        PENDING,
        APPROVED,
        REJECTED;

        @JsonValue
        public String getValue() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Status fromValue(String value) {
            return Status.valueOf(value.trim().toUpperCase());
        }
    }
}
