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

@Entity
@Table(name = "calendar_events", indexes = {
        @Index(name = "idx_calendar_events_family_start", columnList = "familyId,startDate"),
        @Index(name = "idx_calendar_events_swap_request", columnList = "swapRequestId")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CalendarEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long familyId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 1000)
    private String description;

    @Column(nullable = false)
    private Instant startDate;

    @Column(nullable = false)
    private Instant endDate;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EventType type = EventType.OTHER;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ParentSlot parentId = ParentSlot.BOTH;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "calendar_event_targets", joinColumns = @JoinColumn(name = "event_id"))
    @Column(name = "user_id", length = 128)
    private List<String> targetUids = new ArrayList<>();

    @Column(length = 20)
    private String color;

    @Column(length = 200)
    private String location;

    @Column
    private Integer reminderMinutes;

    @Builder.Default
    @Column(nullable = false)
    private Boolean isAllDay = false;

    @Column
    private Long childId;

    @Column
    private Long swapRequestId; // set on events derived from an approved swap

    @Column(length = 128)
    private String createdById;

    @Column
    private String createdByName;

    @CreationTimestamp
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public enum EventType {
        CUSTODY, PICKUP, DROPOFF, SCHOOL, ACTIVITY, MEDICAL, HOLIDAY, VACATION, OTHER;

        @JsonValue
        public String getValue() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static EventType fromValue(String value) {
            return EventType.valueOf(value.trim().toUpperCase());
        }
    }
}
