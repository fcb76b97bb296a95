package com.coparent.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "event_reminders", indexes = {
        @Index(name = "idx_event_reminders_due", columnList = "sent,sendAt")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EventReminder {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private Long eventId;

    @Column(nullable = false)
    private Long familyId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false)
    private Instant startDate;

    @Builder.Default
    @Column(nullable = false)
    private Boolean isAllDay = false;

    @Column(nullable = false)
    private Instant sendAt;

    @Builder.Default
    @Column(nullable = false)
    private Boolean sent = false;

    @Column
    private Instant sentAt;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "event_reminder_targets", joinColumns = @JoinColumn(name = "reminder_id"))
    @Column(name = "user_id", length = 128)
    private List<String> targetUids = new ArrayList<>();
}
