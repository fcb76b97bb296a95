package com.coparent.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "notifications", indexes = {
        @Index(name = "idx_notifications_user_read", columnList = "userId,is_read")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String userId;

    @Column
    private Long familyId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private Type type;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, length = 500)
    private String body;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Priority priority = Priority.NORMAL;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "notification_data", joinColumns = @JoinColumn(name = "notification_id"))
    @MapKeyColumn(name = "data_key", length = 100)
    @Column(name = "data_value", length = 500)
    private Map<String, String> data = new HashMap<>();

    @Column
    private String actionUrl;

    @Builder.Default
    @Column(name = "is_read", nullable = false)
    private Boolean read = false;

    @CreationTimestamp
    private Instant createdAt;

    public enum Type {
        EXPENSE_CREATED,
        EXPENSE_APPROVED,
        EXPENSE_REJECTED,
        EXPENSE_PAID,
        SWAP_REQUEST_CREATED,
        SWAP_REQUEST_APPROVED,
        SWAP_REQUEST_REJECTED,
        TASK_ASSIGNED,
        TASK_COMPLETED,
        CALENDAR_EVENT_CREATED,
        CALENDAR_EVENT_UPDATED,
        CALENDAR_EVENT_REMINDER,
        DOCUMENT_SHARED,
        CHAT_MESSAGE,
        FAMILY_INVITE,
        SYSTEM_ANNOUNCEMENT;

        @JsonValue
        public String getValue() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Type fromValue(String value) {
            return Type.valueOf(value.trim().toUpperCase());
        }
    }

    public enum Priority {
        LOW, NORMAL, HIGH, URGENT;

        @JsonValue
        public String getValue() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Priority fromValue(String value) {
            return Priority.valueOf(value.trim().toUpperCase());
        }
    }
}
