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

@Entity
@Table(name = "tasks", indexes = {
        @Index(name = "idx_tasks_family_status", columnList = "familyId,status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long familyId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 1000)
    private String description;

    @Column
    private Instant dueDate;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Priority priority = Priority.MEDIUM;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Status status = Status.PENDING;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ParentSlot assignedTo = ParentSlot.BOTH;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Category category = Category.OTHER;

    @Column
    private Long childId;

    @Column
    private Integer reminderMinutes;

    @Column
    private Instant completedAt;

    @Column(length = 128)
    private String completedById;

    @Column(length = 128)
    private String createdById;

    @Column
    private String createdByName;

    @CreationTimestamp
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public enum Priority {
        LOW, MEDIUM, HIGH, URGENT;

        @JsonValue
        public String getValue() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Priority fromValue(String value) {
            return Priority.valueOf(value.trim().toUpperCase());
        }
    }

    public enum Status {
        PENDING, IN_PROGRESS, COMPLETED, CANCELLED;

        public boolean isTerminal() {
            return this == COMPLETED || this == CANCELLED;
        }

        @JsonValue
        public String getValue() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Status fromValue(String value) {
            return Status.valueOf(value.trim().toUpperCase());
        }
    }

    public enum Category {
        MEDICAL, EDUCATION, ACTIVITY, SHOPPING, HOUSEHOLD, PAPERWORK, OTHER;

        @JsonValue
        public String getValue() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Category fromValue(String value) {
            return Category.valueOf(value.trim().toUpperCase());
        }
    }
}
