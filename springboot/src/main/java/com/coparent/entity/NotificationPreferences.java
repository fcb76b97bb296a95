package com.coparent.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "notification_preferences")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotificationPreferences {

    @Id
    @Column(length = 128)
    private String userId;

    @Builder.Default
    private Boolean expenseNotifications = true;

    @Builder.Default
    private Boolean swapRequestNotifications = true;

    @Builder.Default
    private Boolean taskNotifications = true;

    @Builder.Default
    private Boolean calendarNotifications = true;

    @Builder.Default
    private Boolean chatNotifications = true;

    @Builder.Default
    private Boolean emailNotifications = true;

    @Builder.Default
    private Boolean pushNotifications = true;

    @Builder.Default
    private Boolean quietHoursEnabled = false;

    @Column(length = 5)
    private String quietHoursStart; // HH:mm

    @Column(length = 5)
    private String quietHoursEnd; // HH:mm

    @UpdateTimestamp
    private Instant updatedAt;
}
