package com.coparent.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "family_settings")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FamilySettings {

    public static final int DEFAULT_PERCENTAGE = 50;

    @Id
    private Long familyId;

    @Builder.Default
    @Column(length = 3)
    private String defaultCurrency = "USD";

    @Builder.Default
    @Column(length = 20)
    private String expenseSplitDefault = "equal";

    @Builder.Default
    private Integer parent1Percentage = DEFAULT_PERCENTAGE;

    @Builder.Default
    private Integer parent2Percentage = DEFAULT_PERCENTAGE;

    @Builder.Default
    private Boolean requireApprovalForExpenses = true;

    @Column(precision = 12, scale = 2)
    private BigDecimal expenseApprovalThreshold;

    @Builder.Default
    private Boolean allowSwapRequests = true;

    @Builder.Default
    private Boolean requireApprovalForSwaps = true;

    @Builder.Default
    @Column(length = 5)
    private String reminderDefaultTime = "09:00";

    @Builder.Default
    private Boolean enableCalendarReminders = true;

    @Builder.Default
    private Integer calendarReminderMinutes = 30;

    @UpdateTimestamp
    private Instant updatedAt;
}
