package com.coparent.dto;

import com.coparent.entity.FamilySettings;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FamilySettingsDto {
    @Pattern(regexp = "USD|EUR|GBP|ILS|CAD")
    private String defaultCurrency;

    @Pattern(regexp = "equal|percentage|custom")
    private String expenseSplitDefault;

    @Min(0)
    @Max(100)
    private Integer parent1Percentage;

    @Min(0)
    @Max(100)
    private Integer parent2Percentage;

    private Boolean requireApprovalForExpenses;

    @DecimalMin("0")
    private BigDecimal expenseApprovalThreshold;

    private Boolean allowSwapRequests;
    private Boolean requireApprovalForSwaps;

    @Pattern(regexp = NotificationPreferencesDto.HH_MM, message = "must be HH:mm")
    private String reminderDefaultTime;

    private Boolean enableCalendarReminders;

    @Min(0)
    private Integer calendarReminderMinutes;

    public static FamilySettingsDto from(FamilySettings s) {
        return FamilySettingsDto.builder()
                .defaultCurrency(s.getDefaultCurrency())
                .expenseSplitDefault(s.getExpenseSplitDefault())
                .parent1Percentage(s.getParent1Percentage())
                .parent2Percentage(s.getParent2Percentage())
                .requireApprovalForExpenses(s.getRequireApprovalForExpenses())
                .expenseApprovalThreshold(s.getExpenseApprovalThreshold())
                .allowSwapRequests(s.getAllowSwapRequests())
                .requireApprovalForSwaps(s.getRequireApprovalForSwaps())
                .reminderDefaultTime(s.getReminderDefaultTime())
                .enableCalendarReminders(s.getEnableCalendarReminders())
                .calendarReminderMinutes(s.getCalendarReminderMinutes())
                .build();
    }
}
