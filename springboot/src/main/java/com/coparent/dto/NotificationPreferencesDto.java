package com.coparent.dto;

import com.coparent.entity.NotificationPreferences;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class NotificationPreferencesDto {
    public static final String HH_MM = "^([01]\\d|2[0-3]):([0-5]\\d)$";

    private Boolean expenseNotifications;
    private Boolean swapRequestNotifications;
    private Boolean taskNotifications;
    private Boolean calendarNotifications;
    private Boolean chatNotifications;
    private Boolean emailNotifications;
    private Boolean pushNotifications;
    private Boolean quietHoursEnabled;

    @Pattern(regexp = HH_MM, message = "must be HH:mm")
    private String quietHoursStart;

    @Pattern(regexp = HH_MM, message = "must be HH:mm")
    private String quietHoursEnd;

    public static NotificationPreferencesDto from(NotificationPreferences p) {
        return NotificationPreferencesDto.builder()
                .expenseNotifications(p.getExpenseNotifications())
                .swapRequestNotifications(p.getSwapRequestNotifications())
                .taskNotifications(p.getTaskNotifications())
                .calendarNotifications(p.getCalendarNotifications())
                .chatNotifications(p.getChatNotifications())
                .emailNotifications(p.getEmailNotifications())
                .pushNotifications(p.getPushNotifications())
                .quietHoursEnabled(p.getQuietHoursEnabled())
                .quietHoursStart(p.getQuietHoursStart())
                .quietHoursEnd(p.getQuietHoursEnd())
                .build();
    }
}
