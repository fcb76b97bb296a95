package com.coparent.dto;

import com.coparent.entity.UserSettings;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class UserSettingsDto {
    @Pattern(regexp = "en|he|es|fr|de")
    private String language;

    @Size(max = 64)
    private String timezone;

    @Pattern(regexp = "MM/DD/YYYY|DD/MM/YYYY|YYYY-MM-DD")
    private String dateFormat;

    @Pattern(regexp = "12h|24h")
    private String timeFormat;

    @Pattern(regexp = "sunday|monday")
    private String weekStart;

    @Pattern(regexp = "light|dark|auto")
    private String theme;

    public static UserSettingsDto from(UserSettings s) {
        return UserSettingsDto.builder()
                .language(s.getLanguage())
                .timezone(s.getTimezone())
                .dateFormat(s.getDateFormat())
                .timeFormat(s.getTimeFormat())
                .weekStart(s.getWeekStart())
                .theme(s.getTheme())
                .build();
    }
}
