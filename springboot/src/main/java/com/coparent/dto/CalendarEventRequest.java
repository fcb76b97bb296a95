package com.coparent.dto;

import com.coparent.entity.CalendarEvent;
import com.coparent.entity.ParentSlot;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CalendarEventRequest {
    @NotBlank
    @Size(max = 200)
    private String title;

    @Size(max = 1000)
    private String description;

    @NotNull
    private Instant startDate;

    @NotNull
    private Instant endDate;

    private CalendarEvent.EventType type;

    private ParentSlot parentId;

    @Size(max = 20)
    private String color;

    @Size(max = 200)
    private String location;

    /**
     * Minutes before the start to send a reminder; null or 0 means none.
     */
    @Min(0)
    @Max(40320)
    private Integer reminderMinutes;

    private Boolean isAllDay;

    private Long childId;
}
