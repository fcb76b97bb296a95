package com.coparent.dto;

import com.coparent.entity.CalendarEvent;
import com.coparent.entity.ParentSlot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CalendarEventResponse {
    private Long id;
    private Long familyId;
    private String title;
    private String description;
    private Instant startDate;
    private Instant endDate;
    private CalendarEvent.EventType type;
    private ParentSlot parentId;
    private List<String> targetUids;
    private String color;
    private String location;
    private Integer reminderMinutes;
    private Boolean isAllDay;
    private Long childId;
    private Long swapRequestId;
    private String createdById;
    private String createdByName;
    private Instant createdAt;
    private Instant updatedAt;

    public static CalendarEventResponse from(CalendarEvent event) {
        return CalendarEventResponse.builder()
                .id(event.getId())
                .familyId(event.getFamilyId())
                .title(event.getTitle())
                .description(event.getDescription())
                .startDate(event.getStartDate())
                .endDate(event.getEndDate())
                .type(event.getType())
                .parentId(event.getParentId())
                .targetUids(new ArrayList<>(event.getTargetUids()))
                .color(event.getColor())
                .location(event.getLocation())
                .reminderMinutes(event.getReminderMinutes())
                .isAllDay(event.getIsAllDay())
                .childId(event.getChildId())
                .swapRequestId(event.getSwapRequestId())
                .createdById(event.getCreatedById())
                .createdByName(event.getCreatedByName())
                .createdAt(event.getCreatedAt())
                .updatedAt(event.getUpdatedAt())
                .build();
    }
}
