package com.coparent.dto;

import com.coparent.entity.ParentSlot;
import com.coparent.entity.Task;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TaskResponse {
    private Long id;
    private Long familyId;
    private String title;
    private String description;
    private Instant dueDate;
    private Task.Priority priority;
    private Task.Status status;
    private ParentSlot assignedTo;
    private Task.Category category;
    private Long childId;
    private Integer reminderMinutes;
    private Instant completedAt;
    private String completedById;
    private String createdById;
    private String createdByName;
    private Instant createdAt;
    private Instant updatedAt;

    public static TaskResponse from(Task task) {
        return TaskResponse.builder()
                .id(task.getId())
                .familyId(task.getFamilyId())
                .title(task.getTitle())
                .description(task.getDescription())
                .dueDate(task.getDueDate())
                .priority(task.getPriority())
                .status(task.getStatus())
                .assignedTo(task.getAssignedTo())
                .category(task.getCategory())
                .childId(task.getChildId())
                .reminderMinutes(task.getReminderMinutes())
                .completedAt(task.getCompletedAt())
                .completedById(task.getCompletedById())
                .createdById(task.getCreatedById())
                .createdByName(task.getCreatedByName())
                .createdAt(task.getCreatedAt())
                .updatedAt(task.getUpdatedAt())
                .build();
    }
}
