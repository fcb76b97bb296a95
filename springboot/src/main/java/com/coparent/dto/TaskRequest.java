package com.coparent.dto;

import com.coparent.entity.ParentSlot;
import com.coparent.entity.Task;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Body of task create and replace calls. A replace without {@code dueDate}
 * removes the due date and any pending reminder.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TaskRequest {
    @NotBlank
    @Size(max = 200)
    private String title;

    @Size(max = 1000)
    private String description;

    private Instant dueDate;

    private Task.Priority priority;

    private Task.Status status;

    private ParentSlot assignedTo;

    private Task.Category category;

    private Long childId;

    @Min(0)
    @Max(40320)
    private Integer reminderMinutes;
}
