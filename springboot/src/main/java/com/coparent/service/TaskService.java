package com.coparent.service;

import com.coparent.dto.TaskRequest;
import com.coparent.dto.TaskResponse;
import com.coparent.dto.TaskStatsResponse;
import com.coparent.entity.ParentSlot;
import com.coparent.entity.Task;
import com.coparent.entity.User;
import com.coparent.exception.NotFoundException;
import com.coparent.exception.ValidationException;
import com.coparent.repository.FamilyChildRepository;
import com.coparent.repository.TaskRepository;
import com.coparent.service.push.PushNotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class TaskService {

    /**
     * Due date ascending (undated last), then most urgent first, then newest first.
     */
    static final Comparator<Task> LIST_ORDER = Comparator
            .comparing(Task::getDueDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Task::getPriority, Comparator.reverseOrder())
            .thenComparing(Task::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final TaskRepository taskRepository;
    private final FamilyChildRepository familyChildRepository;
    private final FamilyAccessService familyAccessService;
    private final ReminderService reminderService;
    private final FamilyEventPublisher eventPublisher;
    private final PushNotificationService pushNotificationService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<TaskResponse> list(Long familyId, User actor, Task.Status status, ParentSlot assignedTo,
                                   Task.Category category) {
        familyAccessService.requireMember(familyId, actor);
        return taskRepository.search(familyId, status, assignedTo, category).stream()
                .sorted(LIST_ORDER)
                .map(TaskResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public TaskResponse get(Long familyId, User actor, Long taskId) {
        familyAccessService.requireMember(familyId, actor);
        return TaskResponse.from(load(familyId, taskId));
    }

    @Transactional(readOnly = true)
    public TaskStatsResponse stats(Long familyId, User actor) {
        familyAccessService.requireMember(familyId, actor);
        return TaskStatsResponse.builder()
                .total(taskRepository.countByFamilyId(familyId))
                .pending(taskRepository.countByFamilyIdAndStatus(familyId, Task.Status.PENDING))
                .inProgress(taskRepository.countByFamilyIdAndStatus(familyId, Task.Status.IN_PROGRESS))
                .completed(taskRepository.countByFamilyIdAndStatus(familyId, Task.Status.COMPLETED))
                .overdue(taskRepository.countByFamilyIdAndStatusInAndDueDateBefore(familyId,
                        EnumSet.of(Task.Status.PENDING, Task.Status.IN_PROGRESS), Instant.now(clock)))
                .build();
    }

    @Transactional
    public TaskResponse create(Long familyId, User actor, TaskRequest request) {
        familyAccessService.requireMember(familyId, actor);
        validateChild(familyId, request.getChildId());

        Task task = Task.builder()
                .familyId(familyId)
                .createdById(actor.getId())
                .createdByName(actor.getDisplayName())
                .build();
        apply(task, request);
        setStatus(task, request.getStatus() != null ? request.getStatus() : Task.Status.PENDING, actor);
        task = taskRepository.save(task);
        syncReminder(task);
        log.info("Task {} created in family {} by {}", task.getId(), familyId, actor.getId());

        TaskResponse response = TaskResponse.from(task);
        eventPublisher.publish(familyId, FamilyEventPublisher.TASK_CREATED, response, actor.getId());
        pushNotificationService.notifyFamilyExcept(familyId, actor.getId(),
                "New task",
                actor.getDisplayName() + " added: " + task.getTitle(),
                Map.of("type", "task-created",
                        "familyId", String.valueOf(familyId),
                        "taskId", String.valueOf(task.getId())));
        return response;
    }

    /**
     * Replaces every editable field. A missing status keeps the current one.
     */
    @Transactional
    public TaskResponse update(Long familyId, User actor, Long taskId, TaskRequest request) {
        familyAccessService.requireMember(familyId, actor);
        Task task = load(familyId, taskId);
        validateChild(familyId, request.getChildId());

        apply(task, request);
        if (request.getStatus() != null && request.getStatus() != task.getStatus()) {
            setStatus(task, request.getStatus(), actor);
        }
        task = taskRepository.save(task);
        syncReminder(task);
        log.info("Task {} updated in family {} by {}", taskId, familyId, actor.getId());

        TaskResponse response = TaskResponse.from(task);
        eventPublisher.publish(familyId, FamilyEventPublisher.TASK_UPDATED, response, actor.getId());
        return response;
    }

    @Transactional
    public TaskResponse updateStatus(Long familyId, User actor, Long taskId, Task.Status status) {
        familyAccessService.requireMember(familyId, actor);
        Task task = load(familyId, taskId);

        setStatus(task, status, actor);
        task = taskRepository.save(task);
        syncReminder(task);
        log.info("Task {} -> {} by {}", taskId, status, actor.getId());

        TaskResponse response = TaskResponse.from(task);
        eventPublisher.publish(familyId, FamilyEventPublisher.TASK_UPDATED, response, actor.getId());
        return response;
    }

    @Transactional
    public void delete(Long familyId, User actor, Long taskId) {
        familyAccessService.requireMember(familyId, actor);
        Task task = load(familyId, taskId);

        reminderService.deleteTaskReminder(taskId);
        taskRepository.delete(task);
        log.info("Task {} deleted from family {} by {}", taskId, familyId, actor.getId());

        eventPublisher.publish(familyId, FamilyEventPublisher.TASK_DELETED, Map.of("id", taskId), actor.getId());
    }

    private void syncReminder(Task task) {
        reminderService.upsertTaskReminder(task,
                familyAccessService.resolveTargetUids(task.getFamilyId(), task.getAssignedTo()));
    }

    private void setStatus(Task task, Task.Status status, User actor) {
        task.setStatus(status);
        if (status == Task.Status.COMPLETED) {
            task.setCompletedAt(Instant.now(clock));
            task.setCompletedById(actor.getId());
        } else {
            task.setCompletedAt(null);
            task.setCompletedById(null);
        }
    }

    private static void apply(Task task, TaskRequest request) {
        task.setTitle(request.getTitle().trim());
        task.setDescription(request.getDescription());
        task.setDueDate(request.getDueDate());
        task.setPriority(request.getPriority() != null ? request.getPriority() : Task.Priority.MEDIUM);
        task.setAssignedTo(request.getAssignedTo() != null ? request.getAssignedTo() : ParentSlot.BOTH);
        task.setCategory(request.getCategory() != null ? request.getCategory() : Task.Category.OTHER);
        task.setChildId(request.getChildId());
        task.setReminderMinutes(request.getReminderMinutes());
    }

    private void validateChild(Long familyId, Long childId) {
        if (childId != null && !familyChildRepository.existsByIdAndFamilyId(childId, familyId)) {
            throw new ValidationException("child-not-found", "Child not found");
        }
    }

    private Task load(Long familyId, Long taskId) {
        return taskRepository.findByIdAndFamilyId(taskId, familyId)
                .orElseThrow(() -> new NotFoundException("task-not-found", "Task not found"));
    }
}
