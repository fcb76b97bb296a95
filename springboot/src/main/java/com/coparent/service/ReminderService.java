package com.coparent.service;

import com.coparent.config.CoparentProperties;
import com.coparent.entity.CalendarEvent;
import com.coparent.entity.EventReminder;
import com.coparent.entity.Task;
import com.coparent.entity.TaskReminder;
import com.coparent.repository.EventReminderRepository;
import com.coparent.repository.TaskReminderRepository;
import com.coparent.repository.TaskRepository;
import com.coparent.service.push.PushNotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps one reminder row per calendar event and task, and dispatches the ones
 * that have come due.
 * <p>
 * A reminder is only stored while its send time is in the future. A delivery
 * failure leaves the reminder unsent so the next sweep retries it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReminderService {

    public static final String EVENT_REMINDER_TYPE = "calendar-event-reminder";
    public static final String TASK_REMINDER_TYPE = "task-reminder";

    private static final DateTimeFormatter DAY_FORMAT =
            DateTimeFormatter.ofPattern("EEEE, MMMM d", Locale.ENGLISH);
    private static final DateTimeFormatter DAY_TIME_FORMAT =
            DateTimeFormatter.ofPattern("EEEE, MMMM d 'at' HH:mm", Locale.ENGLISH);

    private final EventReminderRepository eventReminderRepository;
    private final TaskReminderRepository taskReminderRepository;
    private final TaskRepository taskRepository;
    private final PushNotificationService pushNotificationService;
    private final CoparentProperties properties;
    private final Clock clock;
    private final ZoneId familyZone;

    @Transactional
    public void upsertEventReminder(CalendarEvent event) {
        Optional<Instant> sendAt = sendTime(event.getStartDate(), event.getReminderMinutes());
        if (sendAt.isEmpty()) {
            deleteEventReminder(event.getId());
            return;
        }

        EventReminder reminder = eventReminderRepository.findByEventId(event.getId())
                .orElseGet(() -> EventReminder.builder().eventId(event.getId()).build());
        reminder.setFamilyId(event.getFamilyId());
        reminder.setTitle(event.getTitle());
        reminder.setStartDate(event.getStartDate());
        reminder.setIsAllDay(Boolean.TRUE.equals(event.getIsAllDay()));
        reminder.setSendAt(sendAt.get());
        reminder.setSent(false);
        reminder.setSentAt(null);
        reminder.setTargetUids(new ArrayList<>(event.getTargetUids()));
        eventReminderRepository.save(reminder);
        log.debug("Event {} reminder scheduled for {}", event.getId(), sendAt.get());
    }

    @Transactional
    public void deleteEventReminder(Long eventId) {
        eventReminderRepository.deleteByEventId(eventId);
    }

    @Transactional
    public void upsertTaskReminder(Task task, List<String> targetUids) {
        Optional<Instant> sendAt = task.getStatus().isTerminal()
                ? Optional.empty()
                : sendTime(task.getDueDate(), task.getReminderMinutes());
        if (sendAt.isEmpty()) {
            deleteTaskReminder(task.getId());
            return;
        }

        TaskReminder reminder = taskReminderRepository.findByTaskId(task.getId())
                .orElseGet(() -> TaskReminder.builder().taskId(task.getId()).build());
        reminder.setFamilyId(task.getFamilyId());
        reminder.setTitle(task.getTitle());
        reminder.setDueDate(task.getDueDate());
        reminder.setSendAt(sendAt.get());
        reminder.setSent(false);
        reminder.setSentAt(null);
        reminder.setTargetUids(new ArrayList<>(targetUids));
        taskReminderRepository.save(reminder);
        log.debug("Task {} reminder scheduled for {}", task.getId(), sendAt.get());
    }

    @Transactional
    public void deleteTaskReminder(Long taskId) {
        taskReminderRepository.deleteByTaskId(taskId);
    }

    /**
     * Sends every due, unsent reminder (up to one batch of each kind).
     *
     * @return number of reminders marked sent
     */
    public int dispatchDueReminders() {
        Instant now = Instant.now(clock);
        log.debug("Checking for due reminders at {}", now);
        return dispatchEventReminders(now) + dispatchTaskReminders(now);
    }

    /**
     * Deletes sent reminders older than the configured retention.
     *
     * @return number of rows removed
     */
    @Transactional
    public long cleanupOldReminders() {
        Instant cutoff = Instant.now(clock).minus(properties.getReminders().getRetention());
        long events = eventReminderRepository.deleteBySentTrueAndSentAtBefore(cutoff);
        long tasks = taskReminderRepository.deleteBySentTrueAndSentAtBefore(cutoff);
        if (events + tasks > 0) {
            log.info("Cleaned up {} old reminders ({} events, {} tasks)", events + tasks, events, tasks);
        }
        return events + tasks;
    }

    private int dispatchEventReminders(Instant now) {
        List<EventReminder> due = eventReminderRepository.findBySentFalseAndSendAtLessThanEqualOrderBySendAtAsc(
                now, PageRequest.of(0, properties.getReminders().getBatchSize()));
        if (due.isEmpty()) {
            return 0;
        }
        log.info("Found {} due event reminders", due.size());

        int sent = 0;
        for (EventReminder reminder : due) {
            try {
                pushNotificationService.deliver(reminder.getTargetUids(),
                        "Reminder: " + reminder.getTitle(),
                        formatStart(reminder.getStartDate(), Boolean.TRUE.equals(reminder.getIsAllDay())),
                        Map.of("type", EVENT_REMINDER_TYPE,
                                "familyId", String.valueOf(reminder.getFamilyId()),
                                "eventId", String.valueOf(reminder.getEventId())));
                markSent(reminder);
                sent++;
                log.info("Sent event reminder for event {}", reminder.getEventId());
            } catch (Exception e) {
                log.error("Failed to send event reminder {}", reminder.getId(), e);
            }
        }
        return sent;
    }

    private int dispatchTaskReminders(Instant now) {
        List<TaskReminder> due = taskReminderRepository.findBySentFalseAndSendAtLessThanEqualOrderBySendAtAsc(
                now, PageRequest.of(0, properties.getReminders().getBatchSize()));
        if (due.isEmpty()) {
            return 0;
        }
        log.info("Found {} due task reminders", due.size());

        int sent = 0;
        for (TaskReminder reminder : due) {
            try {
                Optional<Task> task = taskRepository.findById(reminder.getTaskId());
                if (task.isPresent() && task.get().getStatus().isTerminal()) {
                    // finished tasks are retired without a push
                    markSent(reminder);
                    sent++;
                    continue;
                }

                pushNotificationService.deliver(reminder.getTargetUids(),
                        "Task reminder: " + reminder.getTitle(),
                        reminder.getDueDate() != null ? formatStart(reminder.getDueDate(), true) : "No due date",
                        Map.of("type", TASK_REMINDER_TYPE,
                                "familyId", String.valueOf(reminder.getFamilyId()),
                                "taskId", String.valueOf(reminder.getTaskId())));
                markSent(reminder);
                sent++;
                log.info("Sent task reminder for task {}", reminder.getTaskId());
            } catch (Exception e) {
                log.error("Failed to send task reminder {}", reminder.getId(), e);
            }
        }
        return sent;
    }

    private void markSent(EventReminder reminder) {
        reminder.setSent(true);
        reminder.setSentAt(Instant.now(clock));
        eventReminderRepository.save(reminder);
    }

    private void markSent(TaskReminder reminder) {
        reminder.setSent(true);
        reminder.setSentAt(Instant.now(clock));
        taskReminderRepository.save(reminder);
    }

    private Optional<Instant> sendTime(Instant anchor, Integer minutes) {
        if (anchor == null || minutes == null || minutes <= 0) {
            return Optional.empty();
        }
        Instant sendAt = anchor.minus(Duration.ofMinutes(minutes));
        if (!sendAt.isAfter(Instant.now(clock))) {
            return Optional.empty();
        }
        return Optional.of(sendAt);
    }

    private String formatStart(Instant start, boolean allDay) {
        return (allDay ? DAY_FORMAT : DAY_TIME_FORMAT).format(start.atZone(familyZone));
    }
}
