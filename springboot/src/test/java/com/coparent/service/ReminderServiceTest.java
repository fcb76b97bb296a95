package com.coparent.service;

import com.coparent.config.CoparentProperties;
import com.coparent.entity.CalendarEvent;
import com.coparent.entity.EventReminder;
import com.coparent.entity.Task;
import com.coparent.entity.TaskReminder;
import com.coparent.repository.EventReminderRepository;
import com.coparent.repository.TaskReminderRepository;
import com.coparent.repository.TaskRepository;
import com.coparent.service.push.PushDeliveryException;
import com.coparent.service.push.PushNotificationService;
import com.coparent.service.push.PushResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReminderService")
class ReminderServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private EventReminderRepository eventReminderRepository;
    @Mock
    private TaskReminderRepository taskReminderRepository;
    @Mock
    private TaskRepository taskRepository;
    @Mock
    private PushNotificationService pushNotificationService;

    private final CoparentProperties properties = new CoparentProperties();
    private ReminderService service;

    @BeforeEach
    void setUp() {
        service = new ReminderService(eventReminderRepository, taskReminderRepository, taskRepository,
                pushNotificationService, properties, Clock.fixed(NOW, ZoneOffset.UTC), ZoneId.of("UTC"));
    }

    private static CalendarEvent event(Instant start, Integer reminderMinutes) {
        return CalendarEvent.builder()
                .id(5L)
                .familyId(1L)
                .title("Dentist")
                .startDate(start)
                .endDate(start.plus(Duration.ofHours(1)))
                .reminderMinutes(reminderMinutes)
                .targetUids(new ArrayList<>(List.of("alice", "bob")))
                .build();
    }

    @Nested
    @DisplayName("event reminders")
    class EventReminders {

        @Test
        @DisplayName("stores a reminder at start minus the lead time")
        void upsertsFutureReminder() {
            when(eventReminderRepository.findByEventId(5L)).thenReturn(Optional.empty());

            service.upsertEventReminder(event(NOW.plus(Duration.ofHours(2)), 30));

            ArgumentCaptor<EventReminder> captor = ArgumentCaptor.forClass(EventReminder.class);
            verify(eventReminderRepository).save(captor.capture());
            EventReminder saved = captor.getValue();
            assertThat(saved.getEventId()).isEqualTo(5L);
            assertThat(saved.getSendAt()).isEqualTo(NOW.plus(Duration.ofMinutes(90)));
            assertThat(saved.getSent()).isFalse();
            assertThat(saved.getTargetUids()).containsExactly("alice", "bob");
        }

        @Test
        @DisplayName("rescheduling resets a sent reminder")
        void resetsSentFlag() {
            EventReminder existing = EventReminder.builder().id(9L).eventId(5L).sent(true).sentAt(NOW).build();
            when(eventReminderRepository.findByEventId(5L)).thenReturn(Optional.of(existing));

            service.upsertEventReminder(event(NOW.plus(Duration.ofDays(1)), 60));

            assertThat(existing.getSent()).isFalse();
            assertThat(existing.getSentAt()).isNull();
            verify(eventReminderRepository).save(existing);
        }

        @Test
        @DisplayName("a send time already in the past removes the reminder")
        void pastSendTimeDeletes() {
            service.upsertEventReminder(event(NOW.plus(Duration.ofMinutes(10)), 30));

            verify(eventReminderRepository).deleteByEventId(5L);
            verify(eventReminderRepository, never()).save(any());
        }

        @Test
        @DisplayName("no lead time removes the reminder")
        void zeroMinutesDeletes() {
            service.upsertEventReminder(event(NOW.plus(Duration.ofDays(1)), 0));

            verify(eventReminderRepository).deleteByEventId(5L);
        }
    }

    @Nested
    @DisplayName("task reminders")
    class TaskReminders {

        @Test
        @DisplayName("completed tasks lose their reminder")
        void terminalTaskDeletes() {
            Task task = Task.builder()
                    .id(8L)
                    .title("Forms")
                    .dueDate(NOW.plus(Duration.ofDays(2)))
                    .reminderMinutes(60)
                    .status(Task.Status.COMPLETED)
                    .build();

            service.upsertTaskReminder(task, List.of("alice"));

            verify(taskReminderRepository).deleteByTaskId(8L);
            verify(taskReminderRepository, never()).save(any());
        }

        @Test
        @DisplayName("open tasks with a due date get a reminder for the resolved targets")
        void openTaskUpserts() {
            Task task = Task.builder()
                    .id(8L)
                    .familyId(1L)
                    .title("Forms")
                    .dueDate(NOW.plus(Duration.ofDays(2)))
                    .reminderMinutes(60)
                    .status(Task.Status.PENDING)
                    .build();
            when(taskReminderRepository.findByTaskId(8L)).thenReturn(Optional.empty());

            service.upsertTaskReminder(task, List.of("bob"));

            ArgumentCaptor<TaskReminder> captor = ArgumentCaptor.forClass(TaskReminder.class);
            verify(taskReminderRepository).save(captor.capture());
            assertThat(captor.getValue().getTargetUids()).containsExactly("bob");
            assertThat(captor.getValue().getSendAt()).isEqualTo(NOW.plus(Duration.ofDays(2)).minus(Duration.ofHours(1)));
        }
    }

    @Nested
    @DisplayName("dispatchDueReminders")
    class Dispatch {

        @Test
        @DisplayName("sends due event reminders and marks them sent")
        @SuppressWarnings("unchecked")
        void sendsEventReminders() {
            EventReminder due = EventReminder.builder()
                    .id(1L).eventId(5L).familyId(1L).title("Dentist")
                    .startDate(Instant.parse("2024-06-01T12:30:00Z"))
                    .sendAt(NOW.minusSeconds(5))
                    .targetUids(new ArrayList<>(List.of("alice")))
                    .build();
            when(eventReminderRepository.findBySentFalseAndSendAtLessThanEqualOrderBySendAtAsc(eq(NOW), any()))
                    .thenReturn(List.of(due));
            when(taskReminderRepository.findBySentFalseAndSendAtLessThanEqualOrderBySendAtAsc(eq(NOW), any()))
                    .thenReturn(List.of());
            when(pushNotificationService.deliver(anyCollection(), anyString(), anyString(), anyMap()))
                    .thenReturn(PushResult.empty());

            int sent = service.dispatchDueReminders();

            assertThat(sent).isEqualTo(1);
            assertThat(due.getSent()).isTrue();
            assertThat(due.getSentAt()).isEqualTo(NOW);

            ArgumentCaptor<Map<String, String>> data = ArgumentCaptor.forClass(Map.class);
            verify(pushNotificationService).deliver(eq(List.of("alice")), eq("Reminder: Dentist"),
                    eq("Saturday, June 1 at 12:30"), data.capture());
            assertThat(data.getValue()).containsEntry("type", ReminderService.EVENT_REMINDER_TYPE)
                    .containsEntry("eventId", "5");
        }

        @Test
        @DisplayName("a delivery failure leaves the reminder for the next sweep")
        void failureKeepsReminderUnsent() {
            EventReminder due = EventReminder.builder()
                    .id(1L).eventId(5L).familyId(1L).title("Dentist")
                    .startDate(NOW).sendAt(NOW).build();
            when(eventReminderRepository.findBySentFalseAndSendAtLessThanEqualOrderBySendAtAsc(eq(NOW), any()))
                    .thenReturn(List.of(due));
            when(taskReminderRepository.findBySentFalseAndSendAtLessThanEqualOrderBySendAtAsc(eq(NOW), any()))
                    .thenReturn(List.of());
            when(pushNotificationService.deliver(anyCollection(), anyString(), anyString(), anyMap()))
                    .thenThrow(new PushDeliveryException("gateway down"));

            int sent = service.dispatchDueReminders();

            assertThat(sent).isZero();
            assertThat(due.getSent()).isFalse();
            verify(eventReminderRepository, never()).save(any());
        }

        @Test
        @DisplayName("reminders of finished tasks are retired without a push")
        void finishedTaskRetired() {
            TaskReminder due = TaskReminder.builder()
                    .id(2L).taskId(8L).familyId(1L).title("Forms").sendAt(NOW).build();
            when(eventReminderRepository.findBySentFalseAndSendAtLessThanEqualOrderBySendAtAsc(eq(NOW), any()))
                    .thenReturn(List.of());
            when(taskReminderRepository.findBySentFalseAndSendAtLessThanEqualOrderBySendAtAsc(eq(NOW), any()))
                    .thenReturn(List.of(due));
            when(taskRepository.findById(8L))
                    .thenReturn(Optional.of(Task.builder().id(8L).status(Task.Status.CANCELLED).build()));

            int sent = service.dispatchDueReminders();

            assertThat(sent).isEqualTo(1);
            assertThat(due.getSent()).isTrue();
            verifyNoInteractions(pushNotificationService);
        }
    }

    @Test
    @DisplayName("cleanup removes sent reminders older than the retention")
    void cleanup() {
        Instant cutoff = NOW.minus(Duration.ofDays(7));
        when(eventReminderRepository.deleteBySentTrueAndSentAtBefore(cutoff)).thenReturn(3L);
        when(taskReminderRepository.deleteBySentTrueAndSentAtBefore(cutoff)).thenReturn(2L);

        assertThat(service.cleanupOldReminders()).isEqualTo(5L);
    }
}
