package com.coparent.service;

import com.coparent.dto.CustodyScheduleRequest;
import com.coparent.dto.CustodyScheduleResponse;
import com.coparent.entity.CalendarEvent;
import com.coparent.entity.CustodyApproval;
import com.coparent.entity.CustodySchedule;
import com.coparent.entity.Family;
import com.coparent.entity.User;
import com.coparent.exception.ForbiddenException;
import com.coparent.exception.InvalidStateException;
import com.coparent.exception.NotFoundException;
import com.coparent.repository.CalendarEventRepository;
import com.coparent.repository.CustodyScheduleRepository;
import com.coparent.service.push.PushNotificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CustodyScheduleService")
class CustodyScheduleServiceTest {

    private static final Long FAMILY_ID = 3L;
    private static final Instant NOW = Instant.parse("2024-05-01T08:30:00Z");
    private static final Instant START = Instant.parse("2024-05-06T00:00:00Z");

    @Mock
    private CustodyScheduleRepository custodyScheduleRepository;
    @Mock
    private CalendarEventRepository calendarEventRepository;
    @Mock
    private ReminderService reminderService;
    @Mock
    private FamilyAccessService familyAccessService;
    @Mock
    private FamilyEventPublisher eventPublisher;
    @Mock
    private PushNotificationService pushNotificationService;

    private CustodyScheduleService service;

    private final User alice = User.builder().id("alice").email("alice@example.com").fullName("Alice").build();
    private final User bob = User.builder().id("bob").email("bob@example.com").fullName("Bob").build();

    @BeforeEach
    void setUp() {
        service = new CustodyScheduleService(custodyScheduleRepository, calendarEventRepository, reminderService,
                familyAccessService, eventPublisher, pushNotificationService, Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(familyAccessService.requireMember(eq(FAMILY_ID), any(User.class)))
                .thenReturn(Family.builder().id(FAMILY_ID).build());
        lenient().when(custodyScheduleRepository.saveAndFlush(any(CustodySchedule.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static CustodyScheduleRequest weekly(List<Integer> parent1Days, boolean requestApproval) {
        return CustodyScheduleRequest.builder()
                .name("School year")
                .pattern(CustodySchedule.Pattern.WEEKLY)
                .startDate(START)
                .parent1Days(new ArrayList<>(parent1Days))
                .parent2Days(new ArrayList<>(List.of(5, 6)))
                .requestApproval(requestApproval)
                .build();
    }

    private CustodySchedule existing() {
        CustodySchedule schedule = CustodySchedule.builder()
                .id(1L)
                .familyId(FAMILY_ID)
                .name("Summer")
                .pattern(CustodySchedule.Pattern.BIWEEKLY)
                .startDate(Instant.parse("2024-01-01T00:00:00Z"))
                .parent1Days(new ArrayList<>(List.of(0, 1)))
                .parent2Days(new ArrayList<>(List.of(2, 3)))
                .isActive(true)
                .build();
        when(custodyScheduleRepository.findByFamilyId(FAMILY_ID)).thenReturn(Optional.of(schedule));
        return schedule;
    }

    private CustodySchedule withPendingFrom(String requesterId) {
        CustodySchedule schedule = existing();
        schedule.setPendingApproval(CustodyApproval.builder()
                .name("School year")
                .pattern(CustodySchedule.Pattern.WEEKLY)
                .startDate(START)
                .parent1Days(new ArrayList<>(List.of(1, 2, 3)))
                .parent2Days(new ArrayList<>(List.of(4, 5)))
                .requestedById(requesterId)
                .requestedByName(requesterId)
                .requestedAt(NOW)
                .build());
        return schedule;
    }

    @Nested
    @DisplayName("save")
    class Save {

        @Test
        @DisplayName("without approval the live schedule changes and becomes active")
        void directSave() {
            existing();

            CustodyScheduleResponse response = service.save(FAMILY_ID, alice, weekly(List.of(0, 1, 2), false));

            assertThat(response.getName()).isEqualTo("School year");
            assertThat(response.getParent1Days()).containsExactly(0, 1, 2);
            assertThat(response.getIsActive()).isTrue();
            assertThat(response.getPendingApproval()).isNull();
            verify(eventPublisher).publish(eq(FAMILY_ID), eq(FamilyEventPublisher.CUSTODY_UPDATED), any(), eq("alice"));
            verifyNoInteractions(pushNotificationService);
        }

        @Test
        @DisplayName("with approval the live schedule is untouched and a pending change is staged")
        void stagesPendingChange() {
            existing();

            CustodyScheduleResponse response = service.save(FAMILY_ID, alice, weekly(List.of(0, 1, 2), true));

            assertThat(response.getName()).isEqualTo("Summer");
            assertThat(response.getParent1Days()).containsExactly(0, 1);
            assertThat(response.getPendingApproval()).isNotNull();
            assertThat(response.getPendingApproval().getParent1Days()).containsExactly(0, 1, 2);
            assertThat(response.getPendingApproval().getRequestedById()).isEqualTo("alice");
            assertThat(response.getPendingApproval().getRequestedAt()).isEqualTo(NOW);
            verify(pushNotificationService).notifyFamilyExcept(eq(FAMILY_ID), eq("alice"), anyString(), anyString(),
                    anyMap());
        }

        @Test
        @DisplayName("a first schedule saved for approval is created inactive")
        void newScheduleInactive() {
            when(custodyScheduleRepository.findByFamilyId(FAMILY_ID)).thenReturn(Optional.empty());

            CustodyScheduleResponse response = service.save(FAMILY_ID, alice, weekly(List.of(0, 1), true));

            assertThat(response.getIsActive()).isFalse();
            assertThat(response.getPendingApproval()).isNotNull();
        }

        @Test
        @DisplayName("re-staging replaces the existing pending change")
        void restageReplaces() {
            CustodySchedule schedule = withPendingFrom("bob");
            CustodyApproval staged = schedule.getPendingApproval();

            service.save(FAMILY_ID, alice, weekly(List.of(6), true));

            assertThat(schedule.getPendingApproval()).isSameAs(staged);
            assertThat(staged.getRequestedById()).isEqualTo("alice");
            assertThat(staged.getParent1Days()).containsExactly(6);
        }
    }

    @Nested
    @DisplayName("respond")
    class Respond {

        @Test
        @DisplayName("approval copies the pending values onto the live schedule")
        void approve() {
            withPendingFrom("alice");

            CustodyScheduleResponse response = service.respond(FAMILY_ID, bob, true);

            assertThat(response.getName()).isEqualTo("School year");
            assertThat(response.getPattern()).isEqualTo(CustodySchedule.Pattern.WEEKLY);
            assertThat(response.getParent1Days()).containsExactly(1, 2, 3);
            assertThat(response.getParent2Days()).containsExactly(4, 5);
            assertThat(response.getIsActive()).isTrue();
            assertThat(response.getPendingApproval()).isNull();
            verify(pushNotificationService).notifyUsers(eq(List.of("alice")), anyString(), anyString(), anyMap());
        }

        @Test
        @DisplayName("rejection discards the pending change only")
        void reject() {
            withPendingFrom("alice");

            CustodyScheduleResponse response = service.respond(FAMILY_ID, bob, false);

            assertThat(response.getName()).isEqualTo("Summer");
            assertThat(response.getParent1Days()).containsExactly(0, 1);
            assertThat(response.getPendingApproval()).isNull();
        }

        @Test
        @DisplayName("the author cannot answer their own change")
        void authorCannotRespond() {
            withPendingFrom("alice");

            assertThatThrownBy(() -> service.respond(FAMILY_ID, alice, true))
                    .isInstanceOf(ForbiddenException.class)
                    .extracting("code").isEqualTo("requester-cannot-approve");
        }

        @Test
        @DisplayName("fails when nothing is pending")
        void nothingPending() {
            existing();

            assertThatThrownBy(() -> service.respond(FAMILY_ID, bob, true))
                    .isInstanceOf(InvalidStateException.class)
                    .extracting("code").isEqualTo("no-pending-approval");
        }
    }

    @Nested
    @DisplayName("cancel and delete")
    class CancelAndDelete {

        @Test
        @DisplayName("only the author may cancel a pending change")
        void cancel() {
            withPendingFrom("alice");

            assertThatThrownBy(() -> service.cancelPending(FAMILY_ID, bob))
                    .isInstanceOf(ForbiddenException.class)
                    .extracting("code").isEqualTo("only-requester-can-cancel");

            assertThat(service.cancelPending(FAMILY_ID, alice).getPendingApproval()).isNull();
        }

        @Test
        @DisplayName("deleting removes custody events and their reminders")
        void deleteRemovesCustodyEvents() {
            CustodySchedule schedule = existing();
            List<CalendarEvent> custodyEvents = List.of(
                    CalendarEvent.builder().id(11L).type(CalendarEvent.EventType.CUSTODY).build(),
                    CalendarEvent.builder().id(12L).type(CalendarEvent.EventType.CUSTODY).build());
            when(calendarEventRepository.findByFamilyIdAndTypeOrderByStartDateAsc(FAMILY_ID,
                    CalendarEvent.EventType.CUSTODY)).thenReturn(custodyEvents);

            service.delete(FAMILY_ID, alice);

            verify(reminderService).deleteEventReminder(11L);
            verify(reminderService).deleteEventReminder(12L);
            verify(calendarEventRepository).deleteAll(custodyEvents);
            verify(custodyScheduleRepository).delete(schedule);
            verify(eventPublisher).publish(eq(FAMILY_ID), eq(FamilyEventPublisher.CUSTODY_DELETED), any(), eq("alice"));
        }

        @Test
        @DisplayName("get without a schedule is not found")
        void getMissing() {
            when(custodyScheduleRepository.findByFamilyId(FAMILY_ID)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.get(FAMILY_ID, alice))
                    .isInstanceOf(NotFoundException.class)
                    .extracting("code").isEqualTo("custody-schedule-not-found");
        }
    }
}
