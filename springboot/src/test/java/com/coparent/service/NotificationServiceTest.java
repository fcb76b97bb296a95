package com.coparent.service;

import com.coparent.dto.CreateNotificationRequest;
import com.coparent.dto.NotificationListResponse;
import com.coparent.dto.NotificationPreferencesDto;
import com.coparent.dto.NotificationResponse;
import com.coparent.entity.Notification;
import com.coparent.entity.NotificationPreferences;
import com.coparent.entity.User;
import com.coparent.exception.ForbiddenException;
import com.coparent.exception.NotFoundException;
import com.coparent.repository.NotificationPreferencesRepository;
import com.coparent.repository.NotificationRepository;
import com.coparent.service.push.PushNotificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationService")
class NotificationServiceTest {

    // 23:15 in UTC
    private static final Instant NOW = Instant.parse("2024-02-02T23:15:00Z");

    @Mock
    private NotificationRepository notificationRepository;
    @Mock
    private NotificationPreferencesRepository preferencesRepository;
    @Mock
    private FamilyAccessService familyAccessService;
    @Mock
    private PushNotificationService pushNotificationService;

    private NotificationService service;

    private final User alice = User.builder().id("alice").email("alice@example.com").build();

    @BeforeEach
    void setUp() {
        service = new NotificationService(notificationRepository, preferencesRepository, familyAccessService,
                pushNotificationService, Clock.fixed(NOW, ZoneOffset.UTC), ZoneId.of("UTC"));
    }

    private static CreateNotificationRequest request(String userId, Notification.Type type) {
        return CreateNotificationRequest.builder()
                .userId(userId)
                .type(type)
                .title("Heads up")
                .body("Something happened")
                .build();
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("stores the notification and pushes with its id")
        @SuppressWarnings("unchecked")
        void storesAndPushes() {
            when(preferencesRepository.findById("alice")).thenReturn(Optional.empty());
            when(notificationRepository.save(any(Notification.class))).thenAnswer(invocation -> {
                Notification n = invocation.getArgument(0);
                n.setId(77L);
                return n;
            });

            Optional<NotificationResponse> created = service.create(alice,
                    request("alice", Notification.Type.TASK_ASSIGNED));

            assertThat(created).isPresent();
            assertThat(created.get().getRead()).isFalse();
            ArgumentCaptor<Map<String, String>> data = ArgumentCaptor.forClass(Map.class);
            verify(pushNotificationService).notifyUsers(eq(List.of("alice")), eq("Heads up"),
                    eq("Something happened"), data.capture());
            assertThat(data.getValue()).containsEntry("notificationId", "77").containsEntry("type", "task_assigned");
        }

        @Test
        @DisplayName("a muted category is skipped")
        void mutedCategory() {
            when(preferencesRepository.findById("alice")).thenReturn(Optional.of(
                    NotificationPreferences.builder().userId("alice").swapRequestNotifications(false).build()));

            assertThat(service.create(alice, request("alice", Notification.Type.SWAP_REQUEST_CREATED))).isEmpty();
            verify(notificationRepository, never()).save(any());
        }

        @Test
        @DisplayName("quiet hours wrapping midnight suppress the notification")
        void quietHours() {
            when(preferencesRepository.findById("alice")).thenReturn(Optional.of(
                    NotificationPreferences.builder().userId("alice")
                            .quietHoursEnabled(true).quietHoursStart("22:00").quietHoursEnd("07:00").build()));

            assertThat(service.create(alice, request("alice", Notification.Type.SYSTEM_ANNOUNCEMENT))).isEmpty();
        }

        @Test
        @DisplayName("push can be turned off while the record is still stored")
        void pushDisabled() {
            when(preferencesRepository.findById("alice")).thenReturn(Optional.of(
                    NotificationPreferences.builder().userId("alice").pushNotifications(false).build()));
            when(notificationRepository.save(any(Notification.class))).thenAnswer(invocation -> invocation.getArgument(0));

            assertThat(service.create(alice, request("alice", Notification.Type.CHAT_MESSAGE))).isPresent();
            verifyNoInteractions(pushNotificationService);
        }

        @Test
        @DisplayName("other users can only be addressed through a shared family")
        void otherUserNeedsFamily() {
            assertThatThrownBy(() -> service.create(alice, request("bob", Notification.Type.TASK_ASSIGNED)))
                    .isInstanceOf(ForbiddenException.class);
        }
    }

    @ParameterizedTest(name = "{0}-{1} at {2} -> {3}")
    @CsvSource({
            "22:00, 07:00, 23:15, true",
            "22:00, 07:00, 06:59, true",
            "22:00, 07:00, 07:00, false",
            "22:00, 07:00, 12:00, false",
            "13:00, 15:00, 13:00, true",
            "13:00, 15:00, 15:00, false"
    })
    @DisplayName("quiet hour windows")
    void quietHourWindows(String start, String end, String now, boolean expected) {
        NotificationPreferences preferences = NotificationPreferences.builder()
                .quietHoursStart(start).quietHoursEnd(end).build();

        assertThat(NotificationService.inQuietHours(preferences, LocalTime.parse(now))).isEqualTo(expected);
    }

    @Test
    @DisplayName("list reports total and unread alongside the page")
    void list() {
        Notification n = Notification.builder().id(1L).userId("alice").type(Notification.Type.TASK_ASSIGNED)
                .title("t").body("b").build();
        when(notificationRepository.search(eq("alice"), isNull(), eq(false), any(Pageable.class)))
                .thenReturn(List.of(n));
        when(notificationRepository.count("alice", null, false)).thenReturn(12L);
        when(notificationRepository.count("alice", null, true)).thenReturn(3L);

        NotificationListResponse response = service.list(alice, null, false, null, 10);

        assertThat(response.getNotifications()).hasSize(1);
        assertThat(response.getTotal()).isEqualTo(12L);
        assertThat(response.getUnread()).isEqualTo(3L);

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(notificationRepository).search(eq("alice"), isNull(), eq(false), page.capture());
        assertThat(page.getValue().getOffset()).isEqualTo(10L);
        assertThat(page.getValue().getPageSize()).isEqualTo(NotificationService.DEFAULT_LIMIT);
    }

    @Test
    @DisplayName("deleting someone else's notification is not found")
    void deleteForeign() {
        when(notificationRepository.findByIdAndUserId(5L, "alice")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.delete(alice, 5L))
                .isInstanceOf(NotFoundException.class)
                .extracting("code").isEqualTo("notification-not-found");
    }

    @Test
    @DisplayName("preference updates only touch provided fields")
    void partialPreferenceUpdate() {
        when(preferencesRepository.findById("alice")).thenReturn(Optional.empty());
        when(preferencesRepository.save(any(NotificationPreferences.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        NotificationPreferencesDto updated = service.updatePreferences(alice,
                NotificationPreferencesDto.builder().taskNotifications(false).quietHoursStart("21:30").build());

        assertThat(updated.getTaskNotifications()).isFalse();
        assertThat(updated.getQuietHoursStart()).isEqualTo("21:30");
        assertThat(updated.getPushNotifications()).isTrue();
        assertThat(updated.getQuietHoursEnabled()).isFalse();
    }
}
