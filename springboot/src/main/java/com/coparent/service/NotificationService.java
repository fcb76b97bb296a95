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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-app notification inbox and the per-user preferences that gate it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 200;

    private final NotificationRepository notificationRepository;
    private final NotificationPreferencesRepository preferencesRepository;
    private final FamilyAccessService familyAccessService;
    private final PushNotificationService pushNotificationService;
    private final Clock clock;
    private final ZoneId familyZone;

    @Transactional(readOnly = true)
    public NotificationListResponse list(User actor, Long familyId, boolean unreadOnly, Integer limit, Integer offset) {
        int size = limit == null || limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        int skip = offset == null || offset < 0 ? 0 : offset;

        List<NotificationResponse> page = notificationRepository
                .search(actor.getId(), familyId, unreadOnly, OffsetPage.of(skip, size)).stream()
                .map(NotificationResponse::from)
                .collect(Collectors.toList());
        long total = notificationRepository.count(actor.getId(), familyId, unreadOnly);
        long unread = unreadOnly ? total : notificationRepository.count(actor.getId(), familyId, true);

        return NotificationListResponse.builder()
                .notifications(page)
                .total(total)
                .unread(unread)
                .build();
    }

    @Transactional(readOnly = true)
    public long unreadCount(User actor, Long familyId) {
        return notificationRepository.count(actor.getId(), familyId, true);
    }

    @Transactional
    public int markRead(User actor, Collection<Long> notificationIds) {
        int updated = notificationRepository.markRead(actor.getId(), notificationIds);
        log.debug("Marked {} notifications read for {}", updated, actor.getId());
        return updated;
    }

    @Transactional
    public int markAllRead(User actor, Long familyId) {
        return notificationRepository.markAllRead(actor.getId(), familyId);
    }

    @Transactional
    public void delete(User actor, Long notificationId) {
        Notification notification = notificationRepository.findByIdAndUserId(notificationId, actor.getId())
                .orElseThrow(() -> new NotFoundException("notification-not-found", "Notification not found"));
        notificationRepository.delete(notification);
    }

    @Transactional
    public int deleteAll(User actor, Long familyId) {
        List<Notification> notifications = notificationRepository.findAllForUser(actor.getId(), familyId);
        notificationRepository.deleteAll(notifications);
        return notifications.size();
    }

    /**
     * Stores a notification for the addressed user unless their preferences mute
     * its category or the current time falls in their quiet hours.
     *
     * @return the stored notification, or empty when it was suppressed
     */
    @Transactional
    public Optional<NotificationResponse> create(User actor, CreateNotificationRequest request) {
        checkAddressable(actor, request.getUserId(), request.getFamilyId());

        NotificationPreferences preferences = preferencesRepository.findById(request.getUserId())
                .orElseGet(() -> defaults(request.getUserId()));
        if (!categoryEnabled(request.getType(), preferences)) {
            log.info("Skipping {} notification for {}: disabled in preferences", request.getType(), request.getUserId());
            return Optional.empty();
        }
        if (Boolean.TRUE.equals(preferences.getQuietHoursEnabled())
                && inQuietHours(preferences, LocalTime.now(clock.withZone(familyZone)))) {
            log.info("Skipping {} notification for {}: quiet hours", request.getType(), request.getUserId());
            return Optional.empty();
        }

        Notification notification = notificationRepository.save(Notification.builder()
                .userId(request.getUserId())
                .familyId(request.getFamilyId())
                .type(request.getType())
                .title(request.getTitle())
                .body(request.getBody())
                .priority(request.getPriority() != null ? request.getPriority() : Notification.Priority.NORMAL)
                .data(request.getData() != null ? new HashMap<>(request.getData()) : new HashMap<>())
                .actionUrl(request.getActionUrl())
                .build());

        if (request.isSendPush() && !Boolean.FALSE.equals(preferences.getPushNotifications())) {
            Map<String, String> data = new HashMap<>(notification.getData());
            data.put("notificationId", String.valueOf(notification.getId()));
            data.put("type", notification.getType().getValue());
            if (notification.getActionUrl() != null) {
                data.put("actionUrl", notification.getActionUrl());
            }
            pushNotificationService.notifyUsers(List.of(notification.getUserId()),
                    notification.getTitle(), notification.getBody(), data);
        }
        return Optional.of(NotificationResponse.from(notification));
    }

    @Transactional(readOnly = true)
    public NotificationPreferencesDto getPreferences(User actor) {
        return NotificationPreferencesDto.from(preferencesRepository.findById(actor.getId())
                .orElseGet(() -> defaults(actor.getId())));
    }

    @Transactional
    public NotificationPreferencesDto updatePreferences(User actor, NotificationPreferencesDto update) {
        NotificationPreferences preferences = preferencesRepository.findById(actor.getId())
                .orElseGet(() -> defaults(actor.getId()));

        if (update.getExpenseNotifications() != null) {
            preferences.setExpenseNotifications(update.getExpenseNotifications());
        }
        if (update.getSwapRequestNotifications() != null) {
            preferences.setSwapRequestNotifications(update.getSwapRequestNotifications());
        }
        if (update.getTaskNotifications() != null) {
            preferences.setTaskNotifications(update.getTaskNotifications());
        }
        if (update.getCalendarNotifications() != null) {
            preferences.setCalendarNotifications(update.getCalendarNotifications());
        }
        if (update.getChatNotifications() != null) {
            preferences.setChatNotifications(update.getChatNotifications());
        }
        if (update.getEmailNotifications() != null) {
            preferences.setEmailNotifications(update.getEmailNotifications());
        }
        if (update.getPushNotifications() != null) {
            preferences.setPushNotifications(update.getPushNotifications());
        }
        if (update.getQuietHoursEnabled() != null) {
            preferences.setQuietHoursEnabled(update.getQuietHoursEnabled());
        }
        if (update.getQuietHoursStart() != null) {
            preferences.setQuietHoursStart(update.getQuietHoursStart());
        }
        if (update.getQuietHoursEnd() != null) {
            preferences.setQuietHoursEnd(update.getQuietHoursEnd());
        }
        return NotificationPreferencesDto.from(preferencesRepository.save(preferences));
    }

    // Self, or a fellow member of the given family.
    private void checkAddressable(User actor, String userId, Long familyId) {
        if (actor.getId().equals(userId)) {
            if (familyId != null) {
                familyAccessService.requireMember(familyId, actor);
            }
            return;
        }
        if (familyId == null) {
            throw new ForbiddenException("forbidden", "Notifications for other users need a family");
        }
        familyAccessService.requireMember(familyId, actor);
        if (!familyAccessService.isMember(familyId, userId)) {
            throw new ForbiddenException("not-family-member", "Recipient is not a member of this family");
        }
    }

    static boolean categoryEnabled(Notification.Type type, NotificationPreferences preferences) {
        switch (type) {
            case EXPENSE_CREATED:
            case EXPENSE_APPROVED:
            case EXPENSE_REJECTED:
            case EXPENSE_PAID:
                return !Boolean.FALSE.equals(preferences.getExpenseNotifications());
            case SWAP_REQUEST_CREATED:
            case SWAP_REQUEST_APPROVED:
            case SWAP_REQUEST_REJECTED:
                return !Boolean.FALSE.equals(preferences.getSwapRequestNotifications());
            case TASK_ASSIGNED:
            case TASK_COMPLETED:
                return !Boolean.FALSE.equals(preferences.getTaskNotifications());
            case CALENDAR_EVENT_CREATED:
            case CALENDAR_EVENT_UPDATED:
            case CALENDAR_EVENT_REMINDER:
                return !Boolean.FALSE.equals(preferences.getCalendarNotifications());
            case CHAT_MESSAGE:
                return !Boolean.FALSE.equals(preferences.getChatNotifications());
            default:
                return true;
        }
    }

    /**
     * Start inclusive, end exclusive. A start after the end wraps past midnight.
     */
    static boolean inQuietHours(NotificationPreferences preferences, LocalTime now) {
        if (preferences.getQuietHoursStart() == null || preferences.getQuietHoursEnd() == null) {
            return false;
        }
        LocalTime start = LocalTime.parse(preferences.getQuietHoursStart());
        LocalTime end = LocalTime.parse(preferences.getQuietHoursEnd());
        if (!start.isAfter(end)) {
            return !now.isBefore(start) && now.isBefore(end);
        }
        return !now.isBefore(start) || now.isBefore(end);
    }

    private static NotificationPreferences defaults(String userId) {
        return NotificationPreferences.builder().userId(userId).build();
    }

    /**
     * Offset based paging; Spring's {@link PageRequest} only supports page-aligned offsets.
     */
    static final class OffsetPage extends PageRequest {

        private final long offset;

        private OffsetPage(long offset, int size) {
            super(0, size, Sort.unsorted());
            this.offset = offset;
        }

        static Pageable of(long offset, int size) {
            return new OffsetPage(offset, size);
        }

        @Override
        public long getOffset() {
            return offset;
        }
    }
}
