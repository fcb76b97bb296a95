package com.coparent.service;

import com.coparent.dto.CalendarEventRequest;
import com.coparent.dto.CalendarEventResponse;
import com.coparent.entity.CalendarEvent;
import com.coparent.entity.ParentSlot;
import com.coparent.entity.User;
import com.coparent.exception.NotFoundException;
import com.coparent.exception.ValidationException;
import com.coparent.repository.CalendarEventRepository;
import com.coparent.repository.FamilyChildRepository;
import com.coparent.service.push.PushNotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class CalendarService {

    private static final Instant FAR_FUTURE = Instant.parse("9999-12-31T23:59:59Z");
    private static final DateTimeFormatter PUSH_DATE =
            DateTimeFormatter.ofPattern("EEE, MMM d", Locale.ENGLISH);

    private final CalendarEventRepository calendarEventRepository;
    private final FamilyChildRepository familyChildRepository;
    private final FamilyAccessService familyAccessService;
    private final ReminderService reminderService;
    private final FamilyEventPublisher eventPublisher;
    private final PushNotificationService pushNotificationService;
    private final ZoneId familyZone;

    /**
     * Events of the family, optionally limited to those overlapping [from, to] and to one type.
     */
    @Transactional(readOnly = true)
    public List<CalendarEventResponse> list(Long familyId, User actor, Instant from, Instant to,
                                            CalendarEvent.EventType type) {
        familyAccessService.requireMember(familyId, actor);

        List<CalendarEvent> events;
        if (from == null && to == null) {
            events = type == null
                    ? calendarEventRepository.findByFamilyIdOrderByStartDateAsc(familyId)
                    : calendarEventRepository.findByFamilyIdAndTypeOrderByStartDateAsc(familyId, type);
        } else {
            Instant lower = from != null ? from : Instant.EPOCH;
            Instant upper = to != null ? to : FAR_FUTURE;
            if (upper.isBefore(lower)) {
                throw new ValidationException("invalid-date-range", "'to' must not be before 'from'");
            }
            events = calendarEventRepository.findOverlapping(familyId, lower, upper, type);
        }
        return events.stream().map(CalendarEventResponse::from).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public CalendarEventResponse get(Long familyId, User actor, Long eventId) {
        familyAccessService.requireMember(familyId, actor);
        return CalendarEventResponse.from(load(familyId, eventId));
    }

    @Transactional
    public CalendarEventResponse create(Long familyId, User actor, CalendarEventRequest request) {
        familyAccessService.requireMember(familyId, actor);
        validate(familyId, request);

        CalendarEvent event = CalendarEvent.builder()
                .familyId(familyId)
                .createdById(actor.getId())
                .createdByName(actor.getDisplayName())
                .build();
        apply(event, request, familyId);
        event = calendarEventRepository.save(event);
        reminderService.upsertEventReminder(event);
        log.info("Event {} created in family {} by {}", event.getId(), familyId, actor.getId());

        CalendarEventResponse response = CalendarEventResponse.from(event);
        eventPublisher.publish(familyId, FamilyEventPublisher.EVENT_CREATED, response, actor.getId());
        pushNotificationService.notifyFamilyExcept(familyId, actor.getId(),
                "New family event",
                event.getTitle() + " on " + PUSH_DATE.format(event.getStartDate().atZone(familyZone)),
                Map.of("type", "event-created",
                        "familyId", String.valueOf(familyId),
                        "eventId", String.valueOf(event.getId())));
        return response;
    }

    /**
     * Replaces every editable field of the event and reschedules its reminder.
     */
    @Transactional
    public CalendarEventResponse update(Long familyId, User actor, Long eventId, CalendarEventRequest request) {
        familyAccessService.requireMember(familyId, actor);
        CalendarEvent event = load(familyId, eventId);
        validate(familyId, request);

        apply(event, request, familyId);
        event = calendarEventRepository.save(event);
        reminderService.upsertEventReminder(event);
        log.info("Event {} updated in family {} by {}", eventId, familyId, actor.getId());

        CalendarEventResponse response = CalendarEventResponse.from(event);
        eventPublisher.publish(familyId, FamilyEventPublisher.EVENT_UPDATED, response, actor.getId());
        return response;
    }

    @Transactional
    public void delete(Long familyId, User actor, Long eventId) {
        familyAccessService.requireMember(familyId, actor);
        CalendarEvent event = load(familyId, eventId);

        reminderService.deleteEventReminder(eventId);
        calendarEventRepository.delete(event);
        log.info("Event {} deleted from family {} by {}", eventId, familyId, actor.getId());

        eventPublisher.publish(familyId, FamilyEventPublisher.EVENT_DELETED, Map.of("id", eventId), actor.getId());
    }

    private void validate(Long familyId, CalendarEventRequest request) {
        if (request.getEndDate().isBefore(request.getStartDate())) {
            throw new ValidationException("invalid-date-range", "endDate must not be before startDate");
        }
        if (request.getChildId() != null && !familyChildRepository.existsByIdAndFamilyId(request.getChildId(), familyId)) {
            throw new ValidationException("child-not-found", "Child not found");
        }
    }

    private void apply(CalendarEvent event, CalendarEventRequest request, Long familyId) {
        ParentSlot slot = request.getParentId() != null ? request.getParentId() : ParentSlot.BOTH;
        event.setTitle(request.getTitle().trim());
        event.setDescription(request.getDescription());
        event.setStartDate(request.getStartDate());
        event.setEndDate(request.getEndDate());
        event.setType(request.getType() != null ? request.getType() : CalendarEvent.EventType.OTHER);
        event.setParentId(slot);
        event.setTargetUids(new ArrayList<>(familyAccessService.resolveTargetUids(familyId, slot)));
        event.setColor(request.getColor());
        event.setLocation(request.getLocation());
        event.setReminderMinutes(request.getReminderMinutes());
        event.setIsAllDay(Boolean.TRUE.equals(request.getIsAllDay()));
        event.setChildId(request.getChildId());
    }

    private CalendarEvent load(Long familyId, Long eventId) {
        return calendarEventRepository.findByIdAndFamilyId(eventId, familyId)
                .orElseThrow(() -> new NotFoundException("event-not-found", "Event not found"));
    }
}
