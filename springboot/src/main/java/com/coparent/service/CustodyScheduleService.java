package com.coparent.service;

import com.coparent.dto.CustodyScheduleRequest;
import com.coparent.dto.CustodyScheduleResponse;
import com.coparent.entity.CalendarEvent;
import com.coparent.entity.CustodyApproval;
import com.coparent.entity.CustodySchedule;
import com.coparent.entity.User;
import com.coparent.exception.ForbiddenException;
import com.coparent.exception.InvalidStateException;
import com.coparent.exception.NotFoundException;
import com.coparent.repository.CalendarEventRepository;
import com.coparent.repository.CustodyScheduleRepository;
import com.coparent.service.push.PushNotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The family's recurring custody pattern. Changes either apply immediately or
 * wait in a pending approval until the other parent responds.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustodyScheduleService {

    private final CustodyScheduleRepository custodyScheduleRepository;
    private final CalendarEventRepository calendarEventRepository;
    private final ReminderService reminderService;
    private final FamilyAccessService familyAccessService;
    private final FamilyEventPublisher eventPublisher;
    private final PushNotificationService pushNotificationService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public CustodyScheduleResponse get(Long familyId, User actor) {
        familyAccessService.requireMember(familyId, actor);
        return CustodyScheduleResponse.from(load(familyId));
    }

    @Transactional
    public CustodyScheduleResponse save(Long familyId, User actor, CustodyScheduleRequest request) {
        familyAccessService.requireMember(familyId, actor);
        CustodySchedule schedule = custodyScheduleRepository.findByFamilyId(familyId).orElse(null);

        if (request.isRequestApproval()) {
            CustodyApproval approval = CustodyApproval.builder()
                    .name(request.getName())
                    .pattern(request.getPattern())
                    .startDate(request.getStartDate())
                    .parent1Days(copy(request.getParent1Days()))
                    .parent2Days(copy(request.getParent2Days()))
                    .requestedById(actor.getId())
                    .requestedByName(actor.getDisplayName())
                    .requestedAt(Instant.now(clock))
                    .build();

            if (schedule == null) {
                schedule = CustodySchedule.builder().familyId(familyId).build();
                applyLiveFields(schedule, request);
                schedule.setIsActive(false);
            }
            stagePending(schedule, approval);
            schedule = custodyScheduleRepository.saveAndFlush(schedule);
            log.info("Custody change for family {} awaiting approval, requested by {}", familyId, actor.getId());

            pushNotificationService.notifyFamilyExcept(familyId, actor.getId(),
                    "Custody schedule approval",
                    actor.getDisplayName() + " asked you to approve a new custody schedule",
                    Map.of("type", "custody-approval-request", "familyId", String.valueOf(familyId)));
        } else {
            if (schedule == null) {
                schedule = CustodySchedule.builder().familyId(familyId).build();
            }
            applyLiveFields(schedule, request);
            schedule.setIsActive(request.getIsActive() == null || request.getIsActive());
            schedule = custodyScheduleRepository.saveAndFlush(schedule);
            log.info("Custody schedule for family {} saved by {}", familyId, actor.getId());
        }

        CustodyScheduleResponse response = CustodyScheduleResponse.from(schedule);
        eventPublisher.publish(familyId, FamilyEventPublisher.CUSTODY_UPDATED, response, actor.getId());
        return response;
    }

    /**
     * The other parent's answer to a pending change. Approving copies the staged
     * pattern onto the live schedule and activates it.
     */
    @Transactional
    public CustodyScheduleResponse respond(Long familyId, User actor, boolean approve) {
        familyAccessService.requireMember(familyId, actor);
        CustodySchedule schedule = custodyScheduleRepository.findByFamilyId(familyId).orElse(null);
        CustodyApproval pending = schedule == null ? null : schedule.getPendingApproval();
        if (pending == null) {
            throw new InvalidStateException("no-pending-approval", "There is no pending custody change");
        }
        if (pending.getRequestedById().equals(actor.getId())) {
            throw new ForbiddenException("requester-cannot-approve",
                    "The parent who requested the change cannot answer it");
        }

        if (approve) {
            schedule.setName(pending.getName());
            schedule.setPattern(pending.getPattern());
            schedule.setStartDate(pending.getStartDate());
            schedule.setParent1Days(copy(pending.getParent1Days()));
            schedule.setParent2Days(copy(pending.getParent2Days()));
            schedule.setIsActive(true);
        }
        schedule.setPendingApproval(null);
        schedule = custodyScheduleRepository.saveAndFlush(schedule);
        log.info("Custody change for family {} {} by {}", familyId, approve ? "approved" : "rejected", actor.getId());

        CustodyScheduleResponse response = CustodyScheduleResponse.from(schedule);
        eventPublisher.publish(familyId, FamilyEventPublisher.CUSTODY_UPDATED, response, actor.getId());
        pushNotificationService.notifyUsers(List.of(pending.getRequestedById()),
                approve ? "Custody schedule approved" : "Custody schedule rejected",
                actor.getDisplayName() + (approve ? " approved" : " rejected") + " your custody schedule change",
                Map.of("type", approve ? "custody-approved" : "custody-rejected",
                        "familyId", String.valueOf(familyId)));
        return response;
    }

    @Transactional
    public CustodyScheduleResponse cancelPending(Long familyId, User actor) {
        familyAccessService.requireMember(familyId, actor);
        CustodySchedule schedule = custodyScheduleRepository.findByFamilyId(familyId).orElse(null);
        CustodyApproval pending = schedule == null ? null : schedule.getPendingApproval();
        if (pending == null) {
            throw new InvalidStateException("no-pending-approval", "There is no pending custody change");
        }
        if (!pending.getRequestedById().equals(actor.getId())) {
            throw new ForbiddenException("only-requester-can-cancel",
                    "Only the parent who requested the change can cancel it");
        }

        schedule.setPendingApproval(null);
        schedule = custodyScheduleRepository.saveAndFlush(schedule);
        log.info("Custody change for family {} cancelled by {}", familyId, actor.getId());

        CustodyScheduleResponse response = CustodyScheduleResponse.from(schedule);
        eventPublisher.publish(familyId, FamilyEventPublisher.CUSTODY_UPDATED, response, actor.getId());
        return response;
    }

    /**
     * Removes the schedule together with every custody-type calendar event of the family.
     */
    @Transactional
    public void delete(Long familyId, User actor) {
        familyAccessService.requireMember(familyId, actor);
        CustodySchedule schedule = load(familyId);

        List<CalendarEvent> custodyEvents = calendarEventRepository
                .findByFamilyIdAndTypeOrderByStartDateAsc(familyId, CalendarEvent.EventType.CUSTODY);
        custodyEvents.forEach(event -> reminderService.deleteEventReminder(event.getId()));
        calendarEventRepository.deleteAll(custodyEvents);
        custodyScheduleRepository.delete(schedule);
        log.info("Custody schedule for family {} deleted by {} ({} custody events removed)",
                familyId, actor.getId(), custodyEvents.size());

        eventPublisher.publish(familyId, FamilyEventPublisher.CUSTODY_DELETED,
                Map.of("familyId", familyId), actor.getId());
    }

    private CustodySchedule load(Long familyId) {
        return custodyScheduleRepository.findByFamilyId(familyId)
                .orElseThrow(() -> new NotFoundException("custody-schedule-not-found", "No custody schedule"));
    }

    private static void stagePending(CustodySchedule schedule, CustodyApproval approval) {
        CustodyApproval existing = schedule.getPendingApproval();
        if (existing == null) {
            schedule.setPendingApproval(approval);
            return;
        }
        existing.setName(approval.getName());
        existing.setPattern(approval.getPattern());
        existing.setStartDate(approval.getStartDate());
        existing.setParent1Days(approval.getParent1Days());
        existing.setParent2Days(approval.getParent2Days());
        existing.setRequestedById(approval.getRequestedById());
        existing.setRequestedByName(approval.getRequestedByName());
        existing.setRequestedAt(approval.getRequestedAt());
    }

    private static void applyLiveFields(CustodySchedule schedule, CustodyScheduleRequest request) {
        schedule.setName(request.getName());
        schedule.setPattern(request.getPattern());
        schedule.setStartDate(request.getStartDate());
        schedule.setEndDate(request.getEndDate());
        schedule.setParent1Days(copy(request.getParent1Days()));
        schedule.setParent2Days(copy(request.getParent2Days()));
        schedule.setBiweeklyAltParent1Days(copy(request.getBiweeklyAltParent1Days()));
        schedule.setBiweeklyAltParent2Days(copy(request.getBiweeklyAltParent2Days()));
    }

    private static List<Integer> copy(List<Integer> days) {
        return days == null ? new ArrayList<>() : new ArrayList<>(days);
    }
}
