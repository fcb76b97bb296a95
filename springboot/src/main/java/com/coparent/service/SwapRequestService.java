package com.coparent.service;

import com.coparent.dto.CounterOfferRequest;
import com.coparent.dto.CounterResponseRequest;
import com.coparent.dto.CreateSwapRequest;
import com.coparent.dto.SwapRequestResponse;
import com.coparent.dto.SwapStatusRequest;
import com.coparent.entity.CalendarEvent;
import com.coparent.entity.ParentSlot;
import com.coparent.entity.SwapRequest;
import com.coparent.entity.User;
import com.coparent.exception.ForbiddenException;
import com.coparent.exception.InvalidStateException;
import com.coparent.exception.NotFoundException;
import com.coparent.exception.ValidationException;
import com.coparent.repository.CalendarEventRepository;
import com.coparent.repository.SwapRequestRepository;
import com.coparent.service.push.PushNotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Custody-day swap negotiation between the two parents of a family.
 * <pre>
 * pending       -> countered | approved | rejected | cancelled
 * countered     -> final_pending | pending (counter rejected) | cancelled
 * final_pending -> approved | rejected | cancelled
 * </pre>
 * Guards are checked in order: existence, state, then the caller's role.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SwapRequestService {

    static final String SWAP_EVENT_COLOR = "#8b5cf6";

    private static final Set<SwapRequest.Status> RESPONDABLE =
            EnumSet.of(SwapRequest.Status.PENDING, SwapRequest.Status.FINAL_PENDING);
    private static final Set<SwapRequest.Status> CANCELLABLE =
            EnumSet.of(SwapRequest.Status.PENDING, SwapRequest.Status.COUNTERED, SwapRequest.Status.FINAL_PENDING);

    private final SwapRequestRepository swapRequestRepository;
    private final CalendarEventRepository calendarEventRepository;
    private final FamilyAccessService familyAccessService;
    private final FamilyEventPublisher eventPublisher;
    private final PushNotificationService pushNotificationService;
    private final Clock clock;
    private final ZoneId familyZone;

    @Transactional(readOnly = true)
    public List<SwapRequestResponse> list(Long familyId, User actor, SwapRequest.Status status) {
        familyAccessService.requireMember(familyId, actor);
        List<SwapRequest> requests = status == null
                ? swapRequestRepository.findByFamilyIdOrderByCreatedAtDesc(familyId)
                : swapRequestRepository.findByFamilyIdAndStatusOrderByCreatedAtDesc(familyId, status);
        return requests.stream().map(SwapRequestResponse::from).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public SwapRequestResponse get(Long familyId, User actor, Long requestId) {
        familyAccessService.requireMember(familyId, actor);
        return SwapRequestResponse.from(load(familyId, requestId));
    }

    @Transactional
    public SwapRequestResponse create(Long familyId, User actor, CreateSwapRequest request) {
        familyAccessService.requireMember(familyId, actor);

        SwapRequest.RequestType type = request.getRequestType() == null
                ? SwapRequest.RequestType.SWAP
                : request.getRequestType();
        if (type == SwapRequest.RequestType.SWAP && request.getProposedDate() == null) {
            throw new ValidationException("proposed-date-required", "A swap needs a proposed date");
        }

        User recipient = familyAccessService.otherParent(familyId, actor.getId())
                .orElseThrow(() -> new InvalidStateException("no-other-parent",
                        "There is no other parent in this family yet"));

        SwapRequest swap = swapRequestRepository.save(SwapRequest.builder()
                .familyId(familyId)
                .requestedById(actor.getId())
                .requestedByName(actor.getDisplayName())
                .requestedToId(recipient.getId())
                .requestedToName(recipient.getDisplayName())
                .originalDate(request.getOriginalDate())
                .proposedDate(type == SwapRequest.RequestType.SWAP ? request.getProposedDate() : null)
                .requestType(type)
                .reason(note(request.getReason()))
                .status(SwapRequest.Status.PENDING)
                .build());
        log.info("Swap request {} created in family {} by {}", swap.getId(), familyId, actor.getId());

        SwapRequestResponse response = SwapRequestResponse.from(swap);
        eventPublisher.publish(familyId, FamilyEventPublisher.SWAP_CREATED, response, actor.getId());
        pushNotificationService.notifyUsers(List.of(recipient.getId()),
                "New swap request",
                actor.getDisplayName() + " asked to swap " + swap.getOriginalDate(),
                pushData(swap));
        return response;
    }

    /**
     * Final answer (approve or reject) by the recipient, or cancellation by the requester.
     */
    @Transactional
    public SwapRequestResponse updateStatus(Long familyId, User actor, Long requestId, SwapStatusRequest request) {
        familyAccessService.requireMember(familyId, actor);
        SwapRequest.Status target = request.getStatus();
        if (!target.isTerminal()) {
            throw new ValidationException("swap-request-status-not-allowed",
                    "Status must be approved, rejected or cancelled");
        }

        SwapRequest swap = load(familyId, requestId);
        Instant now = Instant.now(clock);

        if (target == SwapRequest.Status.CANCELLED) {
            if (!CANCELLABLE.contains(swap.getStatus())) {
                throw notPending(swap);
            }
            if (!swap.getRequestedById().equals(actor.getId())) {
                throw new ForbiddenException("swap-request-cancel-forbidden",
                        "Only the requester can cancel a swap request");
            }
        } else {
            if (!RESPONDABLE.contains(swap.getStatus())) {
                throw notPending(swap);
            }
            if (!swap.getRequestedToId().equals(actor.getId())) {
                throw new ForbiddenException("swap-request-response-forbidden",
                        "Only the recipient can respond to a swap request");
            }
        }

        swap.setStatus(target);
        swap.setResponseNote(note(request.getResponseNote()));
        swap.setRespondedAt(now);
        swap = swapRequestRepository.saveAndFlush(swap);

        if (target == SwapRequest.Status.APPROVED) {
            applyToCalendar(swap);
        }
        log.info("Swap request {} -> {} by {}", swap.getId(), target, actor.getId());

        SwapRequestResponse response = SwapRequestResponse.from(swap);
        eventPublisher.publish(familyId, FamilyEventPublisher.SWAP_UPDATED, response, actor.getId());
        if (target != SwapRequest.Status.CANCELLED) {
            pushNotificationService.notifyUsers(List.of(swap.getRequestedById()),
                    target == SwapRequest.Status.APPROVED ? "Swap request approved" : "Swap request rejected",
                    actor.getDisplayName() + " responded to your swap for " + swap.getOriginalDate(),
                    pushData(swap));
        }
        return response;
    }

    @Transactional
    public SwapRequestResponse counter(Long familyId, User actor, Long requestId, CounterOfferRequest request) {
        familyAccessService.requireMember(familyId, actor);
        SwapRequest swap = load(familyId, requestId);

        if (swap.getStatus() != SwapRequest.Status.PENDING) {
            throw notPending(swap);
        }
        if (!swap.getRequestedToId().equals(actor.getId())) {
            throw new ForbiddenException("swap-request-response-forbidden",
                    "Only the recipient can counter a swap request");
        }
        if (swap.getRequestType() != SwapRequest.RequestType.SWAP) {
            throw new InvalidStateException("swap-counter-not-allowed",
                    "One-way requests cannot be countered");
        }

        swap.setPreviousProposedDate(swap.getProposedDate());
        swap.setProposedDate(request.getProposedDate());
        swap.setCounterNote(note(request.getNote()));
        swap.setCounteredById(actor.getId());
        swap.setCounteredAt(Instant.now(clock));
        swap.setRequesterConfirmedAt(null);
        swap.setCounterResponseNote(null);
        swap.setCounterRespondedAt(null);
        swap.setResponseNote(null);
        swap.setRespondedAt(null);
        swap.setStatus(SwapRequest.Status.COUNTERED);
        swap = swapRequestRepository.saveAndFlush(swap);
        log.info("Swap request {} countered by {} with {}", swap.getId(), actor.getId(), swap.getProposedDate());

        SwapRequestResponse response = SwapRequestResponse.from(swap);
        eventPublisher.publish(familyId, FamilyEventPublisher.SWAP_UPDATED, response, actor.getId());
        pushNotificationService.notifyUsers(List.of(swap.getRequestedById()),
                "Counter-offer",
                actor.getDisplayName() + " proposed " + swap.getProposedDate() + " instead",
                pushData(swap));
        return response;
    }

    @Transactional
    public SwapRequestResponse acceptCounter(Long familyId, User actor, Long requestId,
                                             CounterResponseRequest request) {
        familyAccessService.requireMember(familyId, actor);
        SwapRequest swap = load(familyId, requestId);
        requireCountered(swap);
        if (!swap.getRequestedById().equals(actor.getId())) {
            throw new ForbiddenException("swap-counter-accept-forbidden",
                    "Only the requester can accept a counter-offer");
        }

        Instant now = Instant.now(clock);
        swap.setPreviousProposedDate(null);
        swap.setRequesterConfirmedAt(now);
        swap.setCounterResponseNote(note(request == null ? null : request.getNote()));
        swap.setCounterRespondedAt(now);
        swap.setStatus(SwapRequest.Status.FINAL_PENDING);
        swap = swapRequestRepository.saveAndFlush(swap);
        log.info("Counter-offer on swap request {} accepted by {}", swap.getId(), actor.getId());

        SwapRequestResponse response = SwapRequestResponse.from(swap);
        eventPublisher.publish(familyId, FamilyEventPublisher.SWAP_UPDATED, response, actor.getId());
        pushNotificationService.notifyUsers(List.of(swap.getRequestedToId()),
                "Final confirmation needed",
                actor.getDisplayName() + " accepted your counter-offer",
                pushData(swap));
        return response;
    }

    @Transactional
    public SwapRequestResponse rejectCounter(Long familyId, User actor, Long requestId,
                                             CounterResponseRequest request) {
        familyAccessService.requireMember(familyId, actor);
        SwapRequest swap = load(familyId, requestId);
        requireCountered(swap);
        if (!swap.getRequestedById().equals(actor.getId())) {
            throw new ForbiddenException("swap-counter-reject-forbidden",
                    "Only the requester can reject a counter-offer");
        }

        swap.setProposedDate(swap.getPreviousProposedDate());
        swap.setPreviousProposedDate(null);
        swap.setCounterNote(null);
        swap.setCounteredById(null);
        swap.setCounteredAt(null);
        swap.setRequesterConfirmedAt(null);
        swap.setCounterResponseNote(note(request == null ? null : request.getNote()));
        swap.setCounterRespondedAt(Instant.now(clock));
        swap.setStatus(SwapRequest.Status.PENDING);
        swap = swapRequestRepository.saveAndFlush(swap);
        log.info("Counter-offer on swap request {} rejected by {}", swap.getId(), actor.getId());

        SwapRequestResponse response = SwapRequestResponse.from(swap);
        eventPublisher.publish(familyId, FamilyEventPublisher.SWAP_UPDATED, response, actor.getId());
        pushNotificationService.notifyUsers(List.of(swap.getRequestedToId()),
                "Counter-offer declined",
                actor.getDisplayName() + " kept the original date " + swap.getProposedDate(),
                pushData(swap));
        return response;
    }

    /**
     * Replaces the calendar events derived from an approved request: the original
     * day goes to the other parent and, for a swap, the proposed day goes to the requester.
     */
    private void applyToCalendar(SwapRequest swap) {
        Long familyId = swap.getFamilyId();
        calendarEventRepository.deleteByFamilyIdAndSwapRequestId(familyId, swap.getId());

        List<String> memberIds = familyAccessService.memberIds(familyId);
        boolean requesterIsParent1 = !memberIds.isEmpty() && memberIds.get(0).equals(swap.getRequestedById());
        ParentSlot requesterSlot = requesterIsParent1 ? ParentSlot.PARENT1 : ParentSlot.PARENT2;
        ParentSlot otherSlot = requesterIsParent1 ? ParentSlot.PARENT2 : ParentSlot.PARENT1;
        String description = swap.getReason() != null ? swap.getReason() : "Swap approved by both parents";

        List<CalendarEvent> events = new ArrayList<>();
        events.add(derivedEvent(swap, swap.getOriginalDate(), otherSlot, memberIds, description,
                swap.getRequestType() == SwapRequest.RequestType.ONE_WAY
                        ? "Approved custody swap: day handed over without return"
                        : "Approved custody swap: day handed over"));
        if (swap.getRequestType() == SwapRequest.RequestType.SWAP && swap.getProposedDate() != null) {
            events.add(derivedEvent(swap, swap.getProposedDate(), requesterSlot, memberIds, description,
                    "Approved custody swap: day received"));
        }
        calendarEventRepository.saveAll(events);
        log.info("Swap request {} applied to calendar ({} events)", swap.getId(), events.size());
    }

    private CalendarEvent derivedEvent(SwapRequest swap, LocalDate day, ParentSlot slot, List<String> memberIds,
                                       String description, String title) {
        return CalendarEvent.builder()
                .familyId(swap.getFamilyId())
                .title(title)
                .description(description)
                .startDate(day.atStartOfDay(familyZone).toInstant())
                .endDate(day.plusDays(1).atStartOfDay(familyZone).toInstant().minusMillis(1))
                .type(CalendarEvent.EventType.CUSTODY)
                .parentId(slot)
                .isAllDay(true)
                .color(SWAP_EVENT_COLOR)
                .swapRequestId(swap.getId())
                .targetUids(new ArrayList<>(memberIds))
                .createdById(swap.getRequestedToId())
                .createdByName(swap.getRequestedToName())
                .build();
    }

    private SwapRequest load(Long familyId, Long requestId) {
        return swapRequestRepository.findByIdAndFamilyId(requestId, familyId)
                .orElseThrow(() -> new NotFoundException("swap-request-not-found", "Swap request not found"));
    }

    private static void requireCountered(SwapRequest swap) {
        if (swap.getStatus() != SwapRequest.Status.COUNTERED) {
            throw new InvalidStateException("swap-counter-not-pending",
                    "Swap request has no open counter-offer (status " + swap.getStatus().getValue() + ")");
        }
    }

    private static InvalidStateException notPending(SwapRequest swap) {
        return new InvalidStateException("swap-request-not-pending",
                "Swap request is " + swap.getStatus().getValue());
    }

    private static String note(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static Map<String, String> pushData(SwapRequest swap) {
        return Map.of("type", "swap-request",
                "familyId", String.valueOf(swap.getFamilyId()),
                "swapRequestId", String.valueOf(swap.getId()),
                "status", swap.getStatus().getValue());
    }
}
