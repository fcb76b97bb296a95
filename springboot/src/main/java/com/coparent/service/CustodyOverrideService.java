package com.coparent.service;

import com.coparent.dto.CreateCustodyOverrideRequest;
import com.coparent.dto.CustodyOverrideResponse;
import com.coparent.dto.RespondCustodyOverrideRequest;
import com.coparent.entity.CustodyOverride;
import com.coparent.entity.ParentSlot;
import com.coparent.entity.User;
import com.coparent.exception.ConflictException;
import com.coparent.exception.ForbiddenException;
import com.coparent.exception.InvalidStateException;
import com.coparent.exception.NotFoundException;
import com.coparent.exception.ValidationException;
import com.coparent.repository.CustodyOverrideRepository;
import com.coparent.service.push.PushNotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Date-range exceptions to the regular custody schedule. An override proposed by one
 * parent stays pending until the co-parent answers; in a single-parent family, or when
 * no approval is requested, it is approved on creation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustodyOverrideService {

    private static final Set<CustodyOverride.Status> BLOCKING =
            EnumSet.of(CustodyOverride.Status.PENDING, CustodyOverride.Status.APPROVED);

    private final CustodyOverrideRepository custodyOverrideRepository;
    private final FamilyAccessService familyAccessService;
    private final FamilyEventPublisher eventPublisher;
    private final PushNotificationService pushNotificationService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<CustodyOverrideResponse> list(Long familyId, User actor, CustodyOverride.Status status,
                                              Instant from, Instant to) {
        familyAccessService.requireMember(familyId, actor);
        return custodyOverrideRepository.findByFamilyIdOrderByStartDateAsc(familyId).stream()
                .filter(o -> status == null || o.getStatus() == status)
                .filter(o -> from == null || !o.getStartDate().isBefore(from))
                .filter(o -> to == null || !o.getEndDate().isAfter(to))
                .map(CustodyOverrideResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * Approved overrides overlapping [from, to].
     */
    @Transactional(readOnly = true)
    public List<CustodyOverrideResponse> active(Long familyId, User actor, Instant from, Instant to) {
        familyAccessService.requireMember(familyId, actor);
        requireRange(from, to);
        return custodyOverrideRepository.findOverlapping(familyId, CustodyOverride.Status.APPROVED, from, to).stream()
                .map(CustodyOverrideResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public CustodyOverrideResponse get(Long familyId, User actor, Long overrideId) {
        familyAccessService.requireMember(familyId, actor);
        return CustodyOverrideResponse.from(load(familyId, overrideId));
    }

    @Transactional
    public CustodyOverrideResponse create(Long familyId, User actor, CreateCustodyOverrideRequest request) {
        familyAccessService.requireMember(familyId, actor);
        requireRange(request.getStartDate(), request.getEndDate());
        if (request.getAssignments().containsValue(ParentSlot.BOTH)) {
            throw new ValidationException("invalid-assignment", "Each day must be assigned to parent1 or parent2");
        }
        if (custodyOverrideRepository.existsOverlapping(familyId, BLOCKING,
                request.getStartDate(), request.getEndDate())) {
            throw new ConflictException("custody-override-overlap",
                    "Another custody override already covers part of this period");
        }

        Optional<User> counterparty = familyAccessService.otherParent(familyId, actor.getId());
        boolean needsApproval = !Boolean.FALSE.equals(request.getRequestApproval()) && counterparty.isPresent();

        CustodyOverride override = custodyOverrideRepository.save(CustodyOverride.builder()
                .familyId(familyId)
                .name(note(request.getName()))
                .type(request.getType())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .assignments(new LinkedHashMap<>(request.getAssignments()))
                .note(note(request.getNote()))
                .status(needsApproval ? CustodyOverride.Status.PENDING : CustodyOverride.Status.APPROVED)
                .requestedById(actor.getId())
                .requestedByName(actor.getDisplayName())
                .requestedToId(needsApproval ? counterparty.get().getId() : null)
                .requestedToName(needsApproval ? counterparty.get().getDisplayName() : null)
                .build());
        log.info("Custody override {} ({}) created in family {} by {}", override.getId(),
                override.getStatus(), familyId, actor.getId());

        CustodyOverrideResponse response = CustodyOverrideResponse.from(override);
        eventPublisher.publish(familyId, FamilyEventPublisher.CUSTODY_OVERRIDE_CREATED, response, actor.getId());
        if (needsApproval) {
            pushNotificationService.notifyUsers(List.of(override.getRequestedToId()),
                    "Custody change requested",
                    actor.getDisplayName() + " proposed a custody change" + label(override),
                    pushData(override));
        }
        return response;
    }

    @Transactional
    public CustodyOverrideResponse respond(Long familyId, User actor, Long overrideId,
                                           RespondCustodyOverrideRequest request) {
        familyAccessService.requireMember(familyId, actor);
        CustodyOverride override = load(familyId, overrideId);
        if (override.getStatus() != CustodyOverride.Status.PENDING) {
            throw new InvalidStateException("custody-override-not-pending",
                    "Custody override is " + override.getStatus().getValue());
        }
        if (override.getRequestedToId() != null && !override.getRequestedToId().equals(actor.getId())) {
            throw new ForbiddenException("custody-override-response-forbidden",
                    "Only the requested parent can respond to this custody override");
        }

        boolean approved = Boolean.TRUE.equals(request.getApprove());
        override.setStatus(approved ? CustodyOverride.Status.APPROVED : CustodyOverride.Status.REJECTED);
        override.setResponseNote(note(request.getResponseNote()));
        override.setRespondedById(actor.getId());
        override.setRespondedAt(Instant.now(clock));
        override = custodyOverrideRepository.saveAndFlush(override);
        log.info("Custody override {} -> {} by {}", override.getId(), override.getStatus(), actor.getId());

        CustodyOverrideResponse response = CustodyOverrideResponse.from(override);
        eventPublisher.publish(familyId, FamilyEventPublisher.CUSTODY_OVERRIDE_UPDATED, response, actor.getId());
        pushNotificationService.notifyUsers(List.of(override.getRequestedById()),
                approved ? "Custody change approved" : "Custody change rejected",
                actor.getDisplayName() + " responded to your custody change" + label(override),
                pushData(override));
        return response;
    }

    /**
     * Withdraws a pending override. Only the requester may cancel; the row is removed.
     */
    @Transactional
    public void cancel(Long familyId, User actor, Long overrideId) {
        familyAccessService.requireMember(familyId, actor);
        CustodyOverride override = load(familyId, overrideId);
        if (override.getStatus() != CustodyOverride.Status.PENDING) {
            throw new InvalidStateException("custody-override-cancel-not-allowed",
                    "Only pending custody overrides can be cancelled");
        }
        if (!override.getRequestedById().equals(actor.getId())) {
            throw new ForbiddenException("custody-override-cancel-forbidden",
                    "Only the requester can cancel a custody override");
        }
        remove(familyId, actor, override);
    }

    @Transactional
    public void delete(Long familyId, User actor, Long overrideId) {
        familyAccessService.requireMember(familyId, actor);
        remove(familyId, actor, load(familyId, overrideId));
    }

    @Transactional
    public long deleteAll(Long familyId, User actor) {
        familyAccessService.requireMember(familyId, actor);
        long deleted = custodyOverrideRepository.deleteByFamilyId(familyId);
        log.info("Deleted {} custody overrides in family {} by {}", deleted, familyId, actor.getId());
        eventPublisher.publish(familyId, FamilyEventPublisher.CUSTODY_OVERRIDE_DELETED,
                Map.of("deleted", deleted), actor.getId());
        return deleted;
    }

    private void remove(Long familyId, User actor, CustodyOverride override) {
        custodyOverrideRepository.delete(override);
        log.info("Custody override {} deleted in family {} by {}", override.getId(), familyId, actor.getId());
        eventPublisher.publish(familyId, FamilyEventPublisher.CUSTODY_OVERRIDE_DELETED,
                Map.of("id", override.getId()), actor.getId());
    }

    private CustodyOverride load(Long familyId, Long overrideId) {
        return custodyOverrideRepository.findByIdAndFamilyId(overrideId, familyId)
                .orElseThrow(() -> new NotFoundException("custody-override-not-found", "Custody override not found"));
    }

    private static void requireRange(Instant from, Instant to) {
        if (from == null || to == null) {
            throw new ValidationException("invalid-date-range", "Both start and end dates are required");
        }
        if (to.isBefore(from)) {
            throw new ValidationException("invalid-date-range", "End date must not be before start date");
        }
    }

    private static String label(CustodyOverride override) {
        return override.getName() == null ? "" : ": " + override.getName();
    }

    private static String note(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static Map<String, String> pushData(CustodyOverride override) {
        return Map.of("type", "custody-override",
                "familyId", String.valueOf(override.getFamilyId()),
                "custodyOverrideId", String.valueOf(override.getId()),
                "status", override.getStatus().getValue());
    }
}
