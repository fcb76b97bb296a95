package com.coparent.service;

import com.coparent.dto.ChildRequest;
import com.coparent.dto.ChildResponse;
import com.coparent.dto.CustodyScheduleResponse;
import com.coparent.dto.FamilyMemberResponse;
import com.coparent.dto.FamilyResponse;
import com.coparent.dto.InviteResponse;
import com.coparent.dto.UpdateChildRequest;
import com.coparent.dto.UpdateFamilyRequest;
import com.coparent.entity.Family;
import com.coparent.entity.FamilyChild;
import com.coparent.entity.FamilyInvite;
import com.coparent.entity.FamilyMember;
import com.coparent.entity.ParentSlot;
import com.coparent.entity.User;
import com.coparent.exception.ConflictException;
import com.coparent.exception.InvalidStateException;
import com.coparent.exception.NotFoundException;
import com.coparent.exception.ValidationException;
import com.coparent.repository.CalendarEventRepository;
import com.coparent.repository.CustodyOverrideRepository;
import com.coparent.repository.CustodyScheduleRepository;
import com.coparent.repository.EventReminderRepository;
import com.coparent.repository.FamilyChildRepository;
import com.coparent.repository.FamilyInviteRepository;
import com.coparent.repository.FamilyMemberRepository;
import com.coparent.repository.FamilyRepository;
import com.coparent.repository.FamilySettingsRepository;
import com.coparent.repository.NotificationRepository;
import com.coparent.repository.SwapRequestRepository;
import com.coparent.repository.TaskReminderRepository;
import com.coparent.repository.TaskRepository;
import com.coparent.repository.UserRepository;
import com.coparent.service.storage.ObjectStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Families, their members, children and co-parent invitations. A family holds
 * at most two members.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FamilyService {

    static final int MAX_MEMBERS = 2;

    private final FamilyRepository familyRepository;
    private final FamilyMemberRepository familyMemberRepository;
    private final FamilyChildRepository familyChildRepository;
    private final FamilyInviteRepository familyInviteRepository;
    private final UserRepository userRepository;
    private final CustodyScheduleRepository custodyScheduleRepository;
    private final CalendarEventRepository calendarEventRepository;
    private final EventReminderRepository eventReminderRepository;
    private final TaskRepository taskRepository;
    private final TaskReminderRepository taskReminderRepository;
    private final SwapRequestRepository swapRequestRepository;
    private final CustodyOverrideRepository custodyOverrideRepository;
    private final NotificationRepository notificationRepository;
    private final FamilySettingsRepository familySettingsRepository;
    private final FamilyAccessService familyAccessService;
    private final ShareCodeGenerator shareCodeGenerator;
    private final FamilyEventPublisher eventPublisher;
    private final EmailService emailService;
    private final ObjectStorage objectStorage;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<FamilyResponse> listMine(User actor) {
        return familyMemberRepository.findByUserId(actor.getId()).stream()
                .map(FamilyMember::getFamily)
                .sorted(Comparator.comparing(Family::getId))
                .map(family -> toResponse(family, false))
                .collect(Collectors.toList());
    }

    @Transactional
    public FamilyResponse create(User actor, String name) {
        Family family = Family.builder()
                .name(name)
                .ownerId(actor.getId())
                .shareCode(shareCodeGenerator.nextUniqueCode())
                .build();
        family.getMembers().add(FamilyMember.builder()
                .family(family)
                .user(actor)
                .role(FamilyMember.Role.OWNER)
                .build());
        family = familyRepository.save(family);
        setActiveFamily(actor, family.getId());
        log.info("Family {} created by {}", family.getId(), actor.getId());
        return toResponse(family, false);
    }

    @Transactional(readOnly = true)
    public FamilyResponse get(Long familyId, User actor) {
        return toResponse(familyAccessService.requireMember(familyId, actor), true);
    }

    @Transactional
    public FamilyResponse update(Long familyId, User actor, UpdateFamilyRequest request) {
        Family family = familyAccessService.requireMember(familyId, actor);
        if (request.getName() != null) {
            family.setName(request.getName().trim());
        }
        if (request.getPhotoUrl() != null) {
            family.setPhotoUrl(request.getPhotoUrl());
        }
        family = familyRepository.save(family);
        return publishUpdated(family, actor);
    }

    /**
     * Owner only. Removes the family with its calendar, tasks, swap requests and settings.
     */
    @Transactional
    public void delete(Long familyId, User actor) {
        Family family = familyAccessService.requireOwner(familyId, actor);

        userRepository.clearActiveFamily(familyId);
        eventReminderRepository.deleteByFamilyId(familyId);
        taskReminderRepository.deleteByFamilyId(familyId);
        calendarEventRepository.deleteByFamilyId(familyId);
        taskRepository.deleteByFamilyId(familyId);
        swapRequestRepository.deleteByFamilyId(familyId);
        custodyOverrideRepository.deleteByFamilyId(familyId);
        custodyScheduleRepository.deleteByFamilyId(familyId);
        notificationRepository.deleteByFamilyId(familyId);
        familySettingsRepository.findById(familyId).ifPresent(familySettingsRepository::delete);
        familyRepository.delete(family);
        objectStorage.delete(family.getPhotoUrl());
        log.info("Family {} deleted by owner {}", familyId, actor.getId());
    }

    @Transactional
    public FamilyResponse join(User actor, String shareCode) {
        Family family = familyRepository.findByShareCode(shareCode.trim())
                .orElseThrow(() -> new NotFoundException("invalid-share-code", "No family uses this share code"));

        if (isMember(family, actor.getId())) {
            return toResponse(family, true);
        }
        if (family.getMembers().size() >= MAX_MEMBERS) {
            throw new InvalidStateException("family-full", "This family already has two parents");
        }

        addMember(family, actor);
        log.info("User {} joined family {} by share code", actor.getId(), family.getId());
        return toResponse(family, true);
    }

    /**
     * Accepts the oldest pending invitation addressed to the caller's e-mail.
     *
     * @return the joined family, or empty when no invitation is waiting
     */
    @Transactional
    public Optional<FamilyResponse> acceptInvite(User actor) {
        Optional<FamilyInvite> pending = familyInviteRepository
                .findFirstByEmailAndStatusOrderByCreatedAtAsc(normalizeEmail(actor.getEmail()), FamilyInvite.Status.PENDING);
        if (pending.isEmpty()) {
            return Optional.empty();
        }

        FamilyInvite invite = pending.get();
        Family family = invite.getFamily();
        if (!isMember(family, actor.getId())) {
            if (family.getMembers().size() >= MAX_MEMBERS) {
                throw new InvalidStateException("family-full", "This family already has two parents");
            }
            invite.setStatus(FamilyInvite.Status.ACCEPTED);
            familyInviteRepository.save(invite);
            addMember(family, actor);
        } else {
            invite.setStatus(FamilyInvite.Status.ACCEPTED);
            familyInviteRepository.save(invite);
        }
        log.info("User {} accepted invite {} to family {}", actor.getId(), invite.getId(), family.getId());
        return Optional.of(toResponse(family, true));
    }

    @Transactional
    public InviteResponse invite(Long familyId, User actor, String email) {
        Family family = familyAccessService.requireMember(familyId, actor);
        String normalized = normalizeEmail(email);

        if (family.getMembers().size() >= MAX_MEMBERS) {
            throw new InvalidStateException("family-full", "This family already has two parents");
        }
        if (familyInviteRepository.existsByFamilyIdAndEmail(familyId, normalized)) {
            throw new ConflictException("already-invited", "This address was already invited");
        }
        if (normalized.equals(normalizeEmail(actor.getEmail()))) {
            throw new ValidationException("self-invite", "You cannot invite yourself");
        }

        FamilyInvite invite = familyInviteRepository.save(FamilyInvite.builder()
                .family(family)
                .email(normalized)
                .displayEmail(email.trim())
                .invitedById(actor.getId())
                .invitedByName(actor.getDisplayName())
                .build());
        log.info("User {} invited {} to family {}", actor.getId(), normalized, familyId);

        emailService.sendFamilyInvite(normalized, actor.getDisplayName(), family.getName(), family.getShareCode());
        return InviteResponse.from(invite);
    }

    /**
     * Removes the caller's membership. An owner leaving hands ownership to the remaining member.
     */
    @Transactional
    public void leave(Long familyId, User actor) {
        Family family = familyAccessService.requireMember(familyId, actor);

        if (family.getOwnerId().equals(actor.getId())) {
            family.getMembers().stream()
                    .filter(m -> !m.getUser().getId().equals(actor.getId()))
                    .findFirst()
                    .ifPresent(next -> {
                        next.setRole(FamilyMember.Role.OWNER);
                        family.setOwnerId(next.getUser().getId());
                        log.info("Ownership of family {} transferred from {} to {}",
                                familyId, actor.getId(), next.getUser().getId());
                    });
        }
        family.getMembers().removeIf(m -> m.getUser().getId().equals(actor.getId()));
        familyRepository.save(family);

        if (familyId.equals(actor.getActiveFamilyId())) {
            actor.setActiveFamilyId(null);
            userRepository.save(actor);
        }
        log.info("User {} left family {}", actor.getId(), familyId);
        eventPublisher.publish(familyId, FamilyEventPublisher.MEMBER_LEFT,
                Map.of("userId", actor.getId()), actor.getId());
    }

    @Transactional
    public String regenerateShareCode(Long familyId, User actor) {
        Family family = familyAccessService.requireMember(familyId, actor);
        family.setShareCode(shareCodeGenerator.nextUniqueCode());
        family.setShareCodeUpdatedAt(Instant.now(clock));
        family = familyRepository.save(family);
        publishUpdated(family, actor);
        return family.getShareCode();
    }

    @Transactional(readOnly = true)
    public List<FamilyMemberResponse> members(Long familyId, User actor) {
        return memberResponses(familyAccessService.requireMember(familyId, actor));
    }

    @Transactional
    public FamilyResponse uploadPhoto(Long familyId, User actor, byte[] content, String filename, String contentType) {
        Family family = familyAccessService.requireMember(familyId, actor);
        if (content == null || content.length == 0) {
            throw new ValidationException("empty-file", "No file uploaded");
        }
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new ValidationException("invalid-file-type", "Only images are accepted");
        }

        String previous = family.getPhotoUrl();
        family.setPhotoUrl(objectStorage.store(content, "families/" + familyId, filename, contentType));
        family = familyRepository.save(family);
        objectStorage.delete(previous);
        return publishUpdated(family, actor);
    }

    @Transactional
    public ChildResponse addChild(Long familyId, User actor, ChildRequest request) {
        Family family = familyAccessService.requireMember(familyId, actor);
        FamilyChild child = familyChildRepository.save(FamilyChild.builder()
                .family(family)
                .name(request.getName().trim())
                .birthDate(request.getBirthDate())
                .photoUrl(request.getPhotoUrl())
                .build());
        family.getChildren().add(child);
        publishUpdated(family, actor);
        return ChildResponse.from(child);
    }

    @Transactional
    public ChildResponse updateChild(Long familyId, User actor, Long childId, UpdateChildRequest request) {
        Family family = familyAccessService.requireMember(familyId, actor);
        FamilyChild child = loadChild(familyId, childId);
        if (request.getName() != null) {
            child.setName(request.getName().trim());
        }
        if (request.getBirthDate() != null) {
            child.setBirthDate(request.getBirthDate());
        }
        if (request.getPhotoUrl() != null) {
            child.setPhotoUrl(request.getPhotoUrl());
        }
        child = familyChildRepository.save(child);
        publishUpdated(family, actor);
        return ChildResponse.from(child);
    }

    @Transactional
    public void removeChild(Long familyId, User actor, Long childId) {
        Family family = familyAccessService.requireMember(familyId, actor);
        FamilyChild child = loadChild(familyId, childId);
        family.getChildren().remove(child);
        familyChildRepository.delete(child);
        publishUpdated(family, actor);
    }

    private FamilyChild loadChild(Long familyId, Long childId) {
        return familyChildRepository.findByIdAndFamilyId(childId, familyId)
                .orElseThrow(() -> new NotFoundException("child-not-found", "Child not found"));
    }

    private void addMember(Family family, User user) {
        family.getMembers().add(FamilyMember.builder()
                .family(family)
                .user(user)
                .role(FamilyMember.Role.MEMBER)
                .build());
        familyRepository.save(family);
        setActiveFamily(user, family.getId());
        eventPublisher.publish(family.getId(), FamilyEventPublisher.MEMBER_JOINED,
                Map.of("userId", user.getId(), "name", user.getDisplayName()), user.getId());
    }

    private void setActiveFamily(User user, Long familyId) {
        user.setActiveFamilyId(familyId);
        userRepository.save(user);
    }

    private FamilyResponse publishUpdated(Family family, User actor) {
        FamilyResponse response = toResponse(family, false);
        eventPublisher.publish(family.getId(), FamilyEventPublisher.FAMILY_UPDATED, response, actor.getId());
        return response;
    }

    private static boolean isMember(Family family, String userId) {
        return family.getMembers().stream().anyMatch(m -> m.getUser().getId().equals(userId));
    }

    private List<FamilyMemberResponse> memberResponses(Family family) {
        return family.getMembers().stream()
                .sorted(Comparator.comparing(m -> m.getUser().getId()))
                .map(m -> FamilyMemberResponse.from(m, slotOf(family, m)))
                .collect(Collectors.toList());
    }

    private static ParentSlot slotOf(Family family, FamilyMember member) {
        List<String> ids = family.getMembers().stream()
                .map(m -> m.getUser().getId())
                .sorted()
                .collect(Collectors.toList());
        return ParentSlot.ofPosition(ids.indexOf(member.getUser().getId()));
    }

    private FamilyResponse toResponse(Family family, boolean withDetails) {
        FamilyResponse.FamilyResponseBuilder builder = FamilyResponse.builder()
                .id(family.getId())
                .name(family.getName())
                .ownerId(family.getOwnerId())
                .shareCode(family.getShareCode())
                .shareCodeUpdatedAt(family.getShareCodeUpdatedAt())
                .photoUrl(family.getPhotoUrl())
                .createdAt(family.getCreatedAt())
                .members(memberResponses(family))
                .children(family.getChildren().stream().map(ChildResponse::from).collect(Collectors.toList()));

        if (withDetails) {
            builder.pendingInvites(familyInviteRepository
                            .findByFamilyIdAndStatus(family.getId(), FamilyInvite.Status.PENDING).stream()
                            .map(InviteResponse::from)
                            .collect(Collectors.toList()))
                    .custodySchedule(custodyScheduleRepository.findByFamilyId(family.getId())
                            .map(CustodyScheduleResponse::from)
                            .orElse(null));
        }
        return builder.build();
    }

    private static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase();
    }
}
