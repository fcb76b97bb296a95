package com.coparent.service;

import com.coparent.config.CoparentProperties;
import com.coparent.entity.Family;
import com.coparent.entity.FamilyMember;
import com.coparent.entity.ParentSlot;
import com.coparent.entity.User;
import com.coparent.exception.ForbiddenException;
import com.coparent.exception.NotFoundException;
import com.coparent.repository.FamilyMemberRepository;
import com.coparent.repository.FamilyRepository;
import com.coparent.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Membership checks for family-scoped operations and the positional parent slots.
 * Parent slots are derived from member ids sorted ascending: index 0 is
 * {@code parent1}, index 1 is {@code parent2}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FamilyAccessService {

    private final FamilyRepository familyRepository;
    private final FamilyMemberRepository familyMemberRepository;
    private final UserRepository userRepository;
    private final CoparentProperties properties;

    @Transactional(readOnly = true)
    public boolean isMember(Long familyId, String userId) {
        return familyMemberRepository.existsByFamilyIdAndUserId(familyId, userId);
    }

    /**
     * Ensures {@code user} belongs to the family. With auto-enrolment enabled a
     * missing membership is created instead of rejected.
     */
    @Transactional
    public Family requireMember(Long familyId, User user) {
        Family family = familyRepository.findById(familyId)
                .orElseThrow(() -> new NotFoundException("family-not-found", "Family not found"));

        if (!familyMemberRepository.existsByFamilyIdAndUserId(familyId, user.getId())) {
            if (!properties.getFamily().isAutoEnroll()) {
                throw new ForbiddenException("not-family-member", "You are not a member of this family");
            }
            familyMemberRepository.save(FamilyMember.builder()
                    .family(family)
                    .user(user)
                    .role(FamilyMember.Role.MEMBER)
                    .build());
            log.warn("Auto-enrolled user {} into family {}", user.getId(), familyId);
        }
        return family;
    }

    @Transactional
    public Family requireOwner(Long familyId, User user) {
        Family family = requireMember(familyId, user);
        if (!family.getOwnerId().equals(user.getId())) {
            throw new ForbiddenException("forbidden", "Only the family owner can do this");
        }
        return family;
    }

    @Transactional(readOnly = true)
    public List<String> memberIds(Long familyId) {
        return familyMemberRepository.findUserIdsByFamilyId(familyId);
    }

    // An unfilled slot falls back to every member so reminders still reach someone.
    public List<String> resolveTargetUids(Long familyId, ParentSlot slot) {
        List<String> ids = memberIds(familyId);
        if (slot == null || slot == ParentSlot.BOTH) {
            return ids;
        }
        int index = slot == ParentSlot.PARENT1 ? 0 : 1;
        return index < ids.size() ? List.of(ids.get(index)) : ids;
    }

    /**
     * The co-parent of {@code userId} in the family, if there is one.
     */
    @Transactional(readOnly = true)
    public Optional<User> otherParent(Long familyId, String userId) {
        return memberIds(familyId).stream()
                .filter(id -> !id.equals(userId))
                .findFirst()
                .flatMap(userRepository::findById);
    }
}
