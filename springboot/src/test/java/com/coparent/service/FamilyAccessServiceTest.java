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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FamilyAccessService")
class FamilyAccessServiceTest {

    private static final Long FAMILY_ID = 1L;

    @Mock
    private FamilyRepository familyRepository;
    @Mock
    private FamilyMemberRepository familyMemberRepository;
    @Mock
    private UserRepository userRepository;

    private final CoparentProperties properties = new CoparentProperties();
    private FamilyAccessService service;

    private final User carol = User.builder().id("carol").email("carol@example.com").build();

    @BeforeEach
    void setUp() {
        service = new FamilyAccessService(familyRepository, familyMemberRepository, userRepository, properties);
    }

    @Nested
    @DisplayName("requireMember")
    class RequireMember {

        @Test
        @DisplayName("unknown families are not found")
        void unknownFamily() {
            when(familyRepository.findById(FAMILY_ID)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.requireMember(FAMILY_ID, carol))
                    .isInstanceOf(NotFoundException.class)
                    .extracting("code").isEqualTo("family-not-found");
        }

        @Test
        @DisplayName("non-members are rejected by default")
        void nonMemberRejected() {
            when(familyRepository.findById(FAMILY_ID))
                    .thenReturn(Optional.of(Family.builder().id(FAMILY_ID).ownerId("alice").build()));
            when(familyMemberRepository.existsByFamilyIdAndUserId(FAMILY_ID, "carol")).thenReturn(false);

            assertThatThrownBy(() -> service.requireMember(FAMILY_ID, carol))
                    .isInstanceOf(ForbiddenException.class)
                    .extracting("code").isEqualTo("not-family-member");
            verify(familyMemberRepository, never()).save(any());
        }

        @Test
        @DisplayName("auto-enrolment adds the caller as a member")
        void autoEnroll() {
            properties.getFamily().setAutoEnroll(true);
            Family family = Family.builder().id(FAMILY_ID).ownerId("alice").build();
            when(familyRepository.findById(FAMILY_ID)).thenReturn(Optional.of(family));
            when(familyMemberRepository.existsByFamilyIdAndUserId(FAMILY_ID, "carol")).thenReturn(false);

            assertThat(service.requireMember(FAMILY_ID, carol)).isSameAs(family);

            ArgumentCaptor<FamilyMember> captor = ArgumentCaptor.forClass(FamilyMember.class);
            verify(familyMemberRepository).save(captor.capture());
            assertThat(captor.getValue().getRole()).isEqualTo(FamilyMember.Role.MEMBER);
            assertThat(captor.getValue().getUser()).isSameAs(carol);
        }

        @Test
        @DisplayName("owner-only operations refuse plain members")
        void ownerOnly() {
            when(familyRepository.findById(FAMILY_ID))
                    .thenReturn(Optional.of(Family.builder().id(FAMILY_ID).ownerId("alice").build()));
            when(familyMemberRepository.existsByFamilyIdAndUserId(FAMILY_ID, "carol")).thenReturn(true);

            assertThatThrownBy(() -> service.requireOwner(FAMILY_ID, carol))
                    .isInstanceOf(ForbiddenException.class)
                    .extracting("code").isEqualTo("forbidden");
        }
    }

    @Nested
    @DisplayName("parent slots")
    class Slots {

        @BeforeEach
        void members() {
            when(familyMemberRepository.findUserIdsByFamilyId(FAMILY_ID)).thenReturn(List.of("alice", "bob"));
        }

        @Test
        @DisplayName("parent1 is the lowest member id")
        void slotResolution() {
            assertThat(service.resolveTargetUids(FAMILY_ID, ParentSlot.PARENT1)).containsExactly("alice");
            assertThat(service.resolveTargetUids(FAMILY_ID, ParentSlot.PARENT2)).containsExactly("bob");
            assertThat(service.resolveTargetUids(FAMILY_ID, ParentSlot.BOTH)).containsExactly("alice", "bob");
        }

        @Test
        @DisplayName("the other parent is looked up by id")
        void otherParent() {
            User bob = User.builder().id("bob").email("bob@example.com").build();
            when(userRepository.findById("bob")).thenReturn(Optional.of(bob));

            assertThat(service.otherParent(FAMILY_ID, "alice")).contains(bob);
        }
    }

    @Test
    @DisplayName("a slot nobody holds yet targets every member")
    void unfilledSlotTargetsEveryone() {
        when(familyMemberRepository.findUserIdsByFamilyId(FAMILY_ID)).thenReturn(List.of("alice"));

        assertThat(service.resolveTargetUids(FAMILY_ID, ParentSlot.PARENT2)).containsExactly("alice");
    }
}
