package com.coparent.service;

import com.coparent.dto.CreateCustodyOverrideRequest;
import com.coparent.dto.CustodyOverrideResponse;
import com.coparent.dto.RespondCustodyOverrideRequest;
import com.coparent.entity.CustodyOverride;
import com.coparent.entity.Family;
import com.coparent.entity.ParentSlot;
import com.coparent.entity.User;
import com.coparent.exception.ConflictException;
import com.coparent.exception.ForbiddenException;
import com.coparent.exception.InvalidStateException;
import com.coparent.exception.NotFoundException;
import com.coparent.exception.ValidationException;
import com.coparent.repository.CustodyOverrideRepository;
import com.coparent.service.push.PushNotificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CustodyOverrideService")
class CustodyOverrideServiceTest {

    private static final Long FAMILY_ID = 7L;
    private static final Long OVERRIDE_ID = 21L;
    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");
    private static final Instant START = Instant.parse("2024-07-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-07-14T23:59:59Z");

    @Mock
    private CustodyOverrideRepository custodyOverrideRepository;
    @Mock
    private FamilyAccessService familyAccessService;
    @Mock
    private FamilyEventPublisher eventPublisher;
    @Mock
    private PushNotificationService pushNotificationService;

    private CustodyOverrideService service;

    private final User alice = User.builder().id("alice").email("alice@example.com").fullName("Alice").build();
    private final User bob = User.builder().id("bob").email("bob@example.com").fullName("Bob").build();

    @BeforeEach
    void setUp() {
        service = new CustodyOverrideService(custodyOverrideRepository, familyAccessService, eventPublisher,
                pushNotificationService, Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(familyAccessService.requireMember(eq(FAMILY_ID), any(User.class)))
                .thenReturn(Family.builder().id(FAMILY_ID).build());
        lenient().when(custodyOverrideRepository.save(any(CustodyOverride.class))).thenAnswer(invocation -> {
            CustodyOverride override = invocation.getArgument(0);
            override.setId(OVERRIDE_ID);
            return override;
        });
        lenient().when(custodyOverrideRepository.saveAndFlush(any(CustodyOverride.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static CreateCustodyOverrideRequest vacation() {
        return CreateCustodyOverrideRequest.builder()
                .name("  Summer at the lake ")
                .type(CustodyOverride.Type.VACATION)
                .startDate(START)
                .endDate(END)
                .assignments(Map.of(LocalDate.of(2024, 7, 1), ParentSlot.PARENT1,
                        LocalDate.of(2024, 7, 2), ParentSlot.PARENT1))
                .note("   ")
                .build();
    }

    private CustodyOverride stored(CustodyOverride.Status status) {
        CustodyOverride override = CustodyOverride.builder()
                .id(OVERRIDE_ID)
                .familyId(FAMILY_ID)
                .type(CustodyOverride.Type.HOLIDAY)
                .startDate(START)
                .endDate(END)
                .assignments(new HashMap<>(Map.of(LocalDate.of(2024, 7, 1), ParentSlot.PARENT2)))
                .status(status)
                .requestedById("alice")
                .requestedByName("Alice")
                .requestedToId("bob")
                .requestedToName("Bob")
                .build();
        when(custodyOverrideRepository.findByIdAndFamilyId(OVERRIDE_ID, FAMILY_ID)).thenReturn(Optional.of(override));
        return override;
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("is pending for the co-parent and notifies them")
        void pendingWithCoParent() {
            when(familyAccessService.otherParent(FAMILY_ID, "alice")).thenReturn(Optional.of(bob));

            CustodyOverrideResponse response = service.create(FAMILY_ID, alice, vacation());

            assertThat(response.getStatus()).isEqualTo(CustodyOverride.Status.PENDING);
            assertThat(response.getRequestedToId()).isEqualTo("bob");
            assertThat(response.getName()).isEqualTo("Summer at the lake");
            assertThat(response.getNote()).isNull();
            assertThat(response.getAssignments()).containsEntry(LocalDate.of(2024, 7, 1), ParentSlot.PARENT1);
            verify(eventPublisher).publish(eq(FAMILY_ID), eq(FamilyEventPublisher.CUSTODY_OVERRIDE_CREATED),
                    any(), eq("alice"));
            verify(pushNotificationService).notifyUsers(eq(List.of("bob")), anyString(), anyString(), anyMap());
        }

        @Test
        @DisplayName("is approved at once without a co-parent")
        void approvedWhenAlone() {
            when(familyAccessService.otherParent(FAMILY_ID, "alice")).thenReturn(Optional.empty());

            CustodyOverrideResponse response = service.create(FAMILY_ID, alice, vacation());

            assertThat(response.getStatus()).isEqualTo(CustodyOverride.Status.APPROVED);
            assertThat(response.getRequestedToId()).isNull();
            verifyNoInteractions(pushNotificationService);
        }

        @Test
        @DisplayName("is approved at once when approval is not requested")
        void approvedWhenNotRequested() {
            when(familyAccessService.otherParent(FAMILY_ID, "alice")).thenReturn(Optional.of(bob));
            CreateCustodyOverrideRequest request = vacation();
            request.setRequestApproval(false);

            CustodyOverrideResponse response = service.create(FAMILY_ID, alice, request);

            assertThat(response.getStatus()).isEqualTo(CustodyOverride.Status.APPROVED);
            assertThat(response.getRequestedToId()).isNull();
        }

        @Test
        @DisplayName("rejects an overlap with a pending or approved override")
        void overlap() {
            when(custodyOverrideRepository.existsOverlapping(eq(FAMILY_ID), anyCollection(), eq(START), eq(END)))
                    .thenReturn(true);

            assertThatThrownBy(() -> service.create(FAMILY_ID, alice, vacation()))
                    .isInstanceOf(ConflictException.class)
                    .extracting("code").isEqualTo("custody-override-overlap");
            verify(custodyOverrideRepository, never()).save(any());
        }

        @Test
        @DisplayName("rejects an end before the start")
        void invertedRange() {
            CreateCustodyOverrideRequest request = vacation();
            request.setEndDate(START.minusSeconds(1));

            assertThatThrownBy(() -> service.create(FAMILY_ID, alice, request))
                    .isInstanceOf(ValidationException.class)
                    .extracting("code").isEqualTo("invalid-date-range");
        }

        @Test
        @DisplayName("rejects days assigned to both parents")
        void bothIsNotAnAssignment() {
            CreateCustodyOverrideRequest request = vacation();
            request.setAssignments(Map.of(LocalDate.of(2024, 7, 1), ParentSlot.BOTH));

            assertThatThrownBy(() -> service.create(FAMILY_ID, alice, request))
                    .isInstanceOf(ValidationException.class)
                    .extracting("code").isEqualTo("invalid-assignment");
        }
    }

    @Nested
    @DisplayName("respond")
    class Respond {

        @Test
        @DisplayName("approval by the requested parent is recorded and the requester notified")
        void approve() {
            stored(CustodyOverride.Status.PENDING);

            CustodyOverrideResponse response = service.respond(FAMILY_ID, bob, OVERRIDE_ID,
                    RespondCustodyOverrideRequest.builder().approve(true).responseNote(" ok ").build());

            assertThat(response.getStatus()).isEqualTo(CustodyOverride.Status.APPROVED);
            assertThat(response.getResponseNote()).isEqualTo("ok");
            assertThat(response.getRespondedById()).isEqualTo("bob");
            assertThat(response.getRespondedAt()).isEqualTo(NOW);
            verify(pushNotificationService).notifyUsers(eq(List.of("alice")), eq("Custody change approved"),
                    anyString(), anyMap());
        }

        @Test
        @DisplayName("rejection sets the rejected status")
        void reject() {
            stored(CustodyOverride.Status.PENDING);

            CustodyOverrideResponse response = service.respond(FAMILY_ID, bob, OVERRIDE_ID,
                    RespondCustodyOverrideRequest.builder().approve(false).build());

            assertThat(response.getStatus()).isEqualTo(CustodyOverride.Status.REJECTED);
        }

        @Test
        @DisplayName("only the requested parent may respond")
        void requesterCannotRespond() {
            stored(CustodyOverride.Status.PENDING);

            assertThatThrownBy(() -> service.respond(FAMILY_ID, alice, OVERRIDE_ID,
                    RespondCustodyOverrideRequest.builder().approve(true).build()))
                    .isInstanceOf(ForbiddenException.class)
                    .extracting("code").isEqualTo("custody-override-response-forbidden");
            verify(custodyOverrideRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("a decided override cannot be answered again")
        void notPending() {
            stored(CustodyOverride.Status.REJECTED);

            assertThatThrownBy(() -> service.respond(FAMILY_ID, bob, OVERRIDE_ID,
                    RespondCustodyOverrideRequest.builder().approve(true).build()))
                    .isInstanceOf(InvalidStateException.class)
                    .extracting("code").isEqualTo("custody-override-not-pending");
        }

        @Test
        @DisplayName("an unknown override is not found")
        void missing() {
            when(custodyOverrideRepository.findByIdAndFamilyId(OVERRIDE_ID, FAMILY_ID)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.respond(FAMILY_ID, bob, OVERRIDE_ID,
                    RespondCustodyOverrideRequest.builder().approve(true).build()))
                    .isInstanceOf(NotFoundException.class)
                    .extracting("code").isEqualTo("custody-override-not-found");
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        @DisplayName("the requester withdraws a pending override")
        void cancelPending() {
            CustodyOverride override = stored(CustodyOverride.Status.PENDING);

            service.cancel(FAMILY_ID, alice, OVERRIDE_ID);

            verify(custodyOverrideRepository).delete(override);
            verify(eventPublisher).publish(eq(FAMILY_ID), eq(FamilyEventPublisher.CUSTODY_OVERRIDE_DELETED),
                    any(), eq("alice"));
        }

        @Test
        @DisplayName("the co-parent cannot cancel")
        void othersCannotCancel() {
            stored(CustodyOverride.Status.PENDING);

            assertThatThrownBy(() -> service.cancel(FAMILY_ID, bob, OVERRIDE_ID))
                    .isInstanceOf(ForbiddenException.class)
                    .extracting("code").isEqualTo("custody-override-cancel-forbidden");
            verify(custodyOverrideRepository, never()).delete(any(CustodyOverride.class));
        }

        @Test
        @DisplayName("approved overrides are deleted, not cancelled")
        void approvedCannotBeCancelled() {
            stored(CustodyOverride.Status.APPROVED);

            assertThatThrownBy(() -> service.cancel(FAMILY_ID, alice, OVERRIDE_ID))
                    .isInstanceOf(InvalidStateException.class)
                    .extracting("code").isEqualTo("custody-override-cancel-not-allowed");
        }
    }

    @Test
    @DisplayName("list filters by status and range")
    void listFilters() {
        CustodyOverride inRange = CustodyOverride.builder().id(1L).familyId(FAMILY_ID).startDate(START).endDate(END)
                .status(CustodyOverride.Status.APPROVED).requestedById("alice").build();
        CustodyOverride pending = CustodyOverride.builder().id(2L).familyId(FAMILY_ID).startDate(START).endDate(END)
                .status(CustodyOverride.Status.PENDING).requestedById("alice").build();
        CustodyOverride late = CustodyOverride.builder().id(3L).familyId(FAMILY_ID)
                .startDate(END.plusSeconds(60)).endDate(END.plusSeconds(86_400))
                .status(CustodyOverride.Status.APPROVED).requestedById("alice").build();
        when(custodyOverrideRepository.findByFamilyIdOrderByStartDateAsc(FAMILY_ID))
                .thenReturn(List.of(inRange, pending, late));

        assertThat(service.list(FAMILY_ID, alice, CustodyOverride.Status.APPROVED, START, END))
                .extracting(CustodyOverrideResponse::getId).containsExactly(1L);
        assertThat(service.list(FAMILY_ID, alice, null, null, null)).hasSize(3);
    }

    @Test
    @DisplayName("active queries approved overrides overlapping the window")
    void activeWindow() {
        when(custodyOverrideRepository.findOverlapping(FAMILY_ID, CustodyOverride.Status.APPROVED, START, END))
                .thenReturn(List.of());

        assertThat(service.active(FAMILY_ID, alice, START, END)).isEmpty();
        verify(custodyOverrideRepository).findOverlapping(FAMILY_ID, CustodyOverride.Status.APPROVED, START, END);
    }

    @Test
    @DisplayName("deleteAll reports how many rows went")
    void deleteAll() {
        when(custodyOverrideRepository.deleteByFamilyId(FAMILY_ID)).thenReturn(3L);

        assertThat(service.deleteAll(FAMILY_ID, alice)).isEqualTo(3L);
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publish(eq(FAMILY_ID), eq(FamilyEventPublisher.CUSTODY_OVERRIDE_DELETED),
                payload.capture(), eq("alice"));
        assertThat(payload.getValue()).isEqualTo(Map.of("deleted", 3L));
    }
}
