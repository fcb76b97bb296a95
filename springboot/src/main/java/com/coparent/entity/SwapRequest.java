package com.coparent.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

@Entity
@Table(name = "swap_requests", indexes = {
        @Index(name = "idx_swap_requests_family_status", columnList = "familyId,status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SwapRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long familyId;

    @Column(nullable = false, length = 128)
    private String requestedById;

    @Column
    private String requestedByName;

    @Column(nullable = false, length = 128)
    private String requestedToId;

    @Column
    private String requestedToName;

    @Column(nullable = false)
    private LocalDate originalDate;

    @Column
    private LocalDate proposedDate;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RequestType requestType = RequestType.SWAP;

    @Column(length = 500)
    private String reason;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Status status = Status.PENDING;

    // counter-offer
    @Column
    private LocalDate previousProposedDate;

    @Column(length = 500)
    private String counterNote;

    @Column(length = 128)
    private String counteredById;

    @Column
    private Instant counteredAt;

    // requester's answer to a counter-offer
    @Column
    private Instant requesterConfirmedAt;

    @Column(length = 500)
    private String counterResponseNote;

    @Column
    private Instant counterRespondedAt;

    // recipient's final answer
    @Column(length = 500)
    private String responseNote;

    @Column
    private Instant respondedAt;

    @Version
    private Long version;

    @CreationTimestamp
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public enum RequestType {
        SWAP("swap"),
        ONE_WAY("one-way");

        private final String value;

        RequestType(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static RequestType fromValue(String value) {
            for (RequestType type : values()) {
                if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown request type: " + value);
        }
    }

    public enum Status {
        PENDING,
        COUNTERED,
        FINAL_PENDING,
        APPROVED,
        REJECTED,
        CANCELLED;

        private static final Set<Status> TERMINAL = EnumSet.of(APPROVED, REJECTED, CANCELLED);

        public boolean isTerminal() {
            return TERMINAL.contains(this);
        }

        @JsonValue
        public String getValue() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Status fromValue(String value) {
            return Status.valueOf(value.trim().toUpperCase());
        }
    }
}
