package com.coparent.dto;

import com.coparent.entity.SwapRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class SwapRequestResponse {
    private Long id;
    private Long familyId;
    private String requestedById;
    private String requestedByName;
    private String requestedToId;
    private String requestedToName;
    private LocalDate originalDate;
    private LocalDate proposedDate;
    private SwapRequest.RequestType requestType;
    private String reason;
    private SwapRequest.Status status;
    private LocalDate previousProposedDate;
    private String counterNote;
    private String counteredById;
    private Instant counteredAt;
    private Instant requesterConfirmedAt;
    private String counterResponseNote;
    private Instant counterRespondedAt;
    private String responseNote;
    private Instant respondedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public static SwapRequestResponse from(SwapRequest request) {
        return SwapRequestResponse.builder()
                .id(request.getId())
                .familyId(request.getFamilyId())
                .requestedById(request.getRequestedById())
                .requestedByName(request.getRequestedByName())
                .requestedToId(request.getRequestedToId())
                .requestedToName(request.getRequestedToName())
                .originalDate(request.getOriginalDate())
                .proposedDate(request.getProposedDate())
                .requestType(request.getRequestType())
                .reason(request.getReason())
                .status(request.getStatus())
                .previousProposedDate(request.getPreviousProposedDate())
                .counterNote(request.getCounterNote())
                .counteredById(request.getCounteredById())
                .counteredAt(request.getCounteredAt())
                .requesterConfirmedAt(request.getRequesterConfirmedAt())
                .counterResponseNote(request.getCounterResponseNote())
                .counterRespondedAt(request.getCounterRespondedAt())
                .responseNote(request.getResponseNote())
                .respondedAt(request.getRespondedAt())
                .createdAt(request.getCreatedAt())
                .updatedAt(request.getUpdatedAt())
                .build();
    }
}
