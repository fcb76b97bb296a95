package com.coparent.dto;

import com.coparent.entity.CustodyOverride;
import com.coparent.entity.ParentSlot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CustodyOverrideResponse {
    private Long id;
    private Long familyId;
    private String name;
    private CustodyOverride.Type type;
    private Instant startDate;
    private Instant endDate;
    private Map<LocalDate, ParentSlot> assignments;
    private String note;
    private CustodyOverride.Status status;
    private String requestedById;
    private String requestedByName;
    private String requestedToId;
    private String requestedToName;
    private String responseNote;
    private String respondedById;
    private Instant respondedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public static CustodyOverrideResponse from(CustodyOverride override) {
        return CustodyOverrideResponse.builder()
                .id(override.getId())
                .familyId(override.getFamilyId())
                .name(override.getName())
                .type(override.getType())
                .startDate(override.getStartDate())
                .endDate(override.getEndDate())
                .assignments(new TreeMap<>(override.getAssignments()))
                .note(override.getNote())
                .status(override.getStatus())
                .requestedById(override.getRequestedById())
                .requestedByName(override.getRequestedByName())
                .requestedToId(override.getRequestedToId())
                .requestedToName(override.getRequestedToName())
                .responseNote(override.getResponseNote())
                .respondedById(override.getRespondedById())
                .respondedAt(override.getRespondedAt())
                .createdAt(override.getCreatedAt())
                .updatedAt(override.getUpdatedAt())
                .build();
    }
}
