package com.coparent.dto;

import com.coparent.entity.CustodyApproval;
import com.coparent.entity.CustodySchedule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CustodyScheduleResponse {
    private Long id;
    private Long familyId;
    private String name;
    private CustodySchedule.Pattern pattern;
    private Instant startDate;
    private Instant endDate;
    private List<Integer> parent1Days;
    private List<Integer> parent2Days;
    private List<Integer> biweeklyAltParent1Days;
    private List<Integer> biweeklyAltParent2Days;
    private Boolean isActive;
    private PendingApproval pendingApproval;
    private Instant updatedAt;

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    public static class PendingApproval {
        private String name;
        private CustodySchedule.Pattern pattern;
        private Instant startDate;
        private List<Integer> parent1Days;
        private List<Integer> parent2Days;
        private String requestedById;
        private String requestedByName;
        private Instant requestedAt;
    }

    public static CustodyScheduleResponse from(CustodySchedule schedule) {
        CustodyApproval pending = schedule.getPendingApproval();
        return CustodyScheduleResponse.builder()
                .id(schedule.getId())
                .familyId(schedule.getFamilyId())
                .name(schedule.getName())
                .pattern(schedule.getPattern())
                .startDate(schedule.getStartDate())
                .endDate(schedule.getEndDate())
                .parent1Days(new ArrayList<>(schedule.getParent1Days()))
                .parent2Days(new ArrayList<>(schedule.getParent2Days()))
                .biweeklyAltParent1Days(new ArrayList<>(schedule.getBiweeklyAltParent1Days()))
                .biweeklyAltParent2Days(new ArrayList<>(schedule.getBiweeklyAltParent2Days()))
                .isActive(schedule.getIsActive())
                .pendingApproval(pending == null ? null : PendingApproval.builder()
                        .name(pending.getName())
                        .pattern(pending.getPattern())
                        .startDate(pending.getStartDate())
                        .parent1Days(new ArrayList<>(pending.getParent1Days()))
                        .parent2Days(new ArrayList<>(pending.getParent2Days()))
                        .requestedById(pending.getRequestedById())
                        .requestedByName(pending.getRequestedByName())
                        .requestedAt(pending.getRequestedAt())
                        .build())
                .updatedAt(schedule.getUpdatedAt())
                .build();
    }
}
