package com.coparent.dto;

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
public class FamilyResponse {
    private Long id;
    private String name;
    private String ownerId;
    private String shareCode;
    private Instant shareCodeUpdatedAt;
    private String photoUrl;
    private Instant createdAt;

    @Builder.Default
    private List<FamilyMemberResponse> members = new ArrayList<>();

    @Builder.Default
    private List<ChildResponse> children = new ArrayList<>();

    @Builder.Default
    private List<InviteResponse> pendingInvites = new ArrayList<>();

    private CustodyScheduleResponse custodySchedule;
}
