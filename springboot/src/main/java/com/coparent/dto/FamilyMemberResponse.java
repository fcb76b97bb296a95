package com.coparent.dto;

import com.coparent.entity.FamilyMember;
import com.coparent.entity.ParentSlot;
import com.coparent.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class FamilyMemberResponse {
    private String userId;
    private String fullName;
    private String email;
    private String photoUrl;
    private String calendarColor;
    private String role;
    private ParentSlot parentSlot;
    private Instant joinedAt;

    public static FamilyMemberResponse from(FamilyMember member, ParentSlot slot) {
        User user = member.getUser();
        return FamilyMemberResponse.builder()
                .userId(user.getId())
                .fullName(user.getFullName())
                .email(user.getEmail())
                .photoUrl(user.getPhotoUrl())
                .calendarColor(user.getCalendarColor())
                .role(member.getRole().name().toLowerCase())
                .parentSlot(slot)
                .joinedAt(member.getJoinedAt())
                .build();
    }
}
