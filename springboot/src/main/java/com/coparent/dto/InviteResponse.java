package com.coparent.dto;

import com.coparent.entity.FamilyInvite;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class InviteResponse {
    private Long id;
    private String email;
    private String invitedById;
    private String invitedByName;
    private String status;
    private Instant createdAt;

    public static InviteResponse from(FamilyInvite invite) {
        return InviteResponse.builder()
                .id(invite.getId())
                .email(invite.getDisplayEmail() != null ? invite.getDisplayEmail() : invite.getEmail())
                .invitedById(invite.getInvitedById())
                .invitedByName(invite.getInvitedByName())
                .status(invite.getStatus().name().toLowerCase())
                .createdAt(invite.getCreatedAt())
                .build();
    }
}
