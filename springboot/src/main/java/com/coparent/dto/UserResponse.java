package com.coparent.dto;

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
public class UserResponse {
    private String id;
    private String email;
    private String fullName;
    private String photoUrl;
    private String calendarColor;
    private Long activeFamilyId;
    private Instant createdAt;

    public static UserResponse from(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .fullName(user.getFullName())
                .photoUrl(user.getPhotoUrl())
                .calendarColor(user.getCalendarColor())
                .activeFamilyId(user.getActiveFamilyId())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
