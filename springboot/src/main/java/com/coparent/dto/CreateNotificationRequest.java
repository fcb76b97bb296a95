package com.coparent.dto;

import com.coparent.entity.Notification;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CreateNotificationRequest {
    @NotBlank
    @Size(max = 128)
    private String userId;

    private Long familyId;

    @NotNull
    private Notification.Type type;

    @NotBlank
    @Size(max = 200)
    private String title;

    @NotBlank
    @Size(max = 500)
    private String body;

    @Builder.Default
    private Notification.Priority priority = Notification.Priority.NORMAL;

    @Builder.Default
    private Map<String, String> data = new HashMap<>();

    @Size(max = 255)
    private String actionUrl;

    @Builder.Default
    private boolean sendPush = true;
}
