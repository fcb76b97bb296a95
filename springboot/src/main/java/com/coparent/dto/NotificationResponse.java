package com.coparent.dto;

import com.coparent.entity.Notification;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class NotificationResponse {
    private Long id;
    private Long familyId;
    private Notification.Type type;
    private String title;
    private String body;
    private Notification.Priority priority;
    private Map<String, String> data;
    private String actionUrl;
    private Boolean read;
    private Instant createdAt;

    public static NotificationResponse from(Notification notification) {
        return NotificationResponse.builder()
                .id(notification.getId())
                .familyId(notification.getFamilyId())
                .type(notification.getType())
                .title(notification.getTitle())
                .body(notification.getBody())
                .priority(notification.getPriority())
                .data(new HashMap<>(notification.getData()))
                .actionUrl(notification.getActionUrl())
                .read(notification.getRead())
                .createdAt(notification.getCreatedAt())
                .build();
    }
}
