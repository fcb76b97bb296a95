package com.coparent.controller;

import com.coparent.dto.CreateNotificationRequest;
import com.coparent.dto.MarkReadRequest;
import com.coparent.dto.NotificationListResponse;
import com.coparent.dto.NotificationPreferencesDto;
import com.coparent.dto.NotificationResponse;
import com.coparent.service.CurrentUserService;
import com.coparent.service.NotificationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final CurrentUserService currentUserService;
    private final NotificationService notificationService;

    @GetMapping
    public ResponseEntity<NotificationListResponse> list(@RequestParam(required = false) Long familyId,
                                                         @RequestParam(defaultValue = "false") boolean unreadOnly,
                                                         @RequestParam(required = false) Integer limit,
                                                         @RequestParam(required = false) Integer offset,
                                                         Authentication authentication) {
        return ResponseEntity.ok(notificationService.list(currentUserService.resolve(authentication),
                familyId, unreadOnly, limit, offset));
    }

    @GetMapping("/unread-count")
    public ResponseEntity<Map<String, Long>> unreadCount(@RequestParam(required = false) Long familyId,
                                                         Authentication authentication) {
        long count = notificationService.unreadCount(currentUserService.resolve(authentication), familyId);
        return ResponseEntity.ok(Map.of("count", count));
    }

    @PostMapping
    public ResponseEntity<NotificationResponse> create(@Valid @RequestBody CreateNotificationRequest request,
                                                       Authentication authentication) {
        return notificationService.create(currentUserService.resolve(authentication), request)
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/read")
    public ResponseEntity<Map<String, Integer>> markRead(@Valid @RequestBody MarkReadRequest request,
                                                         Authentication authentication) {
        int updated = notificationService.markRead(currentUserService.resolve(authentication),
                request.getNotificationIds());
        return ResponseEntity.ok(Map.of("updated", updated));
    }

    @PostMapping("/read-all")
    public ResponseEntity<Map<String, Integer>> markAllRead(@RequestParam(required = false) Long familyId,
                                                            Authentication authentication) {
        int updated = notificationService.markAllRead(currentUserService.resolve(authentication), familyId);
        return ResponseEntity.ok(Map.of("updated", updated));
    }

    @DeleteMapping("/{notificationId}")
    public ResponseEntity<Void> delete(@PathVariable Long notificationId, Authentication authentication) {
        notificationService.delete(currentUserService.resolve(authentication), notificationId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Integer>> deleteAll(@RequestParam(required = false) Long familyId,
                                                          Authentication authentication) {
        int deleted = notificationService.deleteAll(currentUserService.resolve(authentication), familyId);
        return ResponseEntity.ok(Map.of("deleted", deleted));
    }

    @GetMapping("/preferences")
    public ResponseEntity<NotificationPreferencesDto> preferences(Authentication authentication) {
        return ResponseEntity.ok(notificationService.getPreferences(currentUserService.resolve(authentication)));
    }

    @PutMapping("/preferences")
    public ResponseEntity<NotificationPreferencesDto> updatePreferences(
            @Valid @RequestBody NotificationPreferencesDto request,
            Authentication authentication) {
        return ResponseEntity.ok(notificationService.updatePreferences(currentUserService.resolve(authentication),
                request));
    }
}
