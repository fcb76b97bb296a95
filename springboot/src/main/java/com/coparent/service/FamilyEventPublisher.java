package com.coparent.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Broadcasts domain events to everyone subscribed to a family channel.
 * Messages go out after the surrounding transaction commits. Delivery is
 * best-effort: failures are logged and never reach the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FamilyEventPublisher {

    public static final String SWAP_CREATED = "swap:created";
    public static final String SWAP_UPDATED = "swap:updated";
    public static final String CUSTODY_UPDATED = "custody:updated";
    public static final String CUSTODY_DELETED = "custody:deleted";
    public static final String CUSTODY_OVERRIDE_CREATED = "custody-override:created";
    public static final String CUSTODY_OVERRIDE_UPDATED = "custody-override:updated";
    public static final String CUSTODY_OVERRIDE_DELETED = "custody-override:deleted";
    public static final String EVENT_CREATED = "event:created";
    public static final String EVENT_UPDATED = "event:updated";
    public static final String EVENT_DELETED = "event:deleted";
    public static final String TASK_CREATED = "task:created";
    public static final String TASK_UPDATED = "task:updated";
    public static final String TASK_DELETED = "task:deleted";
    public static final String FAMILY_UPDATED = "family:updated";
    public static final String MEMBER_JOINED = "family:member:joined";
    public static final String MEMBER_LEFT = "family:member:left";

    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    public static String familyTopic(Long familyId) {
        return "/topic/families/" + familyId;
    }

    /**
     * @param originUserId the acting user, so clients can ignore their own echo
     */
    public void publish(Long familyId, String event, Object payload, String originUserId) {
        AfterCommit.run(() -> send(familyId, event, payload, originUserId));
    }

    private void send(Long familyId, String event, Object payload, String originUserId) {
        try {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("event", event);
            envelope.put("payload", payload);
            envelope.put("originUserId", originUserId);
            envelope.put("sentAt", Instant.now(clock));

            messagingTemplate.convertAndSend(familyTopic(familyId), envelope);
            log.debug("Published {} to family {}", event, familyId);
        } catch (Exception e) {
            log.error("Failed to publish {} to family {}", event, familyId, e);
        }
    }
}
