package com.coparent.service.push;

import com.coparent.entity.PushToken;
import com.coparent.repository.FamilyMemberRepository;
import com.coparent.repository.PushTokenRepository;
import com.coparent.service.AfterCommit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PushNotificationService {

    private final PushGateway pushGateway;
    private final PushTokenRepository pushTokenRepository;
    private final FamilyMemberRepository familyMemberRepository;

    /**
     * Sends a push and propagates gateway failures. Tokens the gateway reports
     * as invalid are removed.
     */
    public PushResult deliver(Collection<String> userIds, String title, String body, Map<String, String> data) {
        if (userIds == null || userIds.isEmpty()) {
            return PushResult.empty();
        }
        List<String> tokens = pushTokenRepository.findByUserIdIn(userIds).stream()
                .map(PushToken::getToken)
                .distinct()
                .collect(Collectors.toList());
        if (tokens.isEmpty()) {
            log.debug("No push tokens registered for users {}", userIds);
            return PushResult.empty();
        }

        PushResult result = pushGateway.send(PushMessage.builder()
                .tokens(tokens)
                .title(title)
                .body(body)
                .data(data == null ? Map.of() : data)
                .build());

        if (result.getInvalidTokens() != null && !result.getInvalidTokens().isEmpty()) {
            int removed = pushTokenRepository.deleteByTokenIn(result.getInvalidTokens());
            log.info("Pruned {} invalid push token(s)", removed);
        }
        return result;
    }

    /**
     * Best-effort push, sent once the surrounding transaction has committed.
     */
    public void notifyUsers(Collection<String> userIds, String title, String body, Map<String, String> data) {
        AfterCommit.run(() -> {
            try {
                deliver(userIds, title, body, data);
            } catch (Exception e) {
                log.error("Failed to send push '{}' to {}", title, userIds, e);
            }
        });
    }

    public void notifyFamilyExcept(Long familyId, String excludedUserId, String title, String body,
                                   Map<String, String> data) {
        List<String> recipients = familyMemberRepository.findUserIdsByFamilyId(familyId).stream()
                .filter(id -> !id.equals(excludedUserId))
                .collect(Collectors.toList());
        notifyUsers(recipients, title, body, data);
    }
}
