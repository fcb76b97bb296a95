package com.coparent.config;

import com.coparent.service.FamilyAccessService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

import java.security.Principal;
import java.util.Collections;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Authenticates STOMP CONNECT frames with the bearer token and only lets family
 * members subscribe to their family's topic.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WebSocketAuthInterceptor implements ChannelInterceptor {

    private static final Pattern FAMILY_TOPIC = Pattern.compile("^/topic/families/(\\d+)$");

    private final JwtDecoder jwtDecoder;
    private final FamilyAccessService familyAccessService;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || accessor.getCommand() == null) {
            return message;
        }

        if (accessor.getCommand() == StompCommand.CONNECT) {
            Jwt jwt = decode(accessor);
            accessor.setUser(new JwtAuthenticationToken(jwt, Collections.emptyList()));
            log.debug("STOMP session {} authenticated as {}", accessor.getSessionId(), jwt.getSubject());
        } else if (accessor.getCommand() == StompCommand.SUBSCRIBE) {
            authorizeSubscription(accessor);
        }
        return message;
    }

    private Jwt decode(StompHeaderAccessor accessor) {
        String header = accessor.getFirstNativeHeader("Authorization");
        if (header == null || !header.startsWith("Bearer ")) {
            throw new MessagingException("missing-token");
        }
        try {
            return jwtDecoder.decode(header.substring("Bearer ".length()).trim());
        } catch (JwtException e) {
            log.warn("Rejected STOMP CONNECT for session {}: {}", accessor.getSessionId(), e.getMessage());
            throw new MessagingException("invalid-token", e);
        }
    }

    private void authorizeSubscription(StompHeaderAccessor accessor) {
        String destination = accessor.getDestination();
        if (destination == null) {
            return;
        }
        Matcher matcher = FAMILY_TOPIC.matcher(destination);
        if (!matcher.matches()) {
            return;
        }
        Principal user = accessor.getUser();
        if (user == null) {
            throw new MessagingException("unauthenticated");
        }
        Long familyId = Long.valueOf(matcher.group(1));
        if (!familyAccessService.isMember(familyId, user.getName())) {
            log.warn("User {} tried to join family channel {} without membership", user.getName(), familyId);
            throw new MessagingException("not-family-member");
        }
        log.debug("User {} joined family channel {}", user.getName(), familyId);
    }
}
