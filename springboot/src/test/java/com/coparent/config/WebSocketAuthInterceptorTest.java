package com.coparent.config;

import com.coparent.service.FamilyAccessService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.util.Collections;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("STOMP authentication and family channel access")
class WebSocketAuthInterceptorTest {

    @Mock
    private JwtDecoder jwtDecoder;
    @Mock
    private FamilyAccessService familyAccessService;
    @Mock
    private MessageChannel channel;

    private WebSocketAuthInterceptor interceptor;

    @BeforeEach
    void setUp() {
        interceptor = new WebSocketAuthInterceptor(jwtDecoder, familyAccessService);
    }

    private static Jwt jwt(String subject) {
        return Jwt.withTokenValue("token").header("alg", "RS256").subject(subject).build();
    }

    private static Message<byte[]> frame(StompHeaderAccessor accessor) {
        accessor.setSessionId("session-1");
        accessor.setLeaveMutable(true);
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }

    private static Message<byte[]> subscribe(String destination, String userId) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.SUBSCRIBE);
        accessor.setDestination(destination);
        if (userId != null) {
            accessor.setUser(new JwtAuthenticationToken(jwt(userId), Collections.emptyList()));
        }
        return frame(accessor);
    }

    @Test
    @DisplayName("CONNECT with a valid bearer token sets the session user")
    void connectAuthenticates() {
        when(jwtDecoder.decode("good-token")).thenReturn(jwt("alice"));
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.CONNECT);
        accessor.addNativeHeader("Authorization", "Bearer good-token");
        Message<byte[]> message = frame(accessor);

        interceptor.preSend(message, channel);

        StompHeaderAccessor result = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        assertThat(result.getUser()).isNotNull();
        assertThat(result.getUser().getName()).isEqualTo("alice");
    }

    @Test
    @DisplayName("CONNECT without a token is refused")
    void connectWithoutToken() {
        Message<byte[]> message = frame(StompHeaderAccessor.create(StompCommand.CONNECT));

        assertThatThrownBy(() -> interceptor.preSend(message, channel))
                .isInstanceOf(MessagingException.class)
                .hasMessageContaining("missing-token");
        verifyNoInteractions(jwtDecoder);
    }

    @Test
    @DisplayName("CONNECT with a token the decoder rejects is refused")
    void connectWithBadToken() {
        when(jwtDecoder.decode("expired")).thenThrow(new BadJwtException("expired"));
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.CONNECT);
        accessor.addNativeHeader("Authorization", "Bearer expired");
        Message<byte[]> message = frame(accessor);

        assertThatThrownBy(() -> interceptor.preSend(message, channel))
                .isInstanceOf(MessagingException.class)
                .hasMessageContaining("invalid-token");
    }

    @Test
    @DisplayName("members may subscribe to their family topic")
    void memberSubscribes() {
        when(familyAccessService.isMember(7L, "alice")).thenReturn(true);
        Message<byte[]> message = subscribe("/topic/families/7", "alice");

        assertThat(interceptor.preSend(message, channel)).isSameAs(message);
    }

    @Test
    @DisplayName("non-members are kept out of the family topic")
    void nonMemberRejected() {
        when(familyAccessService.isMember(7L, "mallory")).thenReturn(false);

        assertThatThrownBy(() -> interceptor.preSend(subscribe("/topic/families/7", "mallory"), channel))
                .isInstanceOf(MessagingException.class)
                .hasMessageContaining("not-family-member");
    }

    @Test
    @DisplayName("anonymous sessions cannot subscribe to a family topic")
    void anonymousRejected() {
        assertThatThrownBy(() -> interceptor.preSend(subscribe("/topic/families/7", null), channel))
                .isInstanceOf(MessagingException.class)
                .hasMessageContaining("unauthenticated");
    }

    @Test
    @DisplayName("other destinations pass through untouched")
    void otherDestinations() {
        Message<byte[]> message = subscribe("/user/queue/errors", "alice");

        assertThat(interceptor.preSend(message, channel)).isSameAs(message);
        verifyNoInteractions(familyAccessService);
    }
}
