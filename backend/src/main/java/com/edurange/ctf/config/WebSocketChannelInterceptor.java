package com.edurange.ctf.config;

import com.edurange.ctf.security.AuthenticatedUser;
import com.edurange.ctf.security.JwtTokenProvider;
import com.edurange.ctf.security.TokenRevocationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates JWT tokens on STOMP CONNECT frames and enforces ownership rules on
 * SUBSCRIBE frames.
 *
 * CONNECT: the token is sent in the STOMP Authorization header:
 * Authorization: Bearer <access_token>
 *
 * SUBSCRIBE rules:
 * /queue/instances/{userId}: only that user, or ADMIN
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketChannelInterceptor implements ChannelInterceptor {

    private static final Pattern INSTANCE_DEST = Pattern.compile("^/queue/instances/([^/]+)");

    private final JwtTokenProvider jwtTokenProvider;
    private final TokenRevocationService tokenRevocationService;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null)
            return message;

        if (StompCommand.CONNECT.equals(accessor.getCommand())) {
            handleConnect(accessor);
        } else if (StompCommand.SUBSCRIBE.equals(accessor.getCommand())) {
            handleSubscribe(accessor);
        }
        return message;
    }

    private void handleConnect(StompHeaderAccessor accessor) {
        String token = extractToken(accessor);
        if (token == null) {
            log.warn("WebSocket CONNECT rejected: no Authorization header");
            throw new IllegalArgumentException("Missing JWT token in WebSocket CONNECT");
        }

        AuthenticatedUser user = jwtTokenProvider.toAuthenticatedUser(token);
        if (user == null) {
            log.warn("WebSocket CONNECT rejected: invalid, expired or non-access JWT");
            throw new IllegalArgumentException("Invalid or expired JWT token");
        }

        String jti = jwtTokenProvider.extractAllClaims(token).getId();
        if (tokenRevocationService.isRevoked(jti)) {
            log.warn("WebSocket CONNECT rejected: revoked JWT");
            throw new IllegalArgumentException("JWT token has been revoked");
        }

        accessor.setUser(new UsernamePasswordAuthenticationToken(
                user, null, List.of(new SimpleGrantedAuthority("ROLE_" + user.getRole()))));
        log.debug("WebSocket CONNECT authenticated: userId={} role={}", user.getId(), user.getRole());
    }

    private void handleSubscribe(StompHeaderAccessor accessor) {
        String destination = accessor.getDestination();
        if (destination == null)
            return;

        AuthenticatedUser principal = extractPrincipal(accessor);
        if (principal == null) {
            log.warn("SUBSCRIBE rejected: no authenticated principal for destination {}", destination);
            throw new IllegalArgumentException("Not authenticated");
        }

        Matcher m = INSTANCE_DEST.matcher(destination);
        if (m.find()) {
            if (principal.isAdmin() || m.group(1).equals(principal.getId())) {
                return;
            }
            log.warn("SUBSCRIBE rejected: user {} cannot follow instances of {}", principal.getId(), m.group(1));
            throw new IllegalArgumentException("You may only subscribe to your own instance updates");
        }
    }

    private AuthenticatedUser extractPrincipal(StompHeaderAccessor accessor) {
        if (accessor.getUser() instanceof UsernamePasswordAuthenticationToken auth
                && auth.getPrincipal() instanceof AuthenticatedUser user) {
            return user;
        }
        return null;
    }

    private String extractToken(StompHeaderAccessor accessor) {
        String bearer = accessor.getFirstNativeHeader("Authorization");
        if (StringUtils.hasText(bearer) && bearer.startsWith("Bearer ")) {
            return bearer.substring(7);
        }
        // Some STOMP clients cannot set Authorization
        String token = accessor.getFirstNativeHeader("token");
        if (StringUtils.hasText(token)) {
            return token;
        }
        return null;
    }
}
