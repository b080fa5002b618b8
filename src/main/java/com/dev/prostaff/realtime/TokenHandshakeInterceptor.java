package com.dev.prostaff.realtime;

import com.dev.prostaff.security.AuthenticationResult;
import com.dev.prostaff.security.ConnectionAuthenticator;
import com.dev.prostaff.security.Identity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;

@Slf4j
@Component
public class TokenHandshakeInterceptor implements HandshakeInterceptor {

    public static final String TOKEN_PARAMETER = "token";

    private final ConnectionAuthenticator connectionAuthenticator;

    public TokenHandshakeInterceptor(ConnectionAuthenticator connectionAuthenticator) {
        this.connectionAuthenticator = connectionAuthenticator;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {
        AuthenticationResult result = connectionAuthenticator.authenticate(tokenFrom(request.getURI()));
        if (!result.isAuthenticated()) {
            log.warn("[Cable] Connection rejected: {}", result.failure());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        Identity identity = result.identity();
        ConnectionAttributes.bindIdentity(attributes, identity);
        log.info("[Cable] Connected: user={} org={}", identity.userId(), identity.organizationId());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               Exception exception) {
        if (exception != null) {
            log.warn("[Cable] Handshake failed after authentication: {}", exception.getMessage());
        }
    }

    static String tokenFrom(URI uri) {
        if (uri == null) {
            return null;
        }
        String raw = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(TOKEN_PARAMETER);
        return raw == null ? null : UriUtils.decode(raw, StandardCharsets.UTF_8);
    }
}
