package com.dev.prostaff.realtime;

import com.dev.prostaff.security.IdentityAuthentication;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.support.DefaultHandshakeHandler;

import java.security.Principal;
import java.util.Map;

public class IdentityHandshakeHandler extends DefaultHandshakeHandler {

    @Override
    protected Principal determineUser(ServerHttpRequest request,
                                      WebSocketHandler wsHandler,
                                      Map<String, Object> attributes) {
        return ConnectionAttributes.identityOf(attributes)
                .map(identity -> (Principal) new IdentityAuthentication(identity, null))
                .orElseGet(() -> super.determineUser(request, wsHandler, attributes));
    }
}
