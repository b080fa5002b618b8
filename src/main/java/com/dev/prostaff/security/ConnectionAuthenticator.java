package com.dev.prostaff.security;

import com.dev.prostaff.store.UserRecord;
import com.dev.prostaff.store.UserStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@Component
public class ConnectionAuthenticator {

    private final SessionService sessionService;
    private final UserStore userStore;

    public ConnectionAuthenticator(SessionService sessionService, UserStore userStore) {
        this.sessionService = sessionService;
        this.userStore = userStore;
    }

    public AuthenticationResult authenticate(String token) {
        if (token == null || token.isBlank()) {
            return reject(AuthFailure.MISSING_TOKEN, "no token supplied");
        }

        TokenClaims claims;
        try {
            claims = sessionService.verify(token);
        } catch (SessionAuthenticationException e) {
            return reject(e.failure(), e.getMessage());
        }

        // refresh tokens never open interactive sessions
        if (!claims.isAccess()) {
            return reject(AuthFailure.WRONG_TOKEN_TYPE, "token type " + claims.getType().wireName());
        }

        Optional<UserRecord> found = userStore.findById(claims.getSubject());
        if (found.isEmpty()) {
            return reject(AuthFailure.USER_NOT_FOUND, "user " + claims.getSubject() + " not found");
        }
        UserRecord user = found.get();
        if (!user.hasOrganization()) {
            return reject(AuthFailure.NO_ORGANIZATION, "user " + user.id() + " has no organization");
        }
        if (claims.getOrganizationId() != null && !user.belongsTo(claims.getOrganizationId())) {
            return reject(AuthFailure.ORGANIZATION_MISMATCH, "user " + user.id() + " changed organization");
        }

        Identity identity = new Identity(user.id(), user.organizationId(), user.role());
        log.debug("Authenticated user={} org={}", identity.userId(), identity.organizationId());
        return AuthenticationResult.authenticated(identity);
    }

    private static AuthenticationResult reject(AuthFailure failure, String detail) {
        log.warn("Authentication rejected [{}]: {}", failure, detail);
        return AuthenticationResult.rejected(failure);
    }
}
