package com.dev.prostaff.security;

import java.util.Objects;

public final class AuthenticationResult {

    private final ConnectionState state;
    private final Identity identity;
    private final AuthFailure failure;

    private AuthenticationResult(ConnectionState state, Identity identity, AuthFailure failure) {
        this.state = state;
        this.identity = identity;
        this.failure = failure;
    }

    public static AuthenticationResult authenticated(Identity identity) {
        return new AuthenticationResult(ConnectionState.AUTHENTICATED, Objects.requireNonNull(identity), null);
    }

    public static AuthenticationResult rejected(AuthFailure failure) {
        return new AuthenticationResult(ConnectionState.REJECTED, null, Objects.requireNonNull(failure));
    }

    public ConnectionState state() {
        return state;
    }

    public boolean isAuthenticated() {
        return state == ConnectionState.AUTHENTICATED;
    }

    public Identity identity() {
        if (identity == null) {
            throw new IllegalStateException("Connection was rejected: " + failure);
        }
        return identity;
    }

    public AuthFailure failure() {
        return failure;
    }

    @Override
    public String toString() {
        return isAuthenticated()
                ? "AuthenticationResult[AUTHENTICATED user=" + identity.userId() + "]"
                : "AuthenticationResult[REJECTED " + failure + "]";
    }
}
