package com.dev.prostaff.security;

public class TokenRevokedException extends SessionAuthenticationException {

    public TokenRevokedException(String message) {
        super(AuthFailure.TOKEN_REVOKED, message);
    }
}
