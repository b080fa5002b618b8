package com.dev.prostaff.security;

public class TokenInvalidException extends SessionAuthenticationException {

    public TokenInvalidException(String message) {
        super(AuthFailure.TOKEN_INVALID, message);
    }
}
