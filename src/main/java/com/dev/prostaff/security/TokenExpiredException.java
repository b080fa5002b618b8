package com.dev.prostaff.security;

public class TokenExpiredException extends SessionAuthenticationException {

    public TokenExpiredException(String message) {
        super(AuthFailure.TOKEN_EXPIRED, message);
    }
}
