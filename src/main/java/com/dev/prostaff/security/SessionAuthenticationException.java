package com.dev.prostaff.security;

public abstract class SessionAuthenticationException extends RuntimeException {

    private final AuthFailure failure;

    protected SessionAuthenticationException(AuthFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public AuthFailure failure() {
        return failure;
    }

    public String errorCode() {
        return failure.name();
    }
}
