package com.dev.prostaff.security;

public class UserNotFoundException extends SessionAuthenticationException {

    public UserNotFoundException(String message) {
        super(AuthFailure.USER_NOT_FOUND, message);
    }
}
