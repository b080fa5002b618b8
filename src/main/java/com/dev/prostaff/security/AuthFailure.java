package com.dev.prostaff.security;

public enum AuthFailure {
    MISSING_TOKEN,
    TOKEN_EXPIRED,
    TOKEN_REVOKED,
    TOKEN_INVALID,
    WRONG_TOKEN_TYPE,
    USER_NOT_FOUND,
    NO_ORGANIZATION,
    ORGANIZATION_MISMATCH
}
