package com.dev.prostaff.security;

public enum ConnectionState {
    PENDING,
    AUTHENTICATED,
    REJECTED
}
