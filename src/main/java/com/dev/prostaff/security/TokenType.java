package com.dev.prostaff.security;

import java.util.Locale;

public enum TokenType {
    ACCESS,
    REFRESH;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TokenType fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Missing token type");
        }
        return TokenType.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
