package com.dev.prostaff.domain;

import java.util.Locale;

public enum Role {
    OWNER,
    ADMIN,
    COACH,
    ANALYST,
    VIEWER;

    public boolean isAdminOrOwner() {
        return this == OWNER || this == ADMIN;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Role fromWireName(String value) {
        return Role.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
