package com.dev.prostaff.realtime;

import com.dev.prostaff.security.Identity;

import java.util.Map;
import java.util.Optional;

public final class ConnectionAttributes {

    static final String IDENTITY = "prostaff.identity";

    private ConnectionAttributes() {
        // utility class
    }

    public static void bindIdentity(Map<String, Object> attributes, Identity identity) {
        attributes.put(IDENTITY, identity);
    }

    public static Optional<Identity> identityOf(Map<String, Object> attributes) {
        if (attributes == null) {
            return Optional.empty();
        }
        Object value = attributes.get(IDENTITY);
        return value instanceof Identity identity ? Optional.of(identity) : Optional.empty();
    }
}
