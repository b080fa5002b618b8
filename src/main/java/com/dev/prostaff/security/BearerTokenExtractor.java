package com.dev.prostaff.security;

import java.util.Locale;
import java.util.Optional;

public final class BearerTokenExtractor {

    private static final String PREFIX = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= PREFIX.length()
                || !trimmed.toLowerCase(Locale.ROOT).startsWith(PREFIX)
                || !Character.isWhitespace(trimmed.charAt(PREFIX.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(PREFIX.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
