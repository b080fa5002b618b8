package com.dev.prostaff.security;

public record TokenPair(
        String accessToken,
        String refreshToken,
        long expiresIn,
        String tokenType
) {

    public static TokenPair bearer(String accessToken, String refreshToken, long expiresIn) {
        return new TokenPair(accessToken, refreshToken, expiresIn, "Bearer");
    }
}
