package com.dev.prostaff.security;

import com.dev.prostaff.domain.Role;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
public class TokenClaims {
    UUID subject;
    UUID organizationId;
    Role role;
    String email;
    TokenType type;
    String tokenId;
    Instant issuedAt;
    Instant expiresAt;

    public boolean isAccess() {
        return type == TokenType.ACCESS;
    }

    public boolean isRefresh() {
        return type == TokenType.REFRESH;
    }
}
