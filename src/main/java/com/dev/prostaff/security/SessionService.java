package com.dev.prostaff.security;

import com.dev.prostaff.config.JwtProperties;
import com.dev.prostaff.store.UserRecord;
import com.dev.prostaff.store.UserStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Service
public class SessionService {

    private final TokenCodec tokenCodec;
    private final RevocationStore revocationStore;
    private final UserStore userStore;
    private final JwtProperties properties;
    private final Clock clock;

    public SessionService(TokenCodec tokenCodec,
                          RevocationStore revocationStore,
                          UserStore userStore,
                          JwtProperties properties,
                          Clock clock) {
        this.tokenCodec = tokenCodec;
        this.revocationStore = revocationStore;
        this.userStore = userStore;
        this.properties = properties;
        this.clock = clock;
    }

    public TokenPair issueTokenPair(UserRecord user) {
        TokenClaims access = TokenClaims.builder()
                .subject(user.id())
                .organizationId(user.organizationId())
                .role(user.role())
                .email(user.email())
                .type(TokenType.ACCESS)
                .build();
        TokenClaims refresh = access.toBuilder()
                .email(null)
                .type(TokenType.REFRESH)
                .build();
        return TokenPair.bearer(
                tokenCodec.encode(access, properties.accessTokenTtl()),
                tokenCodec.encode(refresh, properties.refreshTokenTtl()),
                properties.accessTokenTtl().toSeconds());
    }

    public TokenClaims verify(String token) {
        TokenClaims claims = tokenCodec.decode(token);
        if (revocationStore.isRevoked(claims.getTokenId())) {
            throw new TokenRevokedException("Token has been revoked");
        }
        return claims;
    }

    /**
     * Exchanges a refresh token for a new pair and revokes it, making each refresh token
     * single-use. When two exchanges of the same token race, only the one that records the
     * revocation gets a new pair.
     */
    public TokenPair refresh(String refreshToken) {
        TokenClaims claims = verify(refreshToken);
        if (!claims.isRefresh()) {
            throw new TokenInvalidException("Invalid refresh token");
        }
        UserRecord user = userStore.findById(claims.getSubject())
                .orElseThrow(() -> new UserNotFoundException("User not found"));
        if (!revocationStore.revoke(claims.getTokenId(), claims.getExpiresAt())) {
            if (!clock.instant().isBefore(claims.getExpiresAt())) {
                throw new TokenExpiredException("Token has expired");
            }
            throw new TokenRevokedException("Token has been revoked");
        }
        log.info("Rotated refresh token for user={}", user.id());
        return issueTokenPair(user);
    }

    public boolean revokeToken(String token) {
        TokenClaims claims;
        try {
            claims = tokenCodec.decode(token);
        } catch (SessionAuthenticationException e) {
            log.warn("Failed to revoke token: {}", e.errorCode());
            return false;
        }
        return revocationStore.revoke(claims.getTokenId(), revocationExpiry(claims));
    }

    private Instant revocationExpiry(TokenClaims claims) {
        if (claims.getExpiresAt() != null) {
            return claims.getExpiresAt();
        }
        return clock.instant().plus(properties.accessTokenTtl());
    }
}
