package com.dev.prostaff.security;

import com.dev.prostaff.config.JwtProperties;
import com.dev.prostaff.domain.Role;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;

@Component
public class TokenCodec {

    static final String CLAIM_ORGANIZATION = "organization_id";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_TYPE = "type";
    static final String CLAIM_EMAIL = "email";

    private final JwtProperties properties;
    private final Clock clock;
    private SecretKey signingKey;
    private JwtParser parser;

    public TokenCodec(JwtProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        this.signingKey = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parserBuilder()
                .requireIssuer(properties.issuer())
                .setSigningKey(signingKey)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    public String encode(TokenClaims draft) {
        return encode(draft, null);
    }

    public String encode(TokenClaims draft, Duration lifetime) {
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Duration ttl = lifetime != null ? lifetime : properties.accessTokenTtl();
        String tokenId = draft.getTokenId() != null ? draft.getTokenId() : UUID.randomUUID().toString();

        JwtBuilder builder = Jwts.builder()
                .setIssuer(properties.issuer())
                .setId(tokenId)
                .setSubject(draft.getSubject().toString())
                .claim(CLAIM_TYPE, draft.getType().wireName())
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(issuedAt.plus(ttl)));
        if (draft.getOrganizationId() != null) {
            builder.claim(CLAIM_ORGANIZATION, draft.getOrganizationId().toString());
        }
        if (draft.getRole() != null) {
            builder.claim(CLAIM_ROLE, draft.getRole().wireName());
        }
        if (draft.getEmail() != null) {
            builder.claim(CLAIM_EMAIL, draft.getEmail());
        }
        return builder.signWith(signingKey, SignatureAlgorithm.HS256).compact();
    }

    public TokenClaims decode(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenInvalidException("Token is missing");
        }
        Claims claims;
        try {
            claims = parser.parseClaimsJws(token).getBody();
        } catch (ExpiredJwtException e) {
            throw new TokenExpiredException("Token has expired");
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenInvalidException("Invalid token: " + e.getMessage());
        }
        TokenClaims decoded = toClaims(claims);
        if (!clock.instant().isBefore(decoded.getExpiresAt())) {
            throw new TokenExpiredException("Token has expired");
        }
        return decoded;
    }

    private TokenClaims toClaims(Claims claims) {
        try {
            String organization = claims.get(CLAIM_ORGANIZATION, String.class);
            String role = claims.get(CLAIM_ROLE, String.class);
            Date issuedAt = claims.getIssuedAt();
            return TokenClaims.builder()
                    .subject(UUID.fromString(required(claims.getSubject(), "sub")))
                    .organizationId(organization != null ? UUID.fromString(organization) : null)
                    .role(role != null ? Role.fromWireName(role) : null)
                    .email(claims.get(CLAIM_EMAIL, String.class))
                    .type(TokenType.fromWireName(claims.get(CLAIM_TYPE, String.class)))
                    .tokenId(required(claims.getId(), "jti"))
                    .issuedAt(issuedAt != null ? issuedAt.toInstant() : null)
                    .expiresAt(required(claims.getExpiration(), "exp").toInstant())
                    .build();
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenInvalidException("Invalid token: " + e.getMessage());
        }
    }

    private static <T> T required(T value, String claim) {
        if (value == null || (value instanceof String text && text.isBlank())) {
            throw new IllegalArgumentException("Missing claim '" + claim + "'");
        }
        return value;
    }
}
