package com.dev.prostaff.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RedisRevocationStore")
class RedisRevocationStoreTest {

    static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private RedisRevocationStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        store = new RedisRevocationStore(redisTemplate, "revoked-token:", Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("writes the id with SET NX and the remaining lifetime as TTL")
    void revokeUsesSetIfAbsentWithTtl() {
        Instant expiresAt = NOW.plus(Duration.ofMinutes(30));
        when(valueOperations.setIfAbsent("revoked-token:jti-1", expiresAt.toString(), Duration.ofMinutes(30)))
                .thenReturn(true);

        assertThat(store.revoke("jti-1", expiresAt)).isTrue();
    }

    @Test
    @DisplayName("reports false when the key already exists")
    void revokeReportsExistingKey() {
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);

        assertThat(store.revoke("jti-1", NOW.plusSeconds(60))).isFalse();
    }

    @Test
    @DisplayName("does not write expired tokens")
    void skipsExpiredTokens() {
        assertThat(store.revoke("jti-1", NOW.minusSeconds(1))).isFalse();
        verify(valueOperations, never()).setIfAbsent(anyString(), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("looks revocation up by prefixed key")
    void isRevokedChecksPrefixedKey() {
        when(redisTemplate.hasKey("revoked-token:jti-1")).thenReturn(true);
        when(redisTemplate.hasKey("revoked-token:jti-2")).thenReturn(false);

        assertThat(store.isRevoked("jti-1")).isTrue();
        assertThat(store.isRevoked("jti-2")).isFalse();
    }
}
