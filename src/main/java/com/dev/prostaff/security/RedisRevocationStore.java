package com.dev.prostaff.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Slf4j
public class RedisRevocationStore implements RevocationStore {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Clock clock;

    public RedisRevocationStore(StringRedisTemplate redisTemplate, String keyPrefix, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
        this.clock = clock;
    }

    @Override
    public boolean isRevoked(String tokenId) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(key(tokenId)));
    }

    @Override
    public boolean revoke(String tokenId, Instant expiresAt) {
        Duration ttl = Duration.between(clock.instant(), expiresAt);
        if (ttl.isZero() || ttl.isNegative()) {
            log.debug("Skipping revocation of already expired token {}", tokenId);
            return false;
        }
        Boolean created = redisTemplate.opsForValue().setIfAbsent(key(tokenId), expiresAt.toString(), ttl);
        return Boolean.TRUE.equals(created);
    }

    private String key(String tokenId) {
        return keyPrefix + tokenId;
    }
}
