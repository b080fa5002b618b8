package com.dev.prostaff.security;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Slf4j
public class InMemoryRevocationStore implements RevocationStore {

    // tokenId -> expiresAt
    private final ConcurrentMap<String, Instant> revoked = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRevocationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean isRevoked(String tokenId) {
        Instant expiresAt = revoked.get(tokenId);
        return expiresAt != null && clock.instant().isBefore(expiresAt);
    }

    @Override
    public boolean revoke(String tokenId, Instant expiresAt) {
        if (!clock.instant().isBefore(expiresAt)) {
            log.debug("Skipping revocation of already expired token {}", tokenId);
            return false;
        }
        return revoked.putIfAbsent(tokenId, expiresAt) == null;
    }

    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, Instant> entry : revoked.entrySet()) {
            if (!now.isBefore(entry.getValue()) && revoked.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Purged {} expired revocation records", removed);
        }
        return removed;
    }

    int size() {
        return revoked.size();
    }
}
