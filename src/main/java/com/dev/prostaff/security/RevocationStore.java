package com.dev.prostaff.security;

import java.time.Instant;

/**
 * Revoked token ids, kept until the token's own expiry. Implementations are safe for
 * concurrent use without external locking: once {@link #revoke} has returned, every later
 * {@link #isRevoked} for the same id answers {@code true} until {@code expiresAt}.
 */
public interface RevocationStore {

    boolean isRevoked(String tokenId);

    /**
     * Idempotent. Revoking a token that is already past {@code expiresAt} records nothing,
     * since such a token is rejected on expiry alone.
     *
     * @return {@code true} only if this call created the revocation record
     */
    boolean revoke(String tokenId, Instant expiresAt);
}
