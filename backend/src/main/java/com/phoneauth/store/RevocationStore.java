package com.phoneauth.store;

import java.time.Instant;
import java.util.UUID;

/**
 * Denylist of refresh token ids.
 *
 * An entry only needs to outlive the token it blocks: once {@code expiresAt}
 * passes, the token fails verification on expiry alone and the entry may go.
 */
public interface RevocationStore {

    /**
     * Revoke a token id. Idempotent.
     *
     * This is also the atomic check-and-revoke of refresh rotation: among
     * concurrent callers revoking the same id, exactly one receives {@code true}.
     *
     * @param tokenId   the token id (jti)
     * @param expiresAt natural expiry of the token
     * @return true if this call inserted the entry, false if it was already revoked
     */
    boolean revoke(UUID tokenId, Instant expiresAt);

    /**
     * @param tokenId the token id (jti)
     * @return true if the id is revoked and the entry has not expired
     */
    boolean isRevoked(UUID tokenId);

    /**
     * Remove entries whose token has expired.
     *
     * @return number of entries removed
     */
    long evictExpired();
}
