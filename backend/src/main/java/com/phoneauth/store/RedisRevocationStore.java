package com.phoneauth.store;

import com.phoneauth.exception.AuthException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Redis-backed refresh token denylist.
 *
 * Redis Key Structure:
 * - Revoked ids: "auth:revoked" → sorted set, member = token id, score = token expiry (epoch ms)
 *
 * {@code ZADD NX} makes revoke a single atomic insert-if-absent. Reads ignore
 * entries whose score has passed, and {@link #evictExpired()} trims them with
 * one range delete.
 */
@Component
@Slf4j
public class RedisRevocationStore implements RevocationStore {

    static final String KEY = "auth:revoked";

    private final StringRedisTemplate redisStringTemplate;
    private final Clock clock;

    public RedisRevocationStore(StringRedisTemplate redisStringTemplate, Clock clock) {
        this.redisStringTemplate = redisStringTemplate;
        this.clock = clock;
    }

    @Override
    public boolean revoke(UUID tokenId, Instant expiresAt) {
        ZSetOperations<String, String> ops = redisStringTemplate.opsForZSet();
        Boolean added = run("revoke",
                () -> ops.addIfAbsent(KEY, tokenId.toString(), expiresAt.toEpochMilli()));
        boolean inserted = Boolean.TRUE.equals(added);
        log.debug("Revocation of token {}: {}", tokenId, inserted ? "inserted" : "already present");
        return inserted;
    }

    @Override
    public boolean isRevoked(UUID tokenId) {
        ZSetOperations<String, String> ops = redisStringTemplate.opsForZSet();
        Double expiresAtMs = run("isRevoked", () -> ops.score(KEY, tokenId.toString()));
        return expiresAtMs != null && expiresAtMs > clock.millis();
    }

    @Override
    public long evictExpired() {
        ZSetOperations<String, String> ops = redisStringTemplate.opsForZSet();
        long now = clock.millis();
        Long removed = run("evictExpired", () -> ops.removeRangeByScore(KEY, 0, now));
        return removed == null ? 0 : removed;
    }

    private <T> T run(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException ex) {
            log.error("Redis revocation store operation '{}' failed: {}", operation, ex.getMessage());
            throw AuthException.storeUnavailable(ex);
        }
    }
}
