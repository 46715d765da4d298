package com.phoneauth.store;

import com.phoneauth.exception.AuthException;
import com.phoneauth.phone.PhoneNumber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Redis-backed fixed-window issuance limiter.
 *
 * Redis Key Structure:
 * - Counter: "auth:otp:rate:{phone}" → issuances in the current window, TTL = remaining window
 *
 * The acquire script returns {@code [allowed, count, windowRemainingMs]}; the
 * release script decrements the counter without touching its TTL.
 */
@Component
@Slf4j
public class RedisIssuanceRateLimiter implements IssuanceRateLimiter {

    static final String KEY_PREFIX = "auth:otp:rate:";

    private static final String ACQUIRE_LUA =
            "local count = tonumber(redis.call('GET', KEYS[1]) or '0') "
            + "local ttl = redis.call('PTTL', KEYS[1]) "
            + "if count >= tonumber(ARGV[1]) then "
            + "  if ttl < 0 then redis.call('PEXPIRE', KEYS[1], ARGV[2]) ttl = tonumber(ARGV[2]) end "
            + "  return {0, count, ttl} "
            + "end "
            + "count = redis.call('INCR', KEYS[1]) "
            + "if count == 1 or ttl < 0 then redis.call('PEXPIRE', KEYS[1], ARGV[2]) end "
            + "return {1, count, redis.call('PTTL', KEYS[1])}";

    private static final String RELEASE_LUA =
            "local count = tonumber(redis.call('GET', KEYS[1]) or '0') "
            + "if count > 0 then return redis.call('DECR', KEYS[1]) end "
            + "return 0";

    private final DefaultRedisScript<Long> releaseScript = new DefaultRedisScript<>(RELEASE_LUA, Long.class);

    @SuppressWarnings("rawtypes")
    private final DefaultRedisScript<List> acquireScript = new DefaultRedisScript<>(ACQUIRE_LUA, List.class);

    private final StringRedisTemplate redisStringTemplate;

    public RedisIssuanceRateLimiter(StringRedisTemplate redisStringTemplate) {
        this.redisStringTemplate = redisStringTemplate;
    }

    @Override
    public RateLimitDecision tryAcquire(PhoneNumber phone, int maxRequests, Duration window) {
        List<?> result;
        try {
            result = redisStringTemplate.execute(
                    acquireScript,
                    List.of(KEY_PREFIX + phone.value()),
                    String.valueOf(maxRequests),
                    String.valueOf(Math.max(1, window.toMillis()))
            );
        } catch (DataAccessException ex) {
            log.error("Redis rate limiter failed for {}: {}", phone, ex.getMessage());
            throw AuthException.storeUnavailable(ex);
        }

        if (result == null || result.size() < 3) {
            throw AuthException.storeUnavailable(
                    new IllegalStateException("Unexpected rate limiter reply: " + result));
        }

        boolean allowed = toLong(result.get(0)) == 1L;
        long count = toLong(result.get(1));
        if (allowed) {
            return RateLimitDecision.allowed(count);
        }
        long remainingMs = Math.max(1, toLong(result.get(2)));
        return RateLimitDecision.rejected(count, Duration.ofMillis(remainingMs));
    }

    @Override
    public void release(PhoneNumber phone) {
        Long count;
        try {
            count = redisStringTemplate.execute(releaseScript, List.of(KEY_PREFIX + phone.value()));
        } catch (DataAccessException ex) {
            log.error("Redis rate limiter release failed for {}: {}", phone, ex.getMessage());
            throw AuthException.storeUnavailable(ex);
        }
        log.debug("Released issuance slot for {} ({} left in window)", phone, count);
    }

    private static long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }
}
