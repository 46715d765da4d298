package com.phoneauth.store;

import com.phoneauth.exception.AuthException;
import com.phoneauth.phone.PhoneNumber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Redis-backed OTP store.
 *
 * Redis Key Structure:
 * - OTP record: "auth:otp:{phone}" → hash of codeHash, expiresAt, attemptsRemaining, issuedAt
 *
 * Instants are stored as epoch milliseconds. Every write is a Lua script so that
 * replace, compare-and-delete and conditional decrement each execute atomically
 * on the server, whichever service instance issued them.
 */
@Component
@Slf4j
public class RedisOtpStore implements OtpStore {

    static final String KEY_PREFIX = "auth:otp:";

    private static final String FIELD_CODE_HASH = "codeHash";
    private static final String FIELD_EXPIRES_AT = "expiresAt";
    private static final String FIELD_ATTEMPTS = "attemptsRemaining";
    private static final String FIELD_ISSUED_AT = "issuedAt";

    private static final String SAVE_LUA =
            "redis.call('DEL', KEYS[1]) "
            + "redis.call('HSET', KEYS[1], 'codeHash', ARGV[1], 'expiresAt', ARGV[2], "
            + "'attemptsRemaining', ARGV[3], 'issuedAt', ARGV[4]) "
            + "redis.call('PEXPIRE', KEYS[1], ARGV[5]) "
            + "return 1";

    private static final String CONSUME_LUA =
            "if redis.call('HGET', KEYS[1], 'issuedAt') == ARGV[2] "
            + "and redis.call('HGET', KEYS[1], 'codeHash') == ARGV[1] then "
            + "return redis.call('DEL', KEYS[1]) end "
            + "return 0";

    private static final String FAILED_ATTEMPT_LUA =
            "if redis.call('HGET', KEYS[1], 'issuedAt') ~= ARGV[2] "
            + "or redis.call('HGET', KEYS[1], 'codeHash') ~= ARGV[1] then return -1 end "
            + "local remaining = redis.call('HINCRBY', KEYS[1], 'attemptsRemaining', -1) "
            + "if remaining <= 0 then redis.call('DEL', KEYS[1]) return 0 end "
            + "return remaining";

    private static final String EVICT_LUA =
            "if redis.call('HGET', KEYS[1], 'issuedAt') == ARGV[1] then "
            + "return redis.call('DEL', KEYS[1]) end "
            + "return 0";

    private static final HexFormat HEX = HexFormat.of();

    private final StringRedisTemplate redisStringTemplate;
    private final DefaultRedisScript<Long> saveScript = new DefaultRedisScript<>(SAVE_LUA, Long.class);
    private final DefaultRedisScript<Long> consumeScript = new DefaultRedisScript<>(CONSUME_LUA, Long.class);
    private final DefaultRedisScript<Long> failedAttemptScript = new DefaultRedisScript<>(FAILED_ATTEMPT_LUA, Long.class);
    private final DefaultRedisScript<Long> evictScript = new DefaultRedisScript<>(EVICT_LUA, Long.class);

    public RedisOtpStore(StringRedisTemplate redisStringTemplate) {
        this.redisStringTemplate = redisStringTemplate;
    }

    @Override
    public void save(OtpRecord record, Duration retention) {
        long retentionMs = Math.max(1, retention.toMillis());
        run("save", () -> redisStringTemplate.execute(
                saveScript,
                List.of(key(record.phone())),
                HEX.formatHex(record.codeHash()),
                String.valueOf(record.expiresAt().toEpochMilli()),
                String.valueOf(record.attemptsRemaining()),
                String.valueOf(record.issuedAt().toEpochMilli()),
                String.valueOf(retentionMs)
        ));
        log.debug("OTP record stored for {} (retention {} ms)", record.phone(), retentionMs);
    }

    @Override
    public Optional<OtpRecord> find(PhoneNumber phone) {
        HashOperations<String, String, String> ops = redisStringTemplate.opsForHash();
        Map<String, String> data = run("find", () -> ops.entries(key(phone)));
        if (data == null || data.isEmpty()) {
            return Optional.empty();
        }
        String codeHash = data.get(FIELD_CODE_HASH);
        String expiresAt = data.get(FIELD_EXPIRES_AT);
        String attempts = data.get(FIELD_ATTEMPTS);
        String issuedAt = data.get(FIELD_ISSUED_AT);
        if (codeHash == null || expiresAt == null || attempts == null || issuedAt == null) {
            log.warn("Ignoring incomplete OTP record for {}", phone);
            return Optional.empty();
        }
        try {
            return Optional.of(new OtpRecord(
                    phone,
                    HEX.parseHex(codeHash),
                    Instant.ofEpochMilli(Long.parseLong(expiresAt)),
                    Integer.parseInt(attempts),
                    Instant.ofEpochMilli(Long.parseLong(issuedAt))
            ));
        } catch (IllegalArgumentException ex) {
            log.warn("Ignoring unreadable OTP record for {}: {}", phone, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean consume(PhoneNumber phone, byte[] codeHash, Instant issuedAt) {
        Long deleted = run("consume", () -> redisStringTemplate.execute(
                consumeScript,
                List.of(key(phone)),
                HEX.formatHex(codeHash),
                String.valueOf(issuedAt.toEpochMilli())
        ));
        return deleted != null && deleted > 0;
    }

    @Override
    public int recordFailedAttempt(PhoneNumber phone, byte[] codeHash, Instant issuedAt) {
        Long remaining = run("recordFailedAttempt", () -> redisStringTemplate.execute(
                failedAttemptScript,
                List.of(key(phone)),
                HEX.formatHex(codeHash),
                String.valueOf(issuedAt.toEpochMilli())
        ));
        return remaining == null ? -1 : remaining.intValue();
    }

    @Override
    public boolean evict(PhoneNumber phone, Instant issuedAt) {
        Long deleted = run("evict", () -> redisStringTemplate.execute(
                evictScript,
                List.of(key(phone)),
                String.valueOf(issuedAt.toEpochMilli())
        ));
        return deleted != null && deleted > 0;
    }

    static String key(PhoneNumber phone) {
        return KEY_PREFIX + phone.value();
    }

    private <T> T run(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException ex) {
            log.error("Redis OTP store operation '{}' failed: {}", operation, ex.getMessage());
            throw AuthException.storeUnavailable(ex);
        }
    }
}
