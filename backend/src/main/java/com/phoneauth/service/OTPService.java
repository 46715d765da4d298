package com.phoneauth.service;

import com.phoneauth.exception.AuthErrorCode;
import com.phoneauth.exception.AuthException;
import com.phoneauth.messaging.DispatchException;
import com.phoneauth.messaging.MessageDispatcher;
import com.phoneauth.phone.PhoneNumber;
import com.phoneauth.store.IssuanceRateLimiter;
import com.phoneauth.store.OtpRecord;
import com.phoneauth.store.OtpStore;
import com.phoneauth.store.RateLimitDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Service for issuing and verifying phone One-Time Passwords (OTP).
 *
 * Security Features:
 * - Codes come from SecureRandom and only their HMAC is stored
 * - Codes are single use: a successful verification deletes the record atomically
 * - A new issuance replaces any pending code for the same phone
 * - Wrong submissions are limited per code, issuances are limited per phone and window
 * - Hash comparison is constant time
 *
 * Every decision that mutates state (consume, failed attempt, eviction) is a
 * conditional store operation scoped to the issuance that was read, so
 * concurrent verifications cannot both succeed and cannot touch a reissued code.
 *
 * @see com.phoneauth.store.OtpStore
 * @see com.phoneauth.store.IssuanceRateLimiter
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OTPService {

    private final OtpStore otpStore;
    private final IssuanceRateLimiter rateLimiter;
    private final MessageDispatcher messageDispatcher;
    private final OtpCodeGenerator codeGenerator;
    private final OtpHasher otpHasher;
    private final Clock clock;

    @Value("${app.otp.length:6}")
    private int otpLength;

    @Value("${app.otp.ttl:PT5M}")
    private Duration otpTtl;

    @Value("${app.otp.max-attempts:3}")
    private int maxAttempts;

    @Value("${app.otp.expired-retention:PT1M}")
    private Duration expiredRetention;

    @Value("${app.otp.rate-limit.max-requests:5}")
    private int maxRequestsPerWindow;

    @Value("${app.otp.rate-limit.window:PT10M}")
    private Duration rateLimitWindow;

    /**
     * Issue a new code for the given phone and hand it to the dispatcher.
     *
     * This method performs the following steps:
     * 1. Admit the request against the per-phone issuance window
     * 2. Generate a random code of the configured length
     * 3. Store its hash, replacing any pending code of the phone
     * 4. Dispatch the plaintext code
     *
     * If the code cannot be stored, the admitted issuance is given back to the
     * rate limiter before the failure is rethrown.
     *
     * A dispatch failure is logged and reported through
     * {@link OtpIssuance#delivered()}; the stored code stays valid so that a
     * delayed delivery can still be used.
     *
     * @param phone the canonical phone number
     * @return issuance details, without the code
     * @throws AuthException RATE_LIMITED with the time until the window resets,
     *         or STORE_UNAVAILABLE
     */
    public OtpIssuance issue(PhoneNumber phone) {
        RateLimitDecision decision = rateLimiter.tryAcquire(phone, maxRequestsPerWindow, rateLimitWindow);
        if (!decision.allowed()) {
            log.warn("OTP issuance rate limit reached for {} ({} in window, retry in {}s)",
                    phone, decision.count(), decision.retryAfter().toSeconds());
            throw AuthException.rateLimited(decision.retryAfter());
        }

        String code = codeGenerator.nextCode(otpLength);
        Instant now = now();
        OtpRecord record = new OtpRecord(
                phone,
                otpHasher.hash(phone, code),
                now.plus(otpTtl),
                maxAttempts,
                now
        );
        try {
            otpStore.save(record, otpTtl.plus(expiredRetention));
        } catch (AuthException ex) {
            releaseSlot(phone, ex);
            throw ex;
        }

        boolean delivered = dispatch(phone, code);

        log.info("Issued OTP for {} (valid for {}s, issuance {}/{} in window)",
                phone, otpTtl.toSeconds(), decision.count(), maxRequestsPerWindow);
        return new OtpIssuance(phone, record.expiresAt(), maxAttempts, delivered);
    }

    /**
     * Verify a submitted code and consume it on success.
     *
     * @param phone the canonical phone number
     * @param submittedCode the code entered by the user
     * @throws IllegalArgumentException if the submitted code is blank
     * @throws AuthException NOT_FOUND, EXPIRED, CODE_MISMATCH, TOO_MANY_ATTEMPTS
     *         or STORE_UNAVAILABLE
     */
    public void verifyAndConsume(PhoneNumber phone, String submittedCode) {
        if (submittedCode == null || submittedCode.isBlank()) {
            throw new IllegalArgumentException("Verification code must not be blank");
        }

        OtpRecord record = otpStore.find(phone)
                .orElseThrow(() -> {
                    log.info("No pending OTP for {}", phone);
                    return new AuthException(AuthErrorCode.NOT_FOUND);
                });

        if (record.isExpiredAt(now())) {
            otpStore.evict(phone, record.issuedAt());
            log.info("Expired OTP submitted for {}", phone);
            throw new AuthException(AuthErrorCode.EXPIRED);
        }

        if (!otpHasher.matches(phone, submittedCode.trim(), record.codeHash())) {
            int remaining = otpStore.recordFailedAttempt(phone, record.codeHash(), record.issuedAt());
            if (remaining < 0) {
                log.info("OTP for {} was consumed or replaced during verification", phone);
                throw new AuthException(AuthErrorCode.NOT_FOUND);
            }
            if (remaining == 0) {
                log.warn("OTP attempts exhausted for {}, code discarded", phone);
                throw new AuthException(AuthErrorCode.TOO_MANY_ATTEMPTS);
            }
            log.info("Wrong OTP for {} ({} attempts left)", phone, remaining);
            throw new AuthException(AuthErrorCode.CODE_MISMATCH);
        }

        if (!otpStore.consume(phone, record.codeHash(), record.issuedAt())) {
            log.info("OTP for {} was already consumed by a concurrent verification", phone);
            throw new AuthException(AuthErrorCode.NOT_FOUND);
        }
        log.info("OTP verified and consumed for {}", phone);
    }

    /**
     * Check if a code is pending for the phone and has not expired.
     *
     * @param phone the canonical phone number
     * @return true if a usable code exists
     */
    public boolean hasPendingCode(PhoneNumber phone) {
        return otpStore.find(phone)
                .map(record -> !record.isExpiredAt(now()))
                .orElse(false);
    }

    /**
     * Time left before the pending code of the phone expires.
     *
     * @param phone the canonical phone number
     * @return remaining validity, or empty if no usable code exists
     */
    public Optional<Duration> remainingTtl(PhoneNumber phone) {
        Instant now = now();
        return otpStore.find(phone)
                .filter(record -> !record.isExpiredAt(now))
                .map(record -> Duration.between(now, record.expiresAt()));
    }

    private void releaseSlot(PhoneNumber phone, AuthException saveFailure) {
        try {
            rateLimiter.release(phone);
        } catch (AuthException releaseFailure) {
            log.warn("Could not release issuance slot for {} after failed save", phone);
            saveFailure.addSuppressed(releaseFailure);
        }
    }

    private boolean dispatch(PhoneNumber phone, String code) {
        try {
            messageDispatcher.send(phone, code);
            return true;
        } catch (DispatchException ex) {
            log.error("Failed to dispatch OTP to {}: {}", phone, ex.getMessage(), ex);
            return false;
        }
    }

    // Millisecond precision matches what the store persists.
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
