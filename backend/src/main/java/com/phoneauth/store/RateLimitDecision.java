package com.phoneauth.store;

import java.time.Duration;

/**
 * Outcome of {@link IssuanceRateLimiter#tryAcquire}.
 *
 * @param allowed    whether the issuance was admitted
 * @param count      issuances counted in the window after this decision
 * @param retryAfter time until the window resets; zero when allowed
 */
public record RateLimitDecision(boolean allowed, long count, Duration retryAfter) {

    public static RateLimitDecision allowed(long count) {
        return new RateLimitDecision(true, count, Duration.ZERO);
    }

    public static RateLimitDecision rejected(long count, Duration retryAfter) {
        return new RateLimitDecision(false, count, retryAfter);
    }
}
