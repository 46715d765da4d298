package com.phoneauth.store;

import com.phoneauth.phone.PhoneNumber;

import java.time.Duration;

/**
 * Fixed-window limiter of OTP issuances per phone number.
 *
 * The window opens with the first admitted issuance and lasts {@code window};
 * rejected requests neither count nor extend it.
 */
public interface IssuanceRateLimiter {

    /**
     * Admit one issuance if the phone is below {@code maxRequests} in its current
     * window. Check and increment happen atomically.
     *
     * @param phone       the phone number
     * @param maxRequests issuances allowed per window
     * @param window      window length
     * @return the decision, with the time until the window resets when rejected
     */
    RateLimitDecision tryAcquire(PhoneNumber phone, int maxRequests, Duration window);

    /**
     * Give back one admitted issuance whose code never reached the store.
     * The window itself is left unchanged.
     *
     * @param phone the phone number
     */
    void release(PhoneNumber phone);
}
