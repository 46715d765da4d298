package com.phoneauth.service;

import com.phoneauth.phone.PhoneNumber;

import java.time.Instant;

/**
 * Result of a successful OTP issuance. Never carries the code itself.
 *
 * @param phone           canonical phone the code was issued for
 * @param expiresAt       when the code stops being accepted
 * @param attemptsAllowed wrong submissions tolerated before the code is discarded
 * @param delivered       false if the dispatcher failed; the code is still pending
 */
public record OtpIssuance(PhoneNumber phone, Instant expiresAt, int attemptsAllowed, boolean delivered) {
}
