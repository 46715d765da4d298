package com.phoneauth.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Produces numeric one-time codes from a cryptographically strong source.
 */
@Component
@RequiredArgsConstructor
public class OtpCodeGenerator {

    private final SecureRandom secureRandom;

    /**
     * Generate a uniformly random code of exactly {@code length} digits,
     * left-padded with zeros (e.g. "000123").
     *
     * @param length number of digits, between 1 and 9
     * @return the code
     */
    public String nextCode(int length) {
        if (length < 1 || length > 9) {
            throw new IllegalArgumentException("OTP length must be between 1 and 9, got " + length);
        }
        int bound = (int) Math.pow(10, length);
        return String.format("%0" + length + "d", secureRandom.nextInt(bound));
    }
}
