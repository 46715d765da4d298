package com.phoneauth.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Time and randomness sources shared by the authentication components.
 *
 * Every expiry decision (OTP, rate-limit window, token lifetime, revocation
 * eviction) reads the same {@link Clock}, which keeps them consistent and lets
 * tests substitute a controllable clock.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }
}
