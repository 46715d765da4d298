package com.phoneauth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the Phone Auth backend.
 *
 * This Spring Boot application provides the authentication core of the marketplace:
 * - Phone number login with one-time passwords (OTP) stored in Redis
 * - Per-number rate limiting of OTP issuance
 * - JWT access/refresh token pairs with refresh rotation
 * - Refresh token revocation (logout, rotation) backed by Redis
 * - PostgreSQL-backed user identities created on first login
 *
 * @version 0.0.1-SNAPSHOT
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class PhoneAuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhoneAuthApplication.class, args);
    }
}
