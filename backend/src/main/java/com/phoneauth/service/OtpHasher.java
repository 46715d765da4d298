package com.phoneauth.service;

import com.phoneauth.phone.PhoneNumber;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;

/**
 * Keyed hashing of one-time codes.
 *
 * The phone number is part of the MAC input, so a hash copied between records
 * of different phones never matches.
 */
@Component
@Slf4j
public class OtpHasher {

    private static final String ALGORITHM = "HmacSHA256";

    @Value("${app.otp.hash-secret}")
    private String hashSecret;

    private SecretKeySpec key;

    @PostConstruct
    public void init() {
        if (hashSecret == null || hashSecret.length() < 32) {
            throw new IllegalStateException("app.otp.hash-secret must be at least 32 characters");
        }
        this.key = new SecretKeySpec(hashSecret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
        log.info("OTP hasher initialized ({})", ALGORITHM);
    }

    public byte[] hash(PhoneNumber phone, String code) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal((phone.value() + ":" + code).getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC-SHA256 is not available", ex);
        }
    }

    /**
     * Constant-time check of a submitted code against a stored hash.
     */
    public boolean matches(PhoneNumber phone, String code, byte[] expectedHash) {
        return MessageDigest.isEqual(hash(phone, code), expectedHash);
    }
}
