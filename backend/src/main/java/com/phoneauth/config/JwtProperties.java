package com.phoneauth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JWT settings, bound from {@code jwt.*}.
 *
 * The active key signs every new token and is advertised through the
 * {@code kid} header. Keys listed under {@code previous-keys} are accepted for
 * verification only, so a rotated-out key keeps validating live sessions until
 * the refresh token lifetime has elapsed.
 */
@Data
@ConfigurationProperties(prefix = "jwt")
public class JwtProperties {

    /** Issuer claim (iss). */
    private String issuer = "phone-auth";

    /** Identifier of the active signing key, written to the kid header. */
    private String keyId = "primary";

    /** HMAC secret of the active key, at least 256 bits. */
    private String secret;

    /** Retired keys still accepted for verification, keyed by kid. */
    private Map<String, String> previousKeys = new LinkedHashMap<>();

    private Duration accessTokenTtl = Duration.ofMinutes(15);

    private Duration refreshTokenTtl = Duration.ofDays(30);
}
