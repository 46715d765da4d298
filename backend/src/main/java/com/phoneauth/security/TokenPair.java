package com.phoneauth.security;

import java.time.Instant;

/**
 * Access and refresh token minted together for one user.
 */
public record TokenPair(
        String accessToken,
        Instant accessTokenExpiresAt,
        String refreshToken,
        Instant refreshTokenExpiresAt
) {
}
