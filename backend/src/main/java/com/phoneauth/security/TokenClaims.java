package com.phoneauth.security;

import java.time.Instant;
import java.util.UUID;

/**
 * Verified content of a token.
 *
 * @param subjectId user the token was issued to (sub)
 * @param tokenId   unique token id (jti)
 * @param issuedAt  issue time (iat)
 * @param expiresAt expiry time (exp)
 * @param type      token purpose
 */
public record TokenClaims(UUID subjectId, UUID tokenId, Instant issuedAt, Instant expiresAt, TokenType type) {
}
