package com.phoneauth.security;

import com.phoneauth.config.JwtProperties;
import com.phoneauth.exception.AuthErrorCode;
import com.phoneauth.exception.AuthException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.LocatorAdapter;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * JWT Token Provider for issuing and verifying access and refresh tokens.
 *
 * Tokens carry the following claims:
 * - sub: User ID (UUID)
 * - jti: Token ID (random UUID), the handle used for revocation
 * - iat / exp: Issue and expiry time
 * - iss: Configured issuer
 * - token_type: "access" or "refresh"
 *
 * Security Features:
 * - Tokens signed with HS256, key named in the kid header
 * - Signature is verified before any claim is trusted, expired tokens included
 * - Previous keys remain valid for verification after a rotation
 * - Verification of access tokens needs no store lookup
 *
 * @see io.jsonwebtoken.Jwts
 * @see com.phoneauth.config.JwtProperties
 */
@Component
@Slf4j
public class JwtTokenProvider {

    static final String TOKEN_TYPE_CLAIM = "token_type";

    private final JwtProperties properties;
    private final Clock clock;

    private SecretKey signingKey;
    private Map<String, SecretKey> verificationKeys;
    private JwtParser parser;

    public JwtTokenProvider(JwtProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Build the key set after properties are bound.
     *
     * @throws io.jsonwebtoken.security.WeakKeyException if a secret is shorter than 256 bits
     */
    @PostConstruct
    public void init() {
        if (properties.getSecret() == null || properties.getSecret().isBlank()) {
            throw new IllegalStateException("jwt.secret must be configured");
        }
        Map<String, SecretKey> keys = new LinkedHashMap<>();
        properties.getPreviousKeys().forEach((kid, secret) -> keys.put(kid, toKey(secret)));
        this.signingKey = toKey(properties.getSecret());
        keys.put(properties.getKeyId(), signingKey);
        this.verificationKeys = Collections.unmodifiableMap(keys);

        this.parser = Jwts.parser()
                .keyLocator(new LocatorAdapter<Key>() {
                    @Override
                    protected Key locate(JwsHeader header) {
                        String kid = header.getKeyId();
                        SecretKey key = kid == null ? signingKey : verificationKeys.get(kid);
                        if (key == null) {
                            throw new UnsupportedJwtException("Unknown signing key id: " + kid);
                        }
                        return key;
                    }
                })
                .requireIssuer(properties.getIssuer())
                .clock(() -> Date.from(clock.instant()))
                .build();

        log.info("JWT Token Provider initialized: active key '{}', {} verification key(s), access TTL {}, refresh TTL {}",
                properties.getKeyId(), verificationKeys.size(),
                properties.getAccessTokenTtl(), properties.getRefreshTokenTtl());
    }

    /**
     * Issue a fresh access/refresh pair for a user. Each token gets its own id.
     *
     * @param userId the user's unique identifier
     * @return the signed pair with expiry times
     */
    public TokenPair issuePair(UUID userId) {
        // JWT timestamps have second precision
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant accessExpiresAt = now.plus(properties.getAccessTokenTtl());
        Instant refreshExpiresAt = now.plus(properties.getRefreshTokenTtl());

        String accessToken = sign(userId, TokenType.ACCESS, now, accessExpiresAt);
        String refreshToken = sign(userId, TokenType.REFRESH, now, refreshExpiresAt);

        log.debug("Issued token pair for user: {}", userId);
        return new TokenPair(accessToken, accessExpiresAt, refreshToken, refreshExpiresAt);
    }

    /**
     * Verify a token of the expected type.
     *
     * @param token the compact JWS
     * @param expectedType the type the caller accepts
     * @return the verified claims
     * @throws AuthException INVALID_SIGNATURE, WRONG_TYPE or EXPIRED
     */
    public TokenClaims verify(String token, TokenType expectedType) {
        return verify(token, expectedType, false);
    }

    /**
     * Verify a token, returning the claims of a correctly signed token even
     * after it has expired.
     *
     * @param token the compact JWS
     * @param expectedType the type the caller accepts
     * @return the verified claims
     * @throws AuthException INVALID_SIGNATURE or WRONG_TYPE
     */
    public TokenClaims verifyAllowingExpiry(String token, TokenType expectedType) {
        return verify(token, expectedType, true);
    }

    /**
     * Get Authentication object for verified access token claims.
     *
     * The principal is the user ID; the token id is kept in the details.
     *
     * @param claims verified claims of an access token
     * @return Authentication object with user details
     */
    public Authentication getAuthentication(TokenClaims claims) {
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(
                        claims.subjectId().toString(),
                        null,
                        Collections.singletonList(new SimpleGrantedAuthority("ROLE_USER"))
                );
        authentication.setDetails(claims.tokenId().toString());
        return authentication;
    }

    /**
     * Extract JWT token from Authorization header.
     *
     * Expected header format: "Bearer {token}"
     *
     * @param bearerToken the Authorization header value
     * @return the JWT token string, or null if header is invalid
     */
    public String extractTokenFromHeader(String bearerToken) {
        if (bearerToken != null && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        return null;
    }

    public Duration getAccessTokenTtl() {
        return properties.getAccessTokenTtl();
    }

    public Duration getRefreshTokenTtl() {
        return properties.getRefreshTokenTtl();
    }

    private String sign(UUID userId, TokenType type, Instant issuedAt, Instant expiresAt) {
        return Jwts.builder()
                .header().keyId(properties.getKeyId()).and()
                .subject(userId.toString())
                .id(UUID.randomUUID().toString())
                .issuer(properties.getIssuer())
                .claim(TOKEN_TYPE_CLAIM, type.getClaimValue())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
    }

    private TokenClaims verify(String token, TokenType expectedType, boolean allowExpired) {
        if (token == null || token.isBlank()) {
            throw new AuthException(AuthErrorCode.INVALID_SIGNATURE);
        }
        Claims claims;
        boolean expired;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
            expired = false;
        } catch (ExpiredJwtException ex) {
            // thrown only after the signature has been verified
            claims = ex.getClaims();
            expired = true;
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Rejected JWT: {}", ex.getMessage());
            throw new AuthException(AuthErrorCode.INVALID_SIGNATURE, ex);
        }

        TokenClaims result = toTokenClaims(claims);
        if (result.type() != expectedType) {
            log.debug("Rejected {} token where {} was expected", result.type(), expectedType);
            throw new AuthException(AuthErrorCode.WRONG_TYPE);
        }
        // exp is exclusive: a token is dead at its expiry second
        if (!expired && !clock.instant().isBefore(result.expiresAt())) {
            expired = true;
        }
        if (expired && !allowExpired) {
            throw new AuthException(AuthErrorCode.EXPIRED);
        }
        return result;
    }

    private TokenClaims toTokenClaims(Claims claims) {
        try {
            return new TokenClaims(
                    UUID.fromString(claims.getSubject()),
                    UUID.fromString(claims.getId()),
                    claims.getIssuedAt().toInstant(),
                    claims.getExpiration().toInstant(),
                    TokenType.fromClaim(claims.get(TOKEN_TYPE_CLAIM, String.class))
            );
        } catch (RuntimeException ex) {
            log.warn("Signed JWT with unusable claims: {}", ex.getMessage());
            throw new AuthException(AuthErrorCode.INVALID_SIGNATURE, ex);
        }
    }

    private static SecretKey toKey(String secret) {
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }
}
