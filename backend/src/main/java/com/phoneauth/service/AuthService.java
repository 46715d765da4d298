package com.phoneauth.service;

import com.phoneauth.exception.AuthErrorCode;
import com.phoneauth.exception.AuthException;
import com.phoneauth.identity.IdentityStore;
import com.phoneauth.phone.PhoneNumber;
import com.phoneauth.phone.PhoneNumberCanonicalizer;
import com.phoneauth.security.JwtTokenProvider;
import com.phoneauth.security.TokenClaims;
import com.phoneauth.security.TokenPair;
import com.phoneauth.security.TokenType;
import com.phoneauth.store.RevocationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Service for phone-based OTP login and the token session lifecycle.
 *
 * 1. Login Request (requestLogin):
 *    - Canonicalize the phone number
 *    - Issue a code through OTPService (rate limited, dispatched to the phone)
 *
 * 2. Login Completion (completeLogin):
 *    - Verify and consume the code
 *    - Resolve or create the user of the phone
 *    - Issue an access/refresh token pair
 *
 * 3. Refresh (refresh):
 *    - Verify the refresh token and revoke it; exactly one of several concurrent
 *      refreshes with the same token wins
 *    - Issue a new pair for the same user
 *
 * 4. Logout (logout):
 *    - Revoke the refresh token; idempotent, accepts expired tokens
 *
 * Access tokens are not revocable here; they lapse within their short TTL.
 *
 * @see com.phoneauth.service.OTPService
 * @see com.phoneauth.security.JwtTokenProvider
 * @see com.phoneauth.store.RevocationStore
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuthService {

    private final PhoneNumberCanonicalizer phoneNumberCanonicalizer;
    private final OTPService otpService;
    private final IdentityStore identityStore;
    private final JwtTokenProvider jwtTokenProvider;
    private final RevocationStore revocationStore;

    /**
     * Start a login by sending a code to the phone.
     *
     * @param rawPhone the phone number as entered by the user
     * @return issuance details; {@code delivered} is false if dispatch failed
     * @throws AuthException INVALID_PHONE, RATE_LIMITED or STORE_UNAVAILABLE
     */
    public OtpIssuance requestLogin(String rawPhone) {
        PhoneNumber phone = phoneNumberCanonicalizer.canonicalize(rawPhone);
        try {
            OtpIssuance issuance = otpService.issue(phone);
            log.info("Login for {}: {}{}", phone, LoginState.AWAITING_CODE,
                    issuance.delivered() ? "" : " (code not delivered)");
            return issuance;
        } catch (AuthException ex) {
            log.info("Login for {}: {} ({})", phone, LoginState.FAILED, ex.getErrorCode().getCode());
            throw ex;
        }
    }

    /**
     * Complete a login with the code the user received.
     *
     * This is the only operation that mints tokens for a caller holding none.
     *
     * @param rawPhone the phone number as entered by the user
     * @param code the submitted code
     * @return the user id and a fresh token pair
     * @throws AuthException INVALID_PHONE, NOT_FOUND, EXPIRED, CODE_MISMATCH,
     *         TOO_MANY_ATTEMPTS, STORE_UNAVAILABLE or IDENTITY_STORE_UNAVAILABLE
     */
    public LoginResult completeLogin(String rawPhone, String code) {
        PhoneNumber phone = phoneNumberCanonicalizer.canonicalize(rawPhone);
        try {
            otpService.verifyAndConsume(phone, code);
            log.info("Login for {}: {}", phone, LoginState.VERIFIED);

            UUID userId = identityStore.resolveOrCreate(phone);
            TokenPair tokens = jwtTokenProvider.issuePair(userId);

            log.info("Login for {}: {} (user {})", phone, LoginState.TOKEN_ISSUED, userId);
            return new LoginResult(userId, tokens);
        } catch (AuthException ex) {
            log.info("Login for {}: {} ({})", phone, LoginState.FAILED, ex.getErrorCode().getCode());
            throw ex;
        }
    }

    /**
     * Exchange a refresh token for a new pair, revoking the presented token.
     *
     * @param refreshToken the current refresh token
     * @return the new pair for the same user
     * @throws AuthException INVALID_TOKEN, EXPIRED, REVOKED or STORE_UNAVAILABLE
     */
    public TokenPair refresh(String refreshToken) {
        TokenClaims claims = verifyRefreshToken(refreshToken, false);

        if (revocationStore.isRevoked(claims.tokenId())) {
            log.warn("Refresh with revoked token {} of user {}", claims.tokenId(), claims.subjectId());
            throw new AuthException(AuthErrorCode.REVOKED);
        }
        if (!revocationStore.revoke(claims.tokenId(), claims.expiresAt())) {
            log.warn("Refresh token {} of user {} was rotated concurrently", claims.tokenId(), claims.subjectId());
            throw new AuthException(AuthErrorCode.REVOKED);
        }

        TokenPair tokens = jwtTokenProvider.issuePair(claims.subjectId());
        log.info("Rotated refresh token {} of user {}", claims.tokenId(), claims.subjectId());
        return tokens;
    }

    /**
     * Revoke a refresh token. Repeated calls and expired tokens succeed.
     *
     * @param refreshToken the refresh token to revoke
     * @throws AuthException INVALID_TOKEN or STORE_UNAVAILABLE
     */
    public void logout(String refreshToken) {
        TokenClaims claims = verifyRefreshToken(refreshToken, true);
        boolean inserted = revocationStore.revoke(claims.tokenId(), claims.expiresAt());
        log.info("Logout of user {} (token {}{})", claims.subjectId(), claims.tokenId(),
                inserted ? "" : ", already revoked");
    }

    private TokenClaims verifyRefreshToken(String refreshToken, boolean allowExpired) {
        try {
            return allowExpired
                    ? jwtTokenProvider.verifyAllowingExpiry(refreshToken, TokenType.REFRESH)
                    : jwtTokenProvider.verify(refreshToken, TokenType.REFRESH);
        } catch (AuthException ex) {
            if (ex.getErrorCode() == AuthErrorCode.EXPIRED) {
                log.info("Expired refresh token presented");
                throw ex;
            }
            log.warn("Invalid refresh token presented: {}", ex.getErrorCode().getCode());
            throw new AuthException(AuthErrorCode.INVALID_TOKEN, ex);
        }
    }
}
