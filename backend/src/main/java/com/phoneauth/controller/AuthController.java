package com.phoneauth.controller;

import com.phoneauth.dto.request.OTPVerifyRequest;
import com.phoneauth.dto.request.OtpRequest;
import com.phoneauth.dto.request.RefreshTokenRequest;
import com.phoneauth.dto.response.AuthResponse;
import com.phoneauth.exception.AuthErrorCode;
import com.phoneauth.service.AuthService;
import com.phoneauth.service.LoginResult;
import com.phoneauth.service.LoginState;
import com.phoneauth.service.OtpIssuance;
import com.phoneauth.security.TokenPair;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * REST Controller for authentication endpoints.
 *
 * Authentication Flow:
 * 1. User POSTs to /api/auth/otp with a phone number
 * 2. System issues a code (rate limited) and sends it to the phone
 * 3. User POSTs to /api/auth/verify with phone and code
 * 4. System consumes the code, resolves the user and issues an access/refresh pair
 * 5. User calls protected endpoints with the access token as Bearer credential
 * 6. User POSTs to /api/auth/refresh to rotate the pair, /api/auth/logout to end the session
 *
 * Error Responses (RFC 7807, see GlobalExceptionHandler):
 * - 400 Bad Request: invalid input, invalid phone, no pending code
 * - 401 Unauthorized: wrong, expired or exhausted code; invalid, expired or revoked token
 * - 429 Too Many Requests: issuance limit reached, with Retry-After
 * - 503 Service Unavailable: cache or identity store unreachable
 *
 * @see com.phoneauth.service.AuthService
 * @see com.phoneauth.config.SecurityConfig
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final AuthService authService;
    private final Clock clock;

    /**
     * Request a verification code for a phone number.
     *
     * Endpoint: POST /api/auth/otp
     * Authentication: Not required (public endpoint)
     *
     * A failed dispatch is reported as {@code deliveryStatus: DISPATCH_FAILED}
     * with status 200; the code stays valid and the client may request another
     * once the rate limit allows.
     */
    @PostMapping("/otp")
    public ResponseEntity<AuthResponse> requestOtp(@Valid @RequestBody OtpRequest otpRequest) {
        OtpIssuance issuance = authService.requestLogin(otpRequest.getPhone());

        AuthResponse response = AuthResponse.builder()
                .success(true)
                .message(issuance.delivered()
                        ? "Verification code sent"
                        : AuthErrorCode.DISPATCH_FAILED.getDefaultMessage())
                .phone(issuance.phone().masked())
                .loginState(LoginState.AWAITING_CODE)
                .expiresIn(secondsUntil(issuance.expiresAt()))
                .attemptsAllowed(issuance.attemptsAllowed())
                .deliveryStatus(issuance.delivered()
                        ? AuthResponse.DELIVERY_SENT
                        : AuthErrorCode.DISPATCH_FAILED.getCode())
                .build();

        return ResponseEntity.ok(response);
    }

    /**
     * Verify the code and issue tokens.
     *
     * Endpoint: POST /api/auth/verify
     * Authentication: Not required (public endpoint)
     *
     * Example request:
     * <pre>
     * POST /api/auth/verify
     * Content-Type: application/json
     *
     * {
     *   "phone": "+994501234567",
     *   "code": "482913"
     * }
     * </pre>
     */
    @PostMapping("/verify")
    public ResponseEntity<AuthResponse> verifyOTP(@Valid @RequestBody OTPVerifyRequest otpVerifyRequest) {
        LoginResult result = authService.completeLogin(otpVerifyRequest.getPhone(), otpVerifyRequest.getCode());

        AuthResponse response = tokenResponse(result.tokens(), "Authentication successful")
                .userId(result.userId().toString())
                .loginState(LoginState.TOKEN_ISSUED)
                .build();

        return ResponseEntity.ok(response);
    }

    /**
     * Rotate a refresh token. The presented token cannot be used again.
     *
     * Endpoint: POST /api/auth/refresh
     * Authentication: Not required (the refresh token is the credential)
     */
    @PostMapping("/refresh")
    public ResponseEntity<AuthResponse> refresh(@Valid @RequestBody RefreshTokenRequest refreshTokenRequest) {
        TokenPair tokens = authService.refresh(refreshTokenRequest.getRefreshToken());
        return ResponseEntity.ok(tokenResponse(tokens, "Token refreshed").build());
    }

    /**
     * Revoke a refresh token. Repeating the call is harmless.
     *
     * Endpoint: POST /api/auth/logout
     * Authentication: Not required (the refresh token is the credential)
     */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@Valid @RequestBody RefreshTokenRequest refreshTokenRequest) {
        authService.logout(refreshTokenRequest.getRefreshToken());
        return ResponseEntity.noContent().build();
    }

    /**
     * Identify the caller of a valid access token.
     *
     * Endpoint: GET /api/auth/me
     * Authentication: Bearer access token
     */
    @GetMapping("/me")
    public ResponseEntity<AuthResponse> me(Principal principal) {
        return ResponseEntity.ok(AuthResponse.builder()
                .success(true)
                .message("Authenticated")
                .userId(principal.getName())
                .build());
    }

    private AuthResponse.AuthResponseBuilder tokenResponse(TokenPair tokens, String message) {
        return AuthResponse.builder()
                .success(true)
                .message(message)
                .accessToken(tokens.accessToken())
                .refreshToken(tokens.refreshToken())
                .expiresIn(secondsUntil(tokens.accessTokenExpiresAt()))
                .refreshExpiresIn(secondsUntil(tokens.refreshTokenExpiresAt()));
    }

    private long secondsUntil(Instant instant) {
        return Math.max(0, Duration.between(clock.instant(), instant).getSeconds());
    }
}
