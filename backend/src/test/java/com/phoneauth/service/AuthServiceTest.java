package com.phoneauth.service;

import com.phoneauth.config.JwtProperties;
import com.phoneauth.exception.AuthErrorCode;
import com.phoneauth.exception.AuthException;
import com.phoneauth.identity.IdentityStore;
import com.phoneauth.messaging.MessageDispatcher;
import com.phoneauth.phone.PhoneNumber;
import com.phoneauth.phone.PhoneNumberCanonicalizer;
import com.phoneauth.security.JwtTokenProvider;
import com.phoneauth.security.TokenClaims;
import com.phoneauth.security.TokenPair;
import com.phoneauth.security.TokenType;
import com.phoneauth.support.InMemoryIssuanceRateLimiter;
import com.phoneauth.support.InMemoryOtpStore;
import com.phoneauth.support.InMemoryRevocationStore;
import com.phoneauth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.function.Executable;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AuthService.
 *
 * Runs the real OTP, token and revocation logic over in-memory stores to cover:
 * - Phone login from code request to token issuance
 * - Refresh rotation, including concurrent use of one refresh token
 * - Logout and reuse of revoked tokens
 * - Error mapping for invalid refresh tokens
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AuthService Unit Tests")
class AuthServiceTest {

    private static final String RAW_PHONE = "+15551234567";
    private static final PhoneNumber PHONE = new PhoneNumber("+15551234567");
    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private IdentityStore identityStore;

    @Mock
    private MessageDispatcher messageDispatcher;

    @Mock
    private OtpCodeGenerator codeGenerator;

    private MutableClock clock;
    private InMemoryRevocationStore revocationStore;
    private JwtTokenProvider jwtTokenProvider;
    private AuthService authService;
    private UUID userId;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        userId = UUID.randomUUID();

        OtpHasher otpHasher = new OtpHasher();
        ReflectionTestUtils.setField(otpHasher, "hashSecret", "test-otp-hash-secret-0123456789abcdef");
        otpHasher.init();

        OTPService otpService = new OTPService(
                new InMemoryOtpStore(),
                new InMemoryIssuanceRateLimiter(clock),
                messageDispatcher,
                codeGenerator,
                otpHasher,
                clock
        );
        ReflectionTestUtils.setField(otpService, "otpLength", 6);
        ReflectionTestUtils.setField(otpService, "otpTtl", Duration.ofMinutes(5));
        ReflectionTestUtils.setField(otpService, "maxAttempts", 3);
        ReflectionTestUtils.setField(otpService, "expiredRetention", Duration.ofMinutes(1));
        ReflectionTestUtils.setField(otpService, "maxRequestsPerWindow", 5);
        ReflectionTestUtils.setField(otpService, "rateLimitWindow", Duration.ofMinutes(10));

        JwtProperties jwtProperties = new JwtProperties();
        jwtProperties.setSecret("aVerySecureSecretKeyForJWTTokenGenerationThatIsAtLeast256BitsLong");
        jwtTokenProvider = new JwtTokenProvider(jwtProperties, clock);
        jwtTokenProvider.init();

        revocationStore = new InMemoryRevocationStore(clock);
        authService = new AuthService(
                new PhoneNumberCanonicalizer("AZ"),
                otpService,
                identityStore,
                jwtTokenProvider,
                revocationStore
        );
    }

    @Test
    @DisplayName("Complete session: request code → verify → refresh → logout")
    void testCompleteSession() {
        // Arrange
        when(codeGenerator.nextCode(6)).thenReturn("482913");
        when(identityStore.resolveOrCreate(PHONE)).thenReturn(userId);

        // Step 1: request a code
        OtpIssuance issuance = authService.requestLogin(RAW_PHONE);
        assertEquals(PHONE, issuance.phone());
        verify(messageDispatcher).send(PHONE, "482913");

        // Step 2: verify it
        LoginResult login = authService.completeLogin(RAW_PHONE, "482913");
        assertEquals(userId, login.userId());
        TokenClaims access = jwtTokenProvider.verify(login.tokens().accessToken(), TokenType.ACCESS);
        assertEquals(userId, access.subjectId());

        // Step 3: refresh rotates the refresh token
        TokenPair rotated = authService.refresh(login.tokens().refreshToken());
        assertNotEquals(login.tokens().refreshToken(), rotated.refreshToken());
        assertEquals(AuthErrorCode.REVOKED, failureOf(() -> authService.refresh(login.tokens().refreshToken())));

        // Step 4: logout ends the rotated session
        authService.logout(rotated.refreshToken());
        assertEquals(AuthErrorCode.REVOKED, failureOf(() -> authService.refresh(rotated.refreshToken())));

        // The code was consumed by the login
        assertEquals(AuthErrorCode.NOT_FOUND, failureOf(() -> authService.completeLogin(RAW_PHONE, "482913")));
    }

    @Test
    @DisplayName("requestLogin should canonicalize national numbers with the default region")
    void testRequestLogin_NationalFormat() {
        // Arrange
        when(codeGenerator.nextCode(6)).thenReturn("482913");
        when(identityStore.resolveOrCreate(new PhoneNumber("+994501234567"))).thenReturn(userId);

        // Act
        OtpIssuance issuance = authService.requestLogin("050 123 45 67");

        // Assert
        assertEquals("+994501234567", issuance.phone().value());
        assertEquals(userId, authService.completeLogin("+994 50 123 45 67", "482913").userId());
    }

    @Test
    @DisplayName("requestLogin should reject an invalid phone number")
    void testRequestLogin_InvalidPhone() {
        assertEquals(AuthErrorCode.INVALID_PHONE, failureOf(() -> authService.requestLogin("12")));
        assertEquals(AuthErrorCode.INVALID_PHONE, failureOf(() -> authService.requestLogin("not a phone")));
        verifyNoInteractions(messageDispatcher);
    }

    @Test
    @DisplayName("completeLogin should not resolve an identity for a wrong code")
    void testCompleteLogin_WrongCode() {
        // Arrange
        when(codeGenerator.nextCode(6)).thenReturn("482913");
        authService.requestLogin(RAW_PHONE);

        // Act & Assert
        assertEquals(AuthErrorCode.CODE_MISMATCH, failureOf(() -> authService.completeLogin(RAW_PHONE, "123456")));
        verifyNoInteractions(identityStore);
    }

    @Test
    @DisplayName("completeLogin should surface identity store failures")
    void testCompleteLogin_IdentityStoreUnavailable() {
        // Arrange
        when(codeGenerator.nextCode(6)).thenReturn("482913");
        when(identityStore.resolveOrCreate(any())).thenThrow(
                AuthException.identityStoreUnavailable(new DataAccessResourceFailureException("down")));
        authService.requestLogin(RAW_PHONE);

        // Act & Assert
        assertEquals(AuthErrorCode.IDENTITY_STORE_UNAVAILABLE,
                failureOf(() -> authService.completeLogin(RAW_PHONE, "482913")));
    }

    @Test
    @DisplayName("concurrent refreshes with one token should succeed exactly once")
    void testRefresh_ConcurrentRotation() throws Exception {
        // Arrange
        String refreshToken = jwtTokenProvider.issuePair(userId).refreshToken();
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AuthErrorCode>> results = new ArrayList<>();

        // Act
        try {
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        authService.refresh(refreshToken);
                        return null;
                    } catch (AuthException ex) {
                        return ex.getErrorCode();
                    }
                }));
            }
            start.countDown();

            // Assert
            int successes = 0;
            for (Future<AuthErrorCode> result : results) {
                AuthErrorCode outcome = result.get(10, TimeUnit.SECONDS);
                if (outcome == null) {
                    successes++;
                } else {
                    assertEquals(AuthErrorCode.REVOKED, outcome);
                }
            }
            assertEquals(1, successes);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("refresh should map token failures to INVALID_TOKEN or EXPIRED")
    void testRefresh_InvalidTokens() {
        // Arrange
        TokenPair pair = jwtTokenProvider.issuePair(userId);

        // Act & Assert
        assertEquals(AuthErrorCode.INVALID_TOKEN, failureOf(() -> authService.refresh(pair.accessToken())));
        assertEquals(AuthErrorCode.INVALID_TOKEN, failureOf(() -> authService.refresh("garbage")));

        clock.advance(Duration.ofDays(30));
        assertEquals(AuthErrorCode.EXPIRED, failureOf(() -> authService.refresh(pair.refreshToken())));
        assertEquals(0, revocationStore.size());
    }

    @Test
    @DisplayName("logout should be idempotent and accept expired tokens")
    void testLogout_IdempotentAndExpired() {
        // Arrange
        TokenPair pair = jwtTokenProvider.issuePair(userId);

        // Act & Assert
        authService.logout(pair.refreshToken());
        assertDoesNotThrow(() -> authService.logout(pair.refreshToken()));
        assertEquals(1, revocationStore.size());

        TokenPair stale = jwtTokenProvider.issuePair(userId);
        clock.advance(Duration.ofDays(31));
        assertDoesNotThrow(() -> authService.logout(stale.refreshToken()));

        assertEquals(AuthErrorCode.INVALID_TOKEN, failureOf(() -> authService.logout(pair.accessToken())));
    }

    private static AuthErrorCode failureOf(Executable executable) {
        return assertThrows(AuthException.class, executable).getErrorCode();
    }
}
