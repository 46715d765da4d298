package com.phoneauth.store;

import com.phoneauth.exception.AuthErrorCode;
import com.phoneauth.exception.AuthException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisRevocationStore Unit Tests")
class RedisRevocationStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private StringRedisTemplate redisStringTemplate;

    @Mock
    private ZSetOperations<String, String> zSetOperations;

    private RedisRevocationStore revocationStore;
    private UUID tokenId;

    @BeforeEach
    void setUp() {
        when(redisStringTemplate.opsForZSet()).thenReturn(zSetOperations);
        revocationStore = new RedisRevocationStore(redisStringTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
        tokenId = UUID.randomUUID();
    }

    @Test
    @DisplayName("revoke should insert once, scored by token expiry")
    void testRevoke() {
        // Arrange
        Instant expiresAt = NOW.plusSeconds(3600);
        when(zSetOperations.addIfAbsent("auth:revoked", tokenId.toString(), (double) expiresAt.toEpochMilli()))
                .thenReturn(true, false);

        // Act & Assert
        assertTrue(revocationStore.revoke(tokenId, expiresAt));
        assertFalse(revocationStore.revoke(tokenId, expiresAt));
    }

    @Test
    @DisplayName("isRevoked should ignore entries whose token has expired")
    void testIsRevoked() {
        // Arrange
        when(zSetOperations.score("auth:revoked", tokenId.toString()))
                .thenReturn((double) NOW.plusSeconds(60).toEpochMilli(),
                        (double) NOW.minusSeconds(60).toEpochMilli(),
                        null);

        // Act & Assert
        assertTrue(revocationStore.isRevoked(tokenId));
        assertFalse(revocationStore.isRevoked(tokenId));
        assertFalse(revocationStore.isRevoked(tokenId));
    }

    @Test
    @DisplayName("evictExpired should remove entries scored up to now")
    void testEvictExpired() {
        // Arrange
        when(zSetOperations.removeRangeByScore("auth:revoked", 0, (double) NOW.toEpochMilli())).thenReturn(4L);

        // Act & Assert
        assertEquals(4, revocationStore.evictExpired());
    }

    @Test
    @DisplayName("Redis failures should surface as STORE_UNAVAILABLE")
    void testRedisFailure() {
        // Arrange
        when(zSetOperations.score("auth:revoked", tokenId.toString()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        // Act
        AuthException ex = assertThrows(AuthException.class, () -> revocationStore.isRevoked(tokenId));

        // Assert
        assertEquals(AuthErrorCode.STORE_UNAVAILABLE, ex.getErrorCode());
    }
}
