package com.phoneauth.store;

import com.phoneauth.exception.AuthException;
import com.phoneauth.support.InMemoryRevocationStore;
import com.phoneauth.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("RevocationEvictionTask Unit Tests")
class RevocationEvictionTaskTest {

    @Test
    @DisplayName("evictExpired should drop entries of expired tokens only")
    void testEvictExpired() {
        // Arrange
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        InMemoryRevocationStore store = new InMemoryRevocationStore(clock);
        UUID shortLived = UUID.randomUUID();
        UUID longLived = UUID.randomUUID();
        store.revoke(shortLived, clock.instant().plus(Duration.ofMinutes(15)));
        store.revoke(longLived, clock.instant().plus(Duration.ofDays(30)));
        clock.advance(Duration.ofHours(1));

        // Act
        new RevocationEvictionTask(store).evictExpired();

        // Assert
        assertEquals(1, store.size());
        assertTrue(store.isRevoked(longLived));
        assertFalse(store.isRevoked(shortLived));
    }

    @Test
    @DisplayName("evictExpired should survive an unavailable store")
    void testEvictExpired_StoreUnavailable() {
        // Arrange
        RevocationStore store = mock(RevocationStore.class);
        when(store.evictExpired()).thenThrow(
                AuthException.storeUnavailable(new DataAccessResourceFailureException("down")));

        // Act & Assert
        assertDoesNotThrow(() -> new RevocationEvictionTask(store).evictExpired());
    }
}
