package com.phoneauth.identity;

import com.phoneauth.entity.User;
import com.phoneauth.exception.AuthErrorCode;
import com.phoneauth.exception.AuthException;
import com.phoneauth.phone.PhoneNumber;
import com.phoneauth.repository.UserRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JpaIdentityStore.
 *
 * Tests identity resolution including:
 * - Creation on first login
 * - Reuse and verification of existing users
 * - Concurrent creation of the same phone
 * - Database failures
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("JpaIdentityStore Unit Tests")
class JpaIdentityStoreTest {

    private static final PhoneNumber PHONE = new PhoneNumber("+994501234567");

    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private JpaIdentityStore identityStore;

    @Test
    @DisplayName("resolveOrCreate should create a verified user on first login")
    void testResolveOrCreate_NewUser() {
        // Arrange
        UUID id = UUID.randomUUID();
        when(userRepository.findByPhone(PHONE.value())).thenReturn(Optional.empty());
        when(userRepository.saveAndFlush(any(User.class))).thenAnswer(invocation -> {
            User user = invocation.getArgument(0);
            user.setId(id);
            return user;
        });

        // Act
        UUID resolved = identityStore.resolveOrCreate(PHONE);

        // Assert
        assertEquals(id, resolved);
        verify(userRepository).saveAndFlush(argThat(user ->
                user.getPhone().equals("+994501234567") && Boolean.TRUE.equals(user.getPhoneVerified())));
    }

    @Test
    @DisplayName("resolveOrCreate should return an existing user and mark the phone verified")
    void testResolveOrCreate_ExistingUser() {
        // Arrange
        User existing = new User(PHONE.value(), false);
        existing.setId(UUID.randomUUID());
        when(userRepository.findByPhone(PHONE.value())).thenReturn(Optional.of(existing));

        // Act
        UUID resolved = identityStore.resolveOrCreate(PHONE);

        // Assert
        assertEquals(existing.getId(), resolved);
        assertTrue(existing.getPhoneVerified());
        verify(userRepository).save(existing);
        verify(userRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("resolveOrCreate should not write an already verified user")
    void testResolveOrCreate_AlreadyVerified() {
        // Arrange
        User existing = new User(PHONE.value(), true);
        existing.setId(UUID.randomUUID());
        when(userRepository.findByPhone(PHONE.value())).thenReturn(Optional.of(existing));

        // Act
        identityStore.resolveOrCreate(PHONE);

        // Assert
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("resolveOrCreate should read the winner after losing a creation race")
    void testResolveOrCreate_ConcurrentCreation() {
        // Arrange
        User winner = new User(PHONE.value(), true);
        winner.setId(UUID.randomUUID());
        when(userRepository.findByPhone(PHONE.value()))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(userRepository.saveAndFlush(any(User.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"));

        // Act
        UUID resolved = identityStore.resolveOrCreate(PHONE);

        // Assert
        assertEquals(winner.getId(), resolved);
    }

    @Test
    @DisplayName("resolveOrCreate should surface database failures as IDENTITY_STORE_UNAVAILABLE")
    void testResolveOrCreate_DatabaseDown() {
        // Arrange
        when(userRepository.findByPhone(PHONE.value()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // Act
        AuthException ex = assertThrows(AuthException.class, () -> identityStore.resolveOrCreate(PHONE));

        // Assert
        assertEquals(AuthErrorCode.IDENTITY_STORE_UNAVAILABLE, ex.getErrorCode());
    }
}
