package com.phoneauth.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("OtpCodeGenerator Unit Tests")
class OtpCodeGeneratorTest {

    @Test
    @DisplayName("nextCode should left-pad small values with zeros")
    void testNextCode_ZeroPadded() {
        // Arrange
        SecureRandom random = mock(SecureRandom.class);
        when(random.nextInt(1_000_000)).thenReturn(42);

        // Act
        String code = new OtpCodeGenerator(random).nextCode(6);

        // Assert
        assertEquals("000042", code);
    }

    @Test
    @DisplayName("nextCode should always return the requested number of digits")
    void testNextCode_Length() {
        OtpCodeGenerator generator = new OtpCodeGenerator(new SecureRandom());
        for (int i = 0; i < 200; i++) {
            assertTrue(generator.nextCode(6).matches("\\d{6}"));
        }
        assertTrue(generator.nextCode(4).matches("\\d{4}"));
    }

    @Test
    @DisplayName("nextCode should reject unsupported lengths")
    void testNextCode_InvalidLength() {
        OtpCodeGenerator generator = new OtpCodeGenerator(new SecureRandom());
        assertThrows(IllegalArgumentException.class, () -> generator.nextCode(0));
        assertThrows(IllegalArgumentException.class, () -> generator.nextCode(10));
    }
}
