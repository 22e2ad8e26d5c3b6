package com.ryuqq.hustle.core.retry;

import com.ryuqq.hustle.core.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryConfig 테스트.
 *
 * @author Hustle Team
 * @since 1.0.0
 */
class RetryConfigTest {

    @Test
    void defaults_Always_FourAttemptsOneSecondDoubling() {
        // When
        RetryConfig config = RetryConfig.defaults();

        // Then
        assertEquals(4, config.maxAttempts());
        assertEquals(Duration.ofSeconds(1), config.initialDelay());
        assertEquals(2.0, config.backoffMultiplier());
        assertNull(config.jitter());
    }

    @Test
    void none_Always_SingleAttempt() {
        // When & Then
        assertEquals(1, RetryConfig.none().maxAttempts());
    }

    @Test
    void constructor_ZeroMaxAttempts_ThrowsConfigurationException() {
        // When & Then
        ConfigurationException exception = assertThrows(
            ConfigurationException.class,
            () -> RetryConfig.of(0, Duration.ZERO)
        );
        assertTrue(exception.getMessage().contains("maxAttempts must be >= 1"));
    }

    @Test
    void constructor_NegativeDelay_ThrowsConfigurationException() {
        // When & Then
        assertThrows(ConfigurationException.class, () -> RetryConfig.of(3, Duration.ofMillis(-1)));
    }

    @Test
    void constructor_MultiplierBelowOne_ThrowsConfigurationException() {
        // When & Then
        ConfigurationException exception = assertThrows(
            ConfigurationException.class,
            () -> RetryConfig.defaults().withBackoffMultiplier(0.5)
        );
        assertTrue(exception.getMessage().contains("backoffMultiplier"));
    }

    @Test
    void constructor_NegativeJitter_ThrowsConfigurationException() {
        // When & Then
        assertThrows(ConfigurationException.class,
            () -> RetryConfig.defaults().withJitter(Duration.ofMillis(-5)));
    }

    @Test
    void withMaxAttempts_ValidValue_KeepsOtherFields() {
        // Given
        RetryConfig original = RetryConfig.of(3, Duration.ofMillis(10)).withJitter(Duration.ofMillis(1));

        // When
        RetryConfig changed = original.withMaxAttempts(5);

        // Then
        assertEquals(5, changed.maxAttempts());
        assertEquals(Duration.ofMillis(10), changed.initialDelay());
        assertEquals(Duration.ofMillis(1), changed.jitter());
        assertEquals(3, original.maxAttempts());
    }
}
