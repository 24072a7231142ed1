package com.ryuqq.analysis.core.protection;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CircuitBreakerConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CircuitBreakerConfigTest {

    @Test
    void constructor_Default_IsFiveFailuresSixtySeconds() {
        CircuitBreakerConfig config = new CircuitBreakerConfig();

        assertEquals(5, config.failureThreshold());
        assertEquals(Duration.ofSeconds(60), config.coolDown());
    }

    @Test
    void constructor_InvalidValues_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreakerConfig(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreakerConfig(1, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreakerConfig(1, null));
    }

    @Test
    void withMethods_ReplaceSingleField() {
        // Given
        CircuitBreakerConfig config = new CircuitBreakerConfig();

        // When
        CircuitBreakerConfig tuned = config.withFailureThreshold(3).withCoolDown(Duration.ofSeconds(10));

        // Then
        assertEquals(3, tuned.failureThreshold());
        assertEquals(Duration.ofSeconds(10), tuned.coolDown());
        assertEquals(5, config.failureThreshold());
    }
}
