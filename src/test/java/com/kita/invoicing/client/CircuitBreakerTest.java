package com.kita.invoicing.client;

import com.kita.invoicing.exception.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CircuitBreaker
 */
class CircuitBreakerTest {

    private SteppingClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new SteppingClock(Instant.parse("2026-03-15T18:00:00Z"));
        breaker = new CircuitBreaker("fiscalapi", 2, Duration.ofSeconds(30), 2, clock);
    }

    private void trip() {
        breaker.recordFailure();
        breaker.recordFailure();
    }

    @Test
    @DisplayName("should stay closed below the failure threshold")
    void shouldStayClosed() {
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();

        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
        assertDoesNotThrow(breaker::acquirePermission);
    }

    @Test
    @DisplayName("should reject calls while open with the remaining wait")
    void shouldRejectWhileOpen() {
        trip();
        clock.advance(Duration.ofSeconds(10));

        ProviderException error = assertThrows(ProviderException.class, breaker::acquirePermission);

        assertEquals(ProviderException.ProviderErrorCode.CIRCUIT_OPEN, error.getErrorCode());
        assertTrue(error.getMessage().contains("20 seconds"), error.getMessage());
        assertEquals("fiscalapi", error.getProvider());
    }

    @Test
    @DisplayName("should close after enough successful trial calls")
    void shouldCloseAfterTrialCalls() {
        trip();
        clock.advance(Duration.ofSeconds(30));

        breaker.acquirePermission();
        assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.getState());
        breaker.recordSuccess();
        assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.getState());
        breaker.recordSuccess();

        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    @DisplayName("should reopen when a trial call fails")
    void shouldReopenOnTrialFailure() {
        trip();
        clock.advance(Duration.ofMinutes(1));
        breaker.acquirePermission();

        breaker.recordFailure();

        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
        assertThrows(ProviderException.class, breaker::acquirePermission);
    }

    @Test
    @DisplayName("should reject non-positive thresholds")
    void shouldRejectInvalidThresholds() {
        assertThrows(IllegalArgumentException.class,
            () -> new CircuitBreaker("x", 0, Duration.ofSeconds(1), 1, clock));
    }

    private static final class SteppingClock extends Clock {

        private Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
