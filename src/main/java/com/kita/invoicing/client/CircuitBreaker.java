package com.kita.invoicing.client;

import com.kita.invoicing.exception.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Per-provider circuit breaker
 *
 * <p>Opens after {@code failureThreshold} consecutive transport or status
 * failures and rejects calls with {@code CIRCUIT_OPEN} until
 * {@code recoveryTimeout} has passed. The first call after that runs in
 * half-open state; {@code successThreshold} successes close the circuit,
 * any failure reopens it.
 */
public class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_SUCCESS_THRESHOLD = 3;

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String providerName;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int successThreshold;
    private final Clock clock;

    private State state = State.CLOSED;
    private int consecutiveFailures;
    private int halfOpenSuccesses;
    private Instant openedAt;

    public CircuitBreaker(String providerName) {
        this(providerName, DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT, DEFAULT_SUCCESS_THRESHOLD,
            Clock.systemUTC());
    }

    public CircuitBreaker(String providerName, int failureThreshold, Duration recoveryTimeout,
                          int successThreshold, Clock clock) {
        if (failureThreshold < 1 || successThreshold < 1) {
            throw new IllegalArgumentException("Circuit breaker thresholds must be at least 1");
        }
        this.providerName = Objects.requireNonNull(providerName, "Provider name must not be null");
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = Objects.requireNonNull(recoveryTimeout, "Recovery timeout must not be null");
        this.successThreshold = successThreshold;
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Admit a call or fail fast while the circuit is open
     *
     * @throws ProviderException with code {@code CIRCUIT_OPEN}
     */
    public synchronized void acquirePermission() {
        if (state != State.OPEN) {
            return;
        }
        Duration elapsed = Duration.between(openedAt, clock.instant());
        if (elapsed.compareTo(recoveryTimeout) >= 0) {
            state = State.HALF_OPEN;
            halfOpenSuccesses = 0;
            logger.info("Circuit for {} is half-open, probing provider", providerName);
            return;
        }
        long remainingMillis = recoveryTimeout.minus(elapsed).toMillis();
        int retryAfterSeconds = (int) Math.max(1, (remainingMillis + 999) / 1000);
        throw ProviderException.circuitOpen(retryAfterSeconds).forProvider(providerName);
    }

    public synchronized void recordSuccess() {
        if (state == State.HALF_OPEN) {
            halfOpenSuccesses++;
            if (halfOpenSuccesses >= successThreshold) {
                close();
                logger.info("Circuit for {} closed after {} successful trial calls", providerName, halfOpenSuccesses);
            }
            return;
        }
        consecutiveFailures = 0;
    }

    public synchronized void recordFailure() {
        if (state == State.HALF_OPEN) {
            open();
            logger.warn("Circuit for {} reopened, trial call failed", providerName);
            return;
        }
        if (state == State.CLOSED && ++consecutiveFailures >= failureThreshold) {
            open();
            logger.warn("Circuit for {} opened after {} consecutive failures", providerName, consecutiveFailures);
        }
    }

    public synchronized State getState() {
        return state;
    }

    /**
     * Force the circuit closed, e.g. after an operator confirmed the provider is back
     */
    public synchronized void reset() {
        close();
        logger.info("Circuit for {} reset", providerName);
    }

    private void open() {
        state = State.OPEN;
        openedAt = clock.instant();
        halfOpenSuccesses = 0;
    }

    private void close() {
        state = State.CLOSED;
        consecutiveFailures = 0;
        halfOpenSuccesses = 0;
        openedAt = null;
    }
}
