package dev.pekelund.receiptscan.circuit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Circuit breaker guarding a single operation key.
 *
 * States:
 * - CLOSED: calls pass through, consecutive failures are counted
 * - OPEN: threshold reached, calls are rejected until the cool-down elapses
 * - HALF_OPEN: exactly one trial call is admitted; its outcome closes or re-opens the circuit
 *
 * Every transition happens inside a method synchronized on the breaker.
 */
final class CircuitBreaker {

    private static final Logger LOGGER = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String key;
    private final int threshold;
    private final Duration coolDown;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean trialInFlight;
    private long totalRequests;
    private long successfulRequests;

    CircuitBreaker(String key, int threshold, Duration coolDown, Clock clock) {
        this.key = key;
        this.threshold = threshold;
        this.coolDown = coolDown;
        this.clock = clock;
    }

    synchronized boolean tryAcquire() {
        advanceIfCoolDownElapsed();
        switch (state) {
            case CLOSED:
                totalRequests++;
                return true;
            case HALF_OPEN:
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
                totalRequests++;
                LOGGER.info("Circuit '{}' admitting trial call", key);
                return true;
            case OPEN:
            default:
                return false;
        }
    }

    synchronized void recordSuccess() {
        successfulRequests++;
        if (state == CircuitState.HALF_OPEN) {
            LOGGER.info("Circuit '{}' CLOSED after successful trial call", key);
        }
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        openedAt = null;
        trialInFlight = false;
    }

    synchronized void recordFailure() {
        consecutiveFailures++;
        if (state == CircuitState.HALF_OPEN) {
            open();
            LOGGER.warn("Circuit '{}' OPENED again after failed trial call", key);
            return;
        }
        if (state == CircuitState.CLOSED && consecutiveFailures >= threshold) {
            open();
            LOGGER.warn("Circuit '{}' OPENED after {} consecutive failures", key, consecutiveFailures);
        }
    }

    synchronized void reset() {
        CircuitState previous = state;
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        openedAt = null;
        trialInFlight = false;
        LOGGER.info("Circuit '{}' reset from {} to CLOSED", key, previous);
    }

    synchronized CircuitBreakerStatus status() {
        advanceIfCoolDownElapsed();
        Instant nextAttemptAt = state == CircuitState.OPEN && openedAt != null ? openedAt.plus(coolDown) : null;
        return new CircuitBreakerStatus(key, state, consecutiveFailures, threshold, openedAt, nextAttemptAt,
            totalRequests, successfulRequests);
    }

    private void open() {
        state = CircuitState.OPEN;
        openedAt = clock.instant();
        trialInFlight = false;
    }

    private void advanceIfCoolDownElapsed() {
        if (state == CircuitState.OPEN && openedAt != null
            && !clock.instant().isBefore(openedAt.plus(coolDown))) {
            state = CircuitState.HALF_OPEN;
            trialInFlight = false;
            LOGGER.info("Circuit '{}' transitioning to HALF_OPEN after cool-down of {}", key, coolDown);
        }
    }
}
