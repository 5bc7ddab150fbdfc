package dev.pekelund.receiptscan.circuit;

import java.time.Instant;

/**
 * Point-in-time view of one circuit breaker.
 */
public record CircuitBreakerStatus(String key, CircuitState state, int consecutiveFailures, int threshold,
    Instant openedAt, Instant nextAttemptAt, long totalRequests, long successfulRequests) {

    public boolean isOpen() {
        return state == CircuitState.OPEN;
    }
}
