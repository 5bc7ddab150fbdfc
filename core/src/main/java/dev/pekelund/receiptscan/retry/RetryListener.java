package dev.pekelund.receiptscan.retry;

import dev.pekelund.receiptscan.errors.ErrorInfo;
import java.time.Duration;

/**
 * Callback notified about every attempt made by {@link RetryExecutor}.
 */
public interface RetryListener {

    RetryListener NOOP = new RetryListener() { };

    /**
     * @param attempt one-based number of the attempt
     */
    default void onAttemptSucceeded(String operation, int attempt, Duration latency) {
    }

    /**
     * @param attempt one-based number of the attempt that failed
     * @param latency time spent in the attempt, {@code null} when the circuit breaker rejected it
     */
    default void onAttemptFailed(String operation, ErrorInfo error, int attempt, Duration latency) {
    }

    default void onRetryScheduled(String operation, int nextAttempt, Duration delay) {
    }
}
