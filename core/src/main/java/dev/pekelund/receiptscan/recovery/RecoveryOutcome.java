package dev.pekelund.receiptscan.recovery;

import java.time.Duration;

/**
 * Result of running one recovery action.
 */
public record RecoveryOutcome(String service, RecoveryStrategy strategy, boolean success, Duration elapsed,
    String message) {
}
