package dev.pekelund.receiptscan.recovery;

import java.time.Duration;
import java.util.List;

/**
 * Operator facing description of a {@link RecoveryAction}, without the ability to run it.
 */
public record RecoveryActionDescriptor(RecoveryStrategy strategy, String description,
    Duration estimatedRecoveryTime, int priority, List<String> conditions) {

    public RecoveryActionDescriptor {
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }
}
