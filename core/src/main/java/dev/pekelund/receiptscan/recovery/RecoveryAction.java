package dev.pekelund.receiptscan.recovery;

import java.time.Duration;
import java.util.List;

/**
 * One candidate corrective step for a watched service. Implementations must be idempotent:
 * running an action twice is harmless.
 */
public interface RecoveryAction {

    RecoveryStrategy strategy();

    String description();

    Duration estimatedRecoveryTime();

    /**
     * @return priority between 1 and 10; higher runs first
     */
    int priority();

    List<String> conditions();

    /**
     * Runs the action.
     *
     * @return {@code true} when the action believes it fixed the problem
     */
    boolean execute() throws Exception;

    default RecoveryActionDescriptor descriptor() {
        return new RecoveryActionDescriptor(strategy(), description(), estimatedRecoveryTime(), priority(),
            conditions());
    }
}
