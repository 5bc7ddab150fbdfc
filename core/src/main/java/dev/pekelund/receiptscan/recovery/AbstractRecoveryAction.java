package dev.pekelund.receiptscan.recovery;

import java.time.Duration;
import java.util.List;
import org.springframework.util.Assert;

/**
 * Base class holding the descriptive part of a recovery action.
 */
public abstract class AbstractRecoveryAction implements RecoveryAction {

    private final RecoveryStrategy strategy;
    private final String description;
    private final Duration estimatedRecoveryTime;
    private final int priority;
    private final List<String> conditions;

    protected AbstractRecoveryAction(RecoveryStrategy strategy, String description, Duration estimatedRecoveryTime,
        int priority, List<String> conditions) {
        Assert.notNull(strategy, "Strategy must not be null");
        Assert.isTrue(priority >= 1 && priority <= 10, "Priority must be between 1 and 10");
        this.strategy = strategy;
        this.description = description;
        this.estimatedRecoveryTime = estimatedRecoveryTime != null ? estimatedRecoveryTime : Duration.ZERO;
        this.priority = priority;
        this.conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    @Override
    public RecoveryStrategy strategy() {
        return strategy;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public Duration estimatedRecoveryTime() {
        return estimatedRecoveryTime;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public List<String> conditions() {
        return conditions;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{strategy=" + strategy + ", priority=" + priority + '}';
    }
}
