package dev.pekelund.receiptscan.recovery;

import dev.pekelund.receiptscan.circuit.CircuitBreakerRegistry;
import dev.pekelund.receiptscan.retry.Sleeper;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Waits before resetting a circuit breaker, giving a struggling dependency time to recover first.
 */
public class DelayedCircuitBreakerResetAction extends AbstractRecoveryAction {

    private static final Logger LOGGER = LoggerFactory.getLogger(DelayedCircuitBreakerResetAction.class);

    private final CircuitBreakerRegistry circuitBreakers;
    private final String key;
    private final Duration delay;
    private final Sleeper sleeper;

    public DelayedCircuitBreakerResetAction(CircuitBreakerRegistry circuitBreakers, String key, Duration delay,
        Sleeper sleeper, int priority) {
        super(RecoveryStrategy.DELAYED_RETRY,
            "Wait " + delay.toSeconds() + "s, then reset the '" + key + "' circuit breaker",
            delay.plusSeconds(5), priority, List.of("Rate limited", "Service overloaded"));
        this.circuitBreakers = circuitBreakers;
        this.key = key;
        this.delay = delay;
        this.sleeper = sleeper != null ? sleeper : Sleeper.THREAD;
    }

    @Override
    public boolean execute() throws InterruptedException {
        LOGGER.info("Waiting {} ms before resetting circuit breaker '{}'", delay.toMillis(), key);
        sleeper.sleep(delay);
        circuitBreakers.reset(key);
        return true;
    }
}
