package dev.pekelund.receiptscan.recovery;

import dev.pekelund.receiptscan.circuit.CircuitBreakerRegistry;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closes one circuit breaker, or every breaker when no key is given, so traffic is retried at once.
 */
public class CircuitBreakerResetAction extends AbstractRecoveryAction {

    private static final Logger LOGGER = LoggerFactory.getLogger(CircuitBreakerResetAction.class);

    private final CircuitBreakerRegistry circuitBreakers;
    private final String key;

    public CircuitBreakerResetAction(CircuitBreakerRegistry circuitBreakers, String key, int priority) {
        super(key != null ? RecoveryStrategy.IMMEDIATE_RETRY : RecoveryStrategy.CIRCUIT_BREAKER_RESET,
            key != null ? "Reset the '" + key + "' circuit breaker and retry immediately"
                : "Reset all circuit breakers",
            Duration.ofSeconds(5), priority,
            List.of("Circuit breaker open", "Transient dependency failure"));
        this.circuitBreakers = circuitBreakers;
        this.key = key;
    }

    @Override
    public boolean execute() {
        if (key != null) {
            circuitBreakers.reset(key);
            LOGGER.info("Recovery reset circuit breaker '{}'", key);
        } else {
            circuitBreakers.resetAll();
        }
        return true;
    }
}
