package dev.pekelund.receiptscan.circuit;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Process-wide registry of circuit breakers keyed by operation name. Breakers are created lazily on
 * first use and live until the registry is discarded.
 */
public class CircuitBreakerRegistry {

    public static final int DEFAULT_THRESHOLD = 5;
    public static final Duration DEFAULT_COOL_DOWN = Duration.ofSeconds(60);

    private static final Logger LOGGER = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final int threshold;
    private final Duration coolDown;
    private final Clock clock;

    public CircuitBreakerRegistry() {
        this(DEFAULT_THRESHOLD, DEFAULT_COOL_DOWN, Clock.systemUTC());
    }

    public CircuitBreakerRegistry(int threshold, Duration coolDown, Clock clock) {
        Assert.isTrue(threshold > 0, "Circuit breaker threshold must be positive");
        Assert.notNull(coolDown, "Cool-down must not be null");
        Assert.isTrue(!coolDown.isNegative(), "Cool-down must not be negative");
        this.threshold = threshold;
        this.coolDown = coolDown;
        this.clock = clock != null ? clock : Clock.systemUTC();
        LOGGER.info("Circuit breaker registry initialised - threshold: {}, cool-down: {}", threshold, coolDown);
    }

    /**
     * Asks permission for one call. Returns {@code false} while the circuit is open, or while the
     * half-open trial call is already in flight.
     */
    public boolean tryAcquire(String key) {
        return breaker(key).tryAcquire();
    }

    public void recordSuccess(String key) {
        breaker(key).recordSuccess();
    }

    public void recordFailure(String key) {
        breaker(key).recordFailure();
    }

    /**
     * Forces the circuit for {@code key} to CLOSED. Safe to call repeatedly.
     */
    public void reset(String key) {
        breaker(key).reset();
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        LOGGER.info("Reset {} circuit breakers", breakers.size());
    }

    public CircuitBreakerStatus statusOf(String key) {
        return breaker(key).status();
    }

    public List<CircuitBreakerStatus> allStatuses() {
        return breakers.values().stream()
            .map(CircuitBreaker::status)
            .sorted(Comparator.comparing(CircuitBreakerStatus::key))
            .toList();
    }

    public int openCircuitCount() {
        return (int) allStatuses().stream().filter(CircuitBreakerStatus::isOpen).count();
    }

    public int getThreshold() {
        return threshold;
    }

    public Duration getCoolDown() {
        return coolDown;
    }

    private CircuitBreaker breaker(String key) {
        Assert.hasText(key, "Circuit breaker key must not be empty");
        return breakers.computeIfAbsent(key, k -> new CircuitBreaker(k, threshold, coolDown, clock));
    }
}
