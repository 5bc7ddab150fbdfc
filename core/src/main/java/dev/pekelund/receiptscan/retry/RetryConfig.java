package dev.pekelund.receiptscan.retry;

import java.time.Duration;
import java.util.random.RandomGenerator;
import org.springframework.util.Assert;

/**
 * Immutable retry settings for one call. Each invocation gets its own copy; adjust with the
 * {@code with...} methods.
 *
 * @param maxRetries retries after the initial attempt, so the call runs at most {@code maxRetries + 1} times
 * @param baseDelay delay before the first retry
 * @param maxDelay upper bound for any single delay
 * @param backoffMultiplier growth factor applied per attempt
 * @param jitterEnabled whether delays are randomised by up to {@link #JITTER_RATIO} in either direction
 * @param timeout hard deadline for each attempt; {@link Duration#ZERO} disables it
 */
public record RetryConfig(int maxRetries, Duration baseDelay, Duration maxDelay, double backoffMultiplier,
    boolean jitterEnabled, Duration timeout) {

    public static final double JITTER_RATIO = 0.25;

    public RetryConfig {
        Assert.isTrue(maxRetries >= 0, "maxRetries must not be negative");
        Assert.notNull(baseDelay, "baseDelay must not be null");
        Assert.notNull(maxDelay, "maxDelay must not be null");
        Assert.isTrue(!baseDelay.isNegative() && !maxDelay.isNegative(), "Delays must not be negative");
        Assert.isTrue(backoffMultiplier >= 1.0, "backoffMultiplier must be at least 1");
        timeout = timeout != null ? timeout : Duration.ZERO;
        Assert.isTrue(!timeout.isNegative(), "timeout must not be negative");
    }

    public static RetryConfig defaults() {
        return new RetryConfig(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, true, Duration.ofSeconds(60));
    }

    public RetryConfig withMaxRetries(int value) {
        return new RetryConfig(value, baseDelay, maxDelay, backoffMultiplier, jitterEnabled, timeout);
    }

    public RetryConfig withTimeout(Duration value) {
        return new RetryConfig(maxRetries, baseDelay, maxDelay, backoffMultiplier, jitterEnabled, value);
    }

    public RetryConfig withJitter(boolean value) {
        return new RetryConfig(maxRetries, baseDelay, maxDelay, backoffMultiplier, value, timeout);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Delay to wait after the failed attempt with zero-based index {@code attempt}:
     * {@code min(baseDelay * backoffMultiplier^attempt, maxDelay)}, jittered when enabled and never
     * above {@code maxDelay}.
     */
    public Duration delayForAttempt(int attempt, RandomGenerator random) {
        double ideal = baseDelay.toMillis() * Math.pow(backoffMultiplier, Math.max(0, attempt));
        double capped = Math.min(ideal, maxDelay.toMillis());
        if (jitterEnabled && capped > 0) {
            capped += random.nextDouble(-JITTER_RATIO, JITTER_RATIO) * capped;
        }
        long delay = Math.max(0, Math.min(Math.round(capped), maxDelay.toMillis()));
        return Duration.ofMillis(delay);
    }
}
