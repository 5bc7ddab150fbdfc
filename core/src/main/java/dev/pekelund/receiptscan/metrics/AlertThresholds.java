package dev.pekelund.receiptscan.metrics;

import java.time.Duration;
import org.springframework.util.Assert;

/**
 * Thresholds used by {@link MonitoringService} when deciding whether to raise an alert.
 *
 * @param slowResponse latency above which a {@link AlertType#SLOW_RESPONSE} alert is raised
 * @param failureWindow trailing window for counting failures
 * @param failureCount failures within {@code failureWindow} that raise {@link AlertType#HIGH_FAILURE_RATE}
 * @param fallbackWindow trailing window for counting fallback invocations
 * @param fallbackCount fallbacks within {@code fallbackWindow} that raise {@link AlertType#FREQUENT_FALLBACK}
 * @param latencySamples number of most recent latencies kept per operation
 * @param alertRetention number of most recent alerts kept in the log
 */
public record AlertThresholds(Duration slowResponse, Duration failureWindow, int failureCount,
    Duration fallbackWindow, int fallbackCount, int latencySamples, int alertRetention) {

    public AlertThresholds {
        Assert.notNull(slowResponse, "slowResponse must not be null");
        Assert.notNull(failureWindow, "failureWindow must not be null");
        Assert.notNull(fallbackWindow, "fallbackWindow must not be null");
        Assert.isTrue(failureCount > 0 && fallbackCount > 0, "Alert counts must be positive");
        Assert.isTrue(latencySamples > 0 && alertRetention > 0, "Sample sizes must be positive");
    }

    public static AlertThresholds defaults() {
        return new AlertThresholds(Duration.ofSeconds(30), Duration.ofMinutes(5), 5, Duration.ofMinutes(10), 3,
            100, 500);
    }
}
