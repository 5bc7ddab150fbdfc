package dev.pekelund.receiptscan.metrics;

import dev.pekelund.receiptscan.circuit.CircuitBreakerRegistry;
import dev.pekelund.receiptscan.errors.ErrorInfo;
import dev.pekelund.receiptscan.errors.ErrorKind;
import dev.pekelund.receiptscan.errors.Severity;
import dev.pekelund.receiptscan.retry.RetryListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Records the outcome of every operation, keeps rolling counters and latency windows, and raises
 * alerts when thresholds are crossed. Counts are mirrored into a Micrometer {@link MeterRegistry}.
 *
 * <p>Registered as a {@link RetryListener} so that every individual model attempt is recorded under
 * its own operation key as well.
 */
public class MonitoringService implements RetryListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(MonitoringService.class);

    private static final String METRIC_PREFIX = "receipt.recognition";
    private static final double LOW_SUCCESS_RATE = 0.80;
    private static final double HIGH_FALLBACK_RATE = 0.20;
    private static final double HIGH_MEMORY_RATIO = 0.75;

    private final MeterRegistry meterRegistry;
    private final CircuitBreakerRegistry circuitBreakers;
    private final MemoryUsageProbe memoryProbe;
    private final Clock clock;
    private final AlertThresholds thresholds;
    private final Instant startedAt;

    private final ConcurrentMap<String, OperationStats> operations = new ConcurrentHashMap<>();
    private final Deque<Alert> alerts = new ArrayDeque<>();

    public MonitoringService(MeterRegistry meterRegistry, CircuitBreakerRegistry circuitBreakers) {
        this(meterRegistry, circuitBreakers, MemoryUsageProbe.RUNTIME, Clock.systemUTC(), AlertThresholds.defaults());
    }

    public MonitoringService(MeterRegistry meterRegistry, CircuitBreakerRegistry circuitBreakers,
        MemoryUsageProbe memoryProbe, Clock clock, AlertThresholds thresholds) {
        Assert.notNull(circuitBreakers, "CircuitBreakerRegistry must not be null");
        this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
        this.circuitBreakers = circuitBreakers;
        this.memoryProbe = memoryProbe != null ? memoryProbe : MemoryUsageProbe.RUNTIME;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.thresholds = thresholds != null ? thresholds : AlertThresholds.defaults();
        this.startedAt = this.clock.instant();
    }

    /**
     * Records one finished operation and evaluates the alert conditions for it.
     *
     * @param latency elapsed time, or {@code null} when the operation never ran
     * @param errorKind classification of the failure, or {@code null}
     */
    public void recordOutcome(String operation, boolean success, Duration latency, boolean fallbackUsed,
        ErrorKind errorKind) {
        Assert.hasText(operation, "Operation must not be empty");
        Instant now = clock.instant();
        OperationStats stats = stats(operation);
        stats.recordOutcome(success, latency, fallbackUsed, errorKind, now);

        Counter.builder(METRIC_PREFIX + ".requests")
            .description("Recorded operation outcomes")
            .tag("operation", operation)
            .tag("outcome", success ? "success" : "failure")
            .tag("fallback", Boolean.toString(fallbackUsed))
            .register(meterRegistry)
            .increment();
        if (errorKind != null) {
            Counter.builder(METRIC_PREFIX + ".errors")
                .description("Classified failures")
                .tag("operation", operation)
                .tag("kind", errorKind.name())
                .register(meterRegistry)
                .increment();
        }
        if (latency != null) {
            Timer.builder(METRIC_PREFIX + ".latency")
                .description("Operation latency")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(latency);
        }

        evaluateAlerts(operation, stats, success, latency, fallbackUsed, now);
    }

    public void recordRetry(String operation) {
        Assert.hasText(operation, "Operation must not be empty");
        stats(operation).recordRetry(clock.instant());
        Counter.builder(METRIC_PREFIX + ".retries")
            .description("Scheduled retries")
            .tag("operation", operation)
            .register(meterRegistry)
            .increment();
    }

    @Override
    public void onAttemptSucceeded(String operation, int attempt, Duration latency) {
        recordOutcome(operation, true, latency, false, null);
    }

    @Override
    public void onAttemptFailed(String operation, ErrorInfo error, int attempt, Duration latency) {
        recordOutcome(operation, false, latency, false, error.kind());
    }

    @Override
    public void onRetryScheduled(String operation, int nextAttempt, Duration delay) {
        recordRetry(operation);
    }

    public MetricsSnapshot currentMetrics() {
        Map<String, OperationSnapshot> snapshots = new LinkedHashMap<>();
        operations.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(entry -> snapshots.put(entry.getKey(), entry.getValue().snapshot()));

        long total = 0;
        long successful = 0;
        long failed = 0;
        long fallback = 0;
        long retries = 0;
        Map<ErrorKind, Long> errorCounts = new EnumMap<>(ErrorKind.class);
        for (OperationSnapshot snapshot : snapshots.values()) {
            total += snapshot.totalRequests();
            successful += snapshot.successfulRequests();
            failed += snapshot.failedRequests();
            fallback += snapshot.fallbackRequests();
            retries += snapshot.retryCount();
            snapshot.errorCounts().forEach((kind, count) -> errorCounts.merge(kind, count, Long::sum));
        }
        Instant now = clock.instant();
        return new MetricsSnapshot(now, Duration.between(startedAt, now), total, successful, failed, fallback,
            retries, snapshots, errorCounts, memoryProbe.currentUsage(), circuitBreakers.openCircuitCount());
    }

    public MonitoringReport report() {
        MetricsSnapshot metrics = currentMetrics();
        ErrorKind topErrorKind = metrics.errorCounts().entrySet().stream()
            .max(Map.Entry.<ErrorKind, Long>comparingByValue()
                .thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
            .map(Map.Entry::getKey)
            .orElse(null);
        return new MonitoringReport(clock.instant(), metrics, metrics.successRate(), metrics.fallbackRate(),
            topErrorKind, alertsSince(clock.instant().minus(Duration.ofHours(1))),
            recommendations(metrics, topErrorKind));
    }

    public List<Alert> alerts() {
        synchronized (alerts) {
            return List.copyOf(alerts);
        }
    }

    public List<Alert> alertsSince(Instant since) {
        synchronized (alerts) {
            return alerts.stream().filter(alert -> !alert.timestamp().isBefore(since)).toList();
        }
    }

    /**
     * Clears all counters and latency windows. The alert log is kept.
     */
    public void resetStats() {
        operations.clear();
        LOGGER.info("Monitoring statistics reset");
    }

    private void evaluateAlerts(String operation, OperationStats stats, boolean success, Duration latency,
        boolean fallbackUsed, Instant now) {
        if (latency != null && latency.compareTo(thresholds.slowResponse()) > 0) {
            raise(new Alert(AlertType.SLOW_RESPONSE, Severity.MEDIUM, operation,
                String.format("Operation '%s' took %d ms (limit %d ms)", operation, latency.toMillis(),
                    thresholds.slowResponse().toMillis()),
                Map.of("latencyMs", latency.toMillis()), now));
        }
        if (!success) {
            int failures = stats.failuresWithin(thresholds.failureWindow(), now);
            if (failures >= thresholds.failureCount()
                && stats.claimAlert(AlertType.HIGH_FAILURE_RATE, thresholds.failureWindow(), now)) {
                raise(new Alert(AlertType.HIGH_FAILURE_RATE, Severity.HIGH, operation,
                    String.format("Operation '%s' failed %d times in the last %d minutes", operation, failures,
                        thresholds.failureWindow().toMinutes()),
                    Map.of("failures", failures), now));
            }
        }
        if (fallbackUsed) {
            int fallbacks = stats.fallbacksWithin(thresholds.fallbackWindow(), now);
            if (fallbacks >= thresholds.fallbackCount()
                && stats.claimAlert(AlertType.FREQUENT_FALLBACK, thresholds.fallbackWindow(), now)) {
                raise(new Alert(AlertType.FREQUENT_FALLBACK, Severity.MEDIUM, operation,
                    String.format("Operation '%s' used the fallback %d times in the last %d minutes", operation,
                        fallbacks, thresholds.fallbackWindow().toMinutes()),
                    Map.of("fallbacks", fallbacks), now));
            }
        }
    }

    private void raise(Alert alert) {
        synchronized (alerts) {
            alerts.addLast(alert);
            while (alerts.size() > thresholds.alertRetention()) {
                alerts.removeFirst();
            }
        }
        Counter.builder(METRIC_PREFIX + ".alerts")
            .description("Raised alerts")
            .tag("type", alert.type().name())
            .register(meterRegistry)
            .increment();
        LOGGER.warn("ALERT [{}] {} - {}", alert.severity(), alert.type(), alert.message());
    }

    private List<String> recommendations(MetricsSnapshot metrics, ErrorKind topErrorKind) {
        List<String> recommendations = new ArrayList<>();
        if (metrics.totalRequests() > 0 && metrics.successRate() < LOW_SUCCESS_RATE) {
            recommendations.add(String.format(
                "Success rate is %.0f%%. Check the recognition service and network connectivity.",
                metrics.successRate() * 100));
        }
        if (metrics.fallbackRate() > HIGH_FALLBACK_RATE) {
            recommendations.add(String.format(
                "Fallback rate is %.0f%%. Many results need manual review; investigate the primary model path.",
                metrics.fallbackRate() * 100));
        }
        if (topErrorKind != null) {
            recommendations.add(recommendationFor(topErrorKind));
        }
        if (metrics.memory().usedRatio() > HIGH_MEMORY_RATIO) {
            recommendations.add(String.format("Heap usage is high (%d MB). Consider a memory recovery action.",
                metrics.memory().usedMegabytes()));
        }
        if (metrics.openCircuits() > 0) {
            recommendations.add(metrics.openCircuits()
                + " circuit breaker(s) open. Verify the dependency before resetting them.");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("All metrics are within normal ranges.");
        }
        return recommendations;
    }

    private static String recommendationFor(ErrorKind kind) {
        return switch (kind) {
            case NETWORK_ERROR -> "Most failures are network errors. Check outbound connectivity to the model endpoint.";
            case API_TIMEOUT -> "Most failures are timeouts. Consider longer timeouts or smaller images.";
            case RATE_LIMITED -> "Most failures are rate limits. Reduce request concurrency or raise the quota.";
            case AUTHENTICATION_ERROR -> "Most failures are authentication errors. Verify the model API key.";
            case PARSING_ERROR -> "Most failures are parsing errors. Review the prompt and the model response format.";
            case IMAGE_PROCESSING_ERROR -> "Most failures are image errors. Ask users for clearer, well lit photos.";
            case SERVICE_UNAVAILABLE -> "Most failures are service outages. Check the model provider status.";
            case UNKNOWN -> "Most failures are unclassified. Inspect the application logs.";
        };
    }

    private OperationStats stats(String operation) {
        return operations.computeIfAbsent(operation, key -> new OperationStats(key, thresholds.latencySamples()));
    }
}
