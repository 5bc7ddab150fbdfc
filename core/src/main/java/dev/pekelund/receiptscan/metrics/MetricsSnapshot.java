package dev.pekelund.receiptscan.metrics;

import dev.pekelund.receiptscan.errors.ErrorKind;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time view of everything {@link MonitoringService} has recorded.
 */
public record MetricsSnapshot(Instant capturedAt, Duration uptime, long totalRequests, long successfulRequests,
    long failedRequests, long fallbackRequests, long retryCount, Map<String, OperationSnapshot> operations,
    Map<ErrorKind, Long> errorCounts, MemoryUsage memory, int openCircuits) {

    public MetricsSnapshot {
        operations = operations != null ? Map.copyOf(operations) : Map.of();
        errorCounts = errorCounts != null ? Map.copyOf(errorCounts) : Map.of();
    }

    public Optional<OperationSnapshot> operation(String name) {
        return Optional.ofNullable(operations.get(name));
    }

    public double successRate() {
        return totalRequests > 0 ? (double) successfulRequests / totalRequests : 1.0;
    }

    public double fallbackRate() {
        return totalRequests > 0 ? (double) fallbackRequests / totalRequests : 0.0;
    }

    public long totalErrors() {
        return errorCounts.values().stream().mapToLong(Long::longValue).sum();
    }
}
