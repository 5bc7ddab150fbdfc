package dev.pekelund.receiptscan.metrics;

import dev.pekelund.receiptscan.errors.ErrorKind;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Counters and latency figures of one operation at a point in time.
 */
public record OperationSnapshot(String operation, long totalRequests, long successfulRequests,
    long failedRequests, long fallbackRequests, long retryCount, Duration averageLatency, Duration p50Latency,
    Duration p95Latency, Duration p99Latency, Map<ErrorKind, Long> errorCounts, Instant lastUpdated) {

    public OperationSnapshot {
        errorCounts = errorCounts != null ? Map.copyOf(errorCounts) : Map.of();
    }

    public double successRate() {
        return totalRequests > 0 ? (double) successfulRequests / totalRequests : 1.0;
    }

    public double errorRate() {
        return totalRequests > 0 ? (double) failedRequests / totalRequests : 0.0;
    }

    public double fallbackRate() {
        return totalRequests > 0 ? (double) fallbackRequests / totalRequests : 0.0;
    }
}
