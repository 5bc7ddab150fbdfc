package dev.pekelund.receiptscan.metrics;

import dev.pekelund.receiptscan.errors.ErrorKind;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/**
 * Mutable per-operation counters. All access goes through methods synchronized on the instance.
 */
final class OperationStats {

    private final String operation;
    private final int latencySamples;

    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private long fallbackRequests;
    private long retryCount;
    private final Deque<Long> latenciesMillis = new ArrayDeque<>();
    private final Map<ErrorKind, Long> errorCounts = new EnumMap<>(ErrorKind.class);
    private final Deque<Instant> failureTimes = new ArrayDeque<>();
    private final Deque<Instant> fallbackTimes = new ArrayDeque<>();
    private final Map<AlertType, Instant> lastAlertAt = new EnumMap<>(AlertType.class);
    private Instant lastUpdated;

    OperationStats(String operation, int latencySamples) {
        this.operation = operation;
        this.latencySamples = latencySamples;
    }

    synchronized void recordOutcome(boolean success, Duration latency, boolean fallbackUsed, ErrorKind errorKind,
        Instant now) {
        totalRequests++;
        if (success) {
            successfulRequests++;
        } else {
            failedRequests++;
            failureTimes.addLast(now);
        }
        if (fallbackUsed) {
            fallbackRequests++;
            fallbackTimes.addLast(now);
        }
        if (errorKind != null) {
            errorCounts.merge(errorKind, 1L, Long::sum);
        }
        if (latency != null) {
            latenciesMillis.addLast(latency.toMillis());
            while (latenciesMillis.size() > latencySamples) {
                latenciesMillis.removeFirst();
            }
        }
        lastUpdated = now;
    }

    synchronized void recordRetry(Instant now) {
        retryCount++;
        lastUpdated = now;
    }

    /**
     * Drops events older than {@code window} and returns how many remain.
     */
    synchronized int failuresWithin(Duration window, Instant now) {
        return prune(failureTimes, window, now);
    }

    synchronized int fallbacksWithin(Duration window, Instant now) {
        return prune(fallbackTimes, window, now);
    }

    /**
     * Marks an alert as raised unless one of the same type was already raised within {@code window}.
     *
     * @return {@code true} when the caller should raise the alert
     */
    synchronized boolean claimAlert(AlertType type, Duration window, Instant now) {
        Instant previous = lastAlertAt.get(type);
        if (previous != null && previous.plus(window).isAfter(now)) {
            return false;
        }
        lastAlertAt.put(type, now);
        return true;
    }

    synchronized OperationSnapshot snapshot() {
        long[] sorted = latenciesMillis.stream().mapToLong(Long::longValue).toArray();
        Arrays.sort(sorted);
        Duration average = sorted.length == 0
            ? Duration.ZERO
            : Duration.ofMillis(Math.round(Arrays.stream(sorted).average().orElse(0)));
        return new OperationSnapshot(operation, totalRequests, successfulRequests, failedRequests,
            fallbackRequests, retryCount, average, percentile(sorted, 0.50), percentile(sorted, 0.95),
            percentile(sorted, 0.99), new EnumMap<>(errorCounts), lastUpdated);
    }

    private static int prune(Deque<Instant> events, Duration window, Instant now) {
        Instant cutoff = now.minus(window);
        while (!events.isEmpty() && events.peekFirst().isBefore(cutoff)) {
            events.removeFirst();
        }
        return events.size();
    }

    // nearest-rank
    private static Duration percentile(long[] sorted, double quantile) {
        if (sorted.length == 0) {
            return Duration.ZERO;
        }
        int rank = (int) Math.ceil(quantile * sorted.length);
        int index = Math.min(sorted.length - 1, Math.max(0, rank - 1));
        return Duration.ofMillis(sorted[index]);
    }
}
