package dev.pekelund.receiptscan.metrics;

import dev.pekelund.receiptscan.errors.ErrorKind;
import java.time.Instant;
import java.util.List;

/**
 * Human oriented summary derived from a {@link MetricsSnapshot}.
 *
 * @param topErrorKind most frequent error kind, {@code null} when nothing failed
 */
public record MonitoringReport(Instant generatedAt, MetricsSnapshot metrics, double successRate,
    double fallbackRate, ErrorKind topErrorKind, List<Alert> recentAlerts, List<String> recommendations) {

    public MonitoringReport {
        recentAlerts = recentAlerts != null ? List.copyOf(recentAlerts) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }
}
