package dev.pekelund.receiptscan.metrics;

import dev.pekelund.receiptscan.errors.Severity;
import java.time.Instant;
import java.util.Map;

/**
 * Entry of the append-only alert log. Alerts describe a crossed threshold; they never act on it.
 */
public record Alert(AlertType type, Severity severity, String operation, String message,
    Map<String, Object> context, Instant timestamp) {

    public Alert {
        context = context != null ? Map.copyOf(context) : Map.of();
    }
}
