package dev.pekelund.receiptscan.errors;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of a classified failure.
 *
 * @param kind the failure category
 * @param severity how serious the failure is
 * @param message the internal message; not meant for end users
 * @param context caller supplied details such as operation name or attempt number
 * @param timestamp when the failure was classified
 */
public record ErrorInfo(ErrorKind kind, Severity severity, String message, Map<String, Object> context,
    Instant timestamp) {

    public ErrorInfo {
        Objects.requireNonNull(kind, "kind must not be null");
        severity = severity != null ? severity : kind.defaultSeverity();
        message = message != null ? message : "";
        context = context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static ErrorInfo of(ErrorKind kind, String message) {
        return new ErrorInfo(kind, kind.defaultSeverity(), message, Map.of(), Instant.now());
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public String userMessage() {
        return kind.userMessage();
    }

    /**
     * Returns a copy with the given entry added to the context.
     */
    public ErrorInfo withContext(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(context);
        merged.put(key, value);
        return new ErrorInfo(kind, severity, message, merged, timestamp);
    }
}
