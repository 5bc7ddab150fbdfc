package dev.pekelund.receiptscan.metrics;

public enum AlertType {
    SLOW_RESPONSE,
    HIGH_FAILURE_RATE,
    FREQUENT_FALLBACK
}
