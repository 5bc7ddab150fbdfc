package dev.pekelund.receiptscan.recovery;

/**
 * Overall system health derived from the per-service states.
 */
public enum HealthVerdict {
    HEALTHY,
    DEGRADED,
    CRITICAL,
    DOWN
}
