package dev.pekelund.receiptscan.recovery;

public enum RecoveryStrategy {
    IMMEDIATE_RETRY,
    DELAYED_RETRY,
    FALLBACK_SERVICE,
    GRACEFUL_DEGRADATION,
    CIRCUIT_BREAKER_RESET,
    MANUAL_INTERVENTION
}
