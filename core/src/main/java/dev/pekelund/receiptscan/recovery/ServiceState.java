package dev.pekelund.receiptscan.recovery;

public enum ServiceState {
    UP,
    DEGRADED,
    DOWN
}
