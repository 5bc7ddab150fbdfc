package dev.pekelund.receiptscan.recovery;

import java.time.Duration;
import java.time.Instant;

public record ServiceStatus(ServiceState state, Instant lastCheck, double errorRate, Duration responseTime) {

    public boolean isUp() {
        return state == ServiceState.UP;
    }
}
