package dev.pekelund.receiptscan.recovery;

import java.time.Duration;

/**
 * Timing of the recovery control loop.
 *
 * @param healthCheckInterval delay between health checks
 * @param autoRecoveryInterval delay between automatic recovery passes
 * @param coolDown wait after a recovery pass before health is checked again
 */
public record RecoverySettings(Duration healthCheckInterval, Duration autoRecoveryInterval, Duration coolDown) {

    public static RecoverySettings defaults() {
        return new RecoverySettings(Duration.ofSeconds(30), Duration.ofMinutes(5), Duration.ofSeconds(5));
    }
}
