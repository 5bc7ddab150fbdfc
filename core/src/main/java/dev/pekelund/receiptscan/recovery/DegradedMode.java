package dev.pekelund.receiptscan.recovery;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide switch that routes recognition straight to the fallback path for a limited time.
 */
public class DegradedMode {

    private static final Logger LOGGER = LoggerFactory.getLogger(DegradedMode.class);

    private final Clock clock;
    private volatile Instant activeUntil;
    private volatile String reason;

    public DegradedMode() {
        this(Clock.systemUTC());
    }

    public DegradedMode(Clock clock) {
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public synchronized void enableFor(Duration duration, String reason) {
        Instant until = clock.instant().plus(duration);
        if (activeUntil == null || until.isAfter(activeUntil)) {
            activeUntil = until;
        }
        this.reason = reason;
        LOGGER.warn("Degraded mode enabled until {} - {}", activeUntil, reason);
    }

    public synchronized void disable() {
        if (activeUntil != null) {
            LOGGER.info("Degraded mode disabled");
        }
        activeUntil = null;
        reason = null;
    }

    public boolean isActive() {
        Instant until = activeUntil;
        return until != null && clock.instant().isBefore(until);
    }

    public Optional<Instant> activeUntil() {
        return isActive() ? Optional.ofNullable(activeUntil) : Optional.empty();
    }

    public Optional<String> reason() {
        return isActive() ? Optional.ofNullable(reason) : Optional.empty();
    }
}
