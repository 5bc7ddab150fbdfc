package dev.pekelund.receiptscan.recovery;

import java.time.Duration;
import java.util.List;

/**
 * Switches recognition to the fallback path for a while so callers get fast best-effort results.
 */
public class FallbackModeAction extends AbstractRecoveryAction {

    private final DegradedMode degradedMode;
    private final Duration duration;

    public FallbackModeAction(DegradedMode degradedMode, Duration duration, int priority) {
        super(RecoveryStrategy.FALLBACK_SERVICE, "Serve fallback recognition for " + duration.toMinutes() + " minutes",
            Duration.ofSeconds(1), priority, List.of("Primary model unavailable", "High error rate"));
        this.degradedMode = degradedMode;
        this.duration = duration;
    }

    @Override
    public boolean execute() {
        degradedMode.enableFor(duration, "Enabled by recovery action");
        return true;
    }
}
