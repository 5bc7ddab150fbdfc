package dev.pekelund.receiptscan.recovery;

import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probes the model endpoint and reports whether it is reachable again.
 */
public class ConnectivityProbeAction extends AbstractRecoveryAction {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectivityProbeAction.class);

    private final ConnectivityProbe probe;

    public ConnectivityProbeAction(ConnectivityProbe probe, int priority) {
        super(RecoveryStrategy.IMMEDIATE_RETRY, "Probe connectivity to the model endpoint", Duration.ofSeconds(10),
            priority, List.of("Network errors", "DNS resolution failures"));
        this.probe = probe;
    }

    @Override
    public boolean execute() throws Exception {
        boolean reachable = probe.isReachable();
        LOGGER.info("Connectivity probe result: {}", reachable ? "reachable" : "unreachable");
        return reachable;
    }
}
