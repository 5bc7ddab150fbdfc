package dev.pekelund.receiptscan.recovery;

import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last resort: asks an operator to step in. Never reports success.
 */
public class ManualInterventionAction extends AbstractRecoveryAction {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManualInterventionAction.class);

    private final String service;

    public ManualInterventionAction(String service, int priority) {
        super(RecoveryStrategy.MANUAL_INTERVENTION, "Notify an operator that '" + service + "' needs attention",
            Duration.ofMinutes(30), priority, List.of("Automatic recovery exhausted"));
        this.service = service;
    }

    @Override
    public boolean execute() {
        LOGGER.error("Service '{}' could not be recovered automatically; manual intervention required", service);
        return false;
    }
}
