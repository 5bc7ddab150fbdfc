package dev.pekelund.receiptscan.recovery;

import dev.pekelund.receiptscan.circuit.CircuitBreakerRegistry;
import dev.pekelund.receiptscan.metrics.MemoryUsageProbe;
import dev.pekelund.receiptscan.metrics.MonitoringService;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drops accumulated statistics, resets circuit breakers and requests a garbage collection.
 */
public class MemoryReclaimAction extends AbstractRecoveryAction {

    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryReclaimAction.class);

    private final MonitoringService monitoringService;
    private final CircuitBreakerRegistry circuitBreakers;
    private final MemoryUsageProbe memoryProbe;

    public MemoryReclaimAction(MonitoringService monitoringService, CircuitBreakerRegistry circuitBreakers,
        MemoryUsageProbe memoryProbe, int priority) {
        super(RecoveryStrategy.GRACEFUL_DEGRADATION, "Clear statistics, reset circuit breakers and run GC",
            Duration.ofSeconds(5), priority, List.of("High heap usage"));
        this.monitoringService = monitoringService;
        this.circuitBreakers = circuitBreakers;
        this.memoryProbe = memoryProbe != null ? memoryProbe : MemoryUsageProbe.RUNTIME;
    }

    @Override
    public boolean execute() {
        long before = memoryProbe.currentUsage().usedMegabytes();
        monitoringService.resetStats();
        circuitBreakers.resetAll();
        System.gc();
        long after = memoryProbe.currentUsage().usedMegabytes();
        LOGGER.info("Memory reclaim finished - heap used before: {} MB, after: {} MB", before, after);
        return true;
    }
}
