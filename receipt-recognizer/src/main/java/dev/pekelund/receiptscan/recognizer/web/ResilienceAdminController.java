package dev.pekelund.receiptscan.recognizer.web;

import dev.pekelund.receiptscan.circuit.CircuitBreakerRegistry;
import dev.pekelund.receiptscan.circuit.CircuitBreakerStatus;
import dev.pekelund.receiptscan.metrics.Alert;
import dev.pekelund.receiptscan.metrics.MetricsSnapshot;
import dev.pekelund.receiptscan.metrics.MonitoringReport;
import dev.pekelund.receiptscan.metrics.MonitoringService;
import dev.pekelund.receiptscan.recovery.RecoveryActionDescriptor;
import dev.pekelund.receiptscan.recovery.RecoveryOrchestrator;
import dev.pekelund.receiptscan.recovery.RecoveryStrategy;
import dev.pekelund.receiptscan.recovery.SystemHealth;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for inspecting and steering the resilience machinery.
 */
@RestController
@RequestMapping(path = "/api/resilience", produces = MediaType.APPLICATION_JSON_VALUE)
public class ResilienceAdminController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResilienceAdminController.class);

    private final MonitoringService monitoringService;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RecoveryOrchestrator recoveryOrchestrator;

    public ResilienceAdminController(MonitoringService monitoringService, CircuitBreakerRegistry circuitBreakers,
        RecoveryOrchestrator recoveryOrchestrator) {
        this.monitoringService = monitoringService;
        this.circuitBreakers = circuitBreakers;
        this.recoveryOrchestrator = recoveryOrchestrator;
    }

    @GetMapping("/metrics")
    public MetricsSnapshot metrics() {
        return monitoringService.currentMetrics();
    }

    @GetMapping("/report")
    public MonitoringReport report() {
        return monitoringService.report();
    }

    @GetMapping("/alerts")
    public List<Alert> alerts() {
        return monitoringService.alerts();
    }

    @GetMapping("/health")
    public SystemHealth health() {
        return recoveryOrchestrator.systemHealth();
    }

    @GetMapping("/circuit-breakers")
    public List<CircuitBreakerStatus> circuitBreakers() {
        return circuitBreakers.allStatuses();
    }

    @PostMapping("/circuit-breakers/{key}/reset")
    public CircuitBreakerStatus resetCircuitBreaker(@PathVariable("key") String key) {
        LOGGER.info("Operator reset of circuit breaker '{}'", key);
        circuitBreakers.reset(key);
        return circuitBreakers.statusOf(key);
    }

    @PostMapping("/circuit-breakers/reset")
    public List<CircuitBreakerStatus> resetAllCircuitBreakers() {
        LOGGER.info("Operator reset of all circuit breakers");
        circuitBreakers.resetAll();
        return circuitBreakers.allStatuses();
    }

    @GetMapping("/recovery/strategies")
    public Map<String, List<RecoveryActionDescriptor>> recoveryStrategies() {
        return recoveryOrchestrator.availableStrategies();
    }

    @PostMapping("/recovery/{service}")
    public RecoveryResponse triggerRecovery(@PathVariable("service") String service,
        @RequestParam(name = "strategy", required = false) String strategy) {
        RecoveryStrategy requested = StringUtils.hasText(strategy)
            ? RecoveryStrategy.valueOf(strategy.trim().toUpperCase(Locale.ROOT))
            : null;
        boolean success = recoveryOrchestrator.triggerManualRecovery(service, requested);
        return new RecoveryResponse(service, requested, success);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException exception) {
        LOGGER.warn("Rejected resilience request: {}", exception.getMessage());
        return Map.of("error", String.valueOf(exception.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleConflict(IllegalStateException exception) {
        LOGGER.warn("Resilience request conflicts with running work: {}", exception.getMessage());
        return Map.of("error", String.valueOf(exception.getMessage()));
    }

    /**
     * @param strategy {@code null} when every strategy of the service was allowed
     */
    public record RecoveryResponse(String service, RecoveryStrategy strategy, boolean success) { }
}
