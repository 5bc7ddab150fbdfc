package dev.pekelund.receiptscan.recovery;

import dev.pekelund.receiptscan.circuit.CircuitBreakerRegistry;
import dev.pekelund.receiptscan.circuit.CircuitBreakerStatus;
import dev.pekelund.receiptscan.errors.ErrorKind;
import dev.pekelund.receiptscan.metrics.MemoryUsage;
import dev.pekelund.receiptscan.metrics.MemoryUsageProbe;
import dev.pekelund.receiptscan.metrics.MetricsSnapshot;
import dev.pekelund.receiptscan.metrics.MonitoringService;
import dev.pekelund.receiptscan.metrics.OperationSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives per-service statuses and the overall verdict from the current metrics, circuit breaker
 * states and heap usage.
 */
public class HealthEvaluator {

    public static final String RECOGNITION_SERVICE = "recognition_service";
    public static final String NETWORK_CONNECTIVITY = "network_connectivity";
    public static final String MEMORY_MANAGEMENT = "memory_management";

    private static final double RECOGNITION_DOWN_ERROR_RATE = 0.5;
    private static final double RECOGNITION_DEGRADED_ERROR_RATE = 0.2;
    private static final Duration RECOGNITION_DOWN_LATENCY = Duration.ofSeconds(60);
    private static final Duration RECOGNITION_DEGRADED_LATENCY = Duration.ofSeconds(30);
    private static final double NETWORK_DOWN_SHARE = 0.3;
    private static final double NETWORK_DEGRADED_SHARE = 0.1;
    private static final double MEMORY_DOWN_RATIO = 0.9;
    private static final double MEMORY_DEGRADED_RATIO = 0.75;

    private final MonitoringService monitoringService;
    private final CircuitBreakerRegistry circuitBreakers;
    private final MemoryUsageProbe memoryProbe;
    private final Clock clock;
    private final String recognitionOperation;
    private final String modelOperation;

    public HealthEvaluator(MonitoringService monitoringService, CircuitBreakerRegistry circuitBreakers,
        MemoryUsageProbe memoryProbe, Clock clock, String recognitionOperation, String modelOperation) {
        this.monitoringService = monitoringService;
        this.circuitBreakers = circuitBreakers;
        this.memoryProbe = memoryProbe != null ? memoryProbe : MemoryUsageProbe.RUNTIME;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.recognitionOperation = recognitionOperation;
        this.modelOperation = modelOperation;
    }

    public SystemHealth evaluate(List<RecoveryActionDescriptor> activeRecoveryActions) {
        Instant now = clock.instant();
        MetricsSnapshot metrics = monitoringService.currentMetrics();

        Map<String, ServiceStatus> services = new LinkedHashMap<>();
        services.put(RECOGNITION_SERVICE, recognitionStatus(metrics, now));
        services.put(NETWORK_CONNECTIVITY, networkStatus(metrics, now));
        services.put(MEMORY_MANAGEMENT, memoryStatus(now));

        HealthVerdict verdict = verdict(services);
        return new SystemHealth(verdict, services, activeRecoveryActions, recommendations(verdict, services), now);
    }

    static HealthVerdict verdict(Map<String, ServiceStatus> services) {
        long down = services.values().stream().filter(status -> status.state() == ServiceState.DOWN).count();
        boolean degraded = services.values().stream().anyMatch(status -> status.state() == ServiceState.DEGRADED);
        if (down >= 2) {
            return HealthVerdict.DOWN;
        }
        if (down == 1) {
            return HealthVerdict.CRITICAL;
        }
        return degraded ? HealthVerdict.DEGRADED : HealthVerdict.HEALTHY;
    }

    private ServiceStatus recognitionStatus(MetricsSnapshot metrics, Instant now) {
        OperationSnapshot operation = metrics.operation(recognitionOperation).orElse(null);
        double errorRate = operation != null ? operation.errorRate() : 0.0;
        Duration latency = operation != null ? operation.averageLatency() : Duration.ZERO;

        ServiceState state;
        if (errorRate > RECOGNITION_DOWN_ERROR_RATE || latency.compareTo(RECOGNITION_DOWN_LATENCY) > 0) {
            state = ServiceState.DOWN;
        } else if (errorRate > RECOGNITION_DEGRADED_ERROR_RATE
            || latency.compareTo(RECOGNITION_DEGRADED_LATENCY) > 0) {
            state = ServiceState.DEGRADED;
        } else {
            state = ServiceState.UP;
        }
        if (state == ServiceState.UP && modelCircuitOpen()) {
            state = ServiceState.DEGRADED;
        }
        return new ServiceStatus(state, now, errorRate, latency);
    }

    private ServiceStatus networkStatus(MetricsSnapshot metrics, Instant now) {
        long totalErrors = metrics.totalErrors();
        long networkErrors = metrics.errorCounts().getOrDefault(ErrorKind.NETWORK_ERROR, 0L);
        double share = totalErrors > 0 ? (double) networkErrors / totalErrors : 0.0;
        ServiceState state = share > NETWORK_DOWN_SHARE ? ServiceState.DOWN
            : share > NETWORK_DEGRADED_SHARE ? ServiceState.DEGRADED
            : ServiceState.UP;
        Duration latency = metrics.operation(modelOperation)
            .map(OperationSnapshot::averageLatency)
            .orElse(Duration.ZERO);
        return new ServiceStatus(state, now, share, latency);
    }

    private ServiceStatus memoryStatus(Instant now) {
        MemoryUsage usage = memoryProbe.currentUsage();
        double ratio = usage.usedRatio();
        ServiceState state = ratio > MEMORY_DOWN_RATIO ? ServiceState.DOWN
            : ratio > MEMORY_DEGRADED_RATIO ? ServiceState.DEGRADED
            : ServiceState.UP;
        return new ServiceStatus(state, now, 0.0, Duration.ZERO);
    }

    private boolean modelCircuitOpen() {
        return circuitBreakers.allStatuses().stream()
            .filter(status -> status.key().equals(modelOperation))
            .anyMatch(CircuitBreakerStatus::isOpen);
    }

    private static List<String> recommendations(HealthVerdict verdict, Map<String, ServiceStatus> services) {
        List<String> recommendations = new ArrayList<>();
        services.forEach((name, status) -> {
            if (status.isUp()) {
                return;
            }
            switch (name) {
                case RECOGNITION_SERVICE -> recommendations.add(String.format(
                    "Recognition is %s (error rate %.0f%%). Check the model provider and API quota.",
                    status.state(), status.errorRate() * 100));
                case NETWORK_CONNECTIVITY -> recommendations.add(
                    "Network errors dominate recent failures. Check DNS and outbound connectivity.");
                case MEMORY_MANAGEMENT -> recommendations.add(
                    "Heap usage is high. Reduce concurrent uploads or increase the heap size.");
                default -> recommendations.add("Service '" + name + "' is " + status.state() + ".");
            }
        });
        if (verdict == HealthVerdict.CRITICAL || verdict == HealthVerdict.DOWN) {
            recommendations.add("Consider triggering manual recovery or alerting the on-call engineer.");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("All services are operating normally.");
        }
        return recommendations;
    }
}
