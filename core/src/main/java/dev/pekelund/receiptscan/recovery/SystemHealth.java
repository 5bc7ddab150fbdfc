package dev.pekelund.receiptscan.recovery;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot produced by each health check. A new instance replaces the previous one.
 */
public record SystemHealth(HealthVerdict overall, Map<String, ServiceStatus> services,
    List<RecoveryActionDescriptor> activeRecoveryActions, List<String> recommendations, Instant checkedAt) {

    public SystemHealth {
        services = services != null ? Collections.unmodifiableMap(new LinkedHashMap<>(services)) : Map.of();
        activeRecoveryActions = activeRecoveryActions != null ? List.copyOf(activeRecoveryActions) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }
}
