package dev.pekelund.receiptscan.recognizer.web;

import dev.pekelund.receiptscan.recovery.HealthVerdict;
import dev.pekelund.receiptscan.recovery.RecoveryOrchestrator;
import dev.pekelund.receiptscan.recovery.SystemHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator that reports the application as DOWN while the recognition pipeline is CRITICAL or
 * DOWN, so the platform stops routing traffic to an instance that can only return fallback drafts.
 */
@Component("receiptRecognitionHealthIndicator")
public class ReceiptRecognitionHealthIndicator implements HealthIndicator {

    private final RecoveryOrchestrator recoveryOrchestrator;

    public ReceiptRecognitionHealthIndicator(RecoveryOrchestrator recoveryOrchestrator) {
        this.recoveryOrchestrator = recoveryOrchestrator;
    }

    @Override
    public Health health() {
        SystemHealth health = recoveryOrchestrator.systemHealth();
        Health.Builder builder = health.overall() == HealthVerdict.HEALTHY || health.overall() == HealthVerdict.DEGRADED
            ? Health.up()
            : Health.down();
        return builder
            .withDetail("verdict", health.overall())
            .withDetail("services", health.services())
            .withDetail("recommendations", health.recommendations())
            .withDetail("checkedAt", health.checkedAt())
            .build();
    }
}
