package dev.pekelund.receiptscan.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

import dev.pekelund.receiptscan.MutableClock;
import dev.pekelund.receiptscan.circuit.CircuitBreakerRegistry;
import dev.pekelund.receiptscan.errors.ErrorInfo;
import dev.pekelund.receiptscan.errors.ErrorKind;
import dev.pekelund.receiptscan.errors.Severity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MonitoringServiceTest {

    private static final long MB = 1024 * 1024;

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private CircuitBreakerRegistry circuitBreakers;
    private MemoryUsage memory;
    private MonitoringService monitoring;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        meterRegistry = new SimpleMeterRegistry();
        circuitBreakers = new CircuitBreakerRegistry(5, Duration.ofSeconds(60), clock);
        memory = new MemoryUsage(200 * MB, 1000 * MB);
        monitoring = new MonitoringService(meterRegistry, circuitBreakers, () -> memory, clock,
            AlertThresholds.defaults());
    }

    @Test
    @DisplayName("raises HIGH_FAILURE_RATE after five failures within five minutes")
    void raisesHighFailureRateAlert() {
        for (int i = 0; i < 5; i++) {
            monitoring.recordOutcome("model_invoke", false, Duration.ofSeconds(1), false, ErrorKind.API_TIMEOUT);
            clock.advance(Duration.ofSeconds(50));
        }

        assertThat(monitoring.alerts())
            .singleElement()
            .satisfies(alert -> {
                assertThat(alert.type()).isEqualTo(AlertType.HIGH_FAILURE_RATE);
                assertThat(alert.severity()).isEqualTo(Severity.HIGH);
                assertThat(alert.operation()).isEqualTo("model_invoke");
            });
    }

    @Test
    void failuresOutsideTheWindowDoNotCount() {
        for (int i = 0; i < 5; i++) {
            monitoring.recordOutcome("model_invoke", false, Duration.ofSeconds(1), false, ErrorKind.NETWORK_ERROR);
            clock.advance(Duration.ofMinutes(2));
        }

        assertThat(monitoring.alerts()).isEmpty();
    }

    @Test
    void doesNotRepeatTheSameAlertWithinItsWindow() {
        for (int i = 0; i < 8; i++) {
            monitoring.recordOutcome("model_invoke", false, null, false, ErrorKind.RATE_LIMITED);
        }

        assertThat(monitoring.alerts()).hasSize(1);

        clock.advance(Duration.ofMinutes(6));
        for (int i = 0; i < 5; i++) {
            monitoring.recordOutcome("model_invoke", false, null, false, ErrorKind.RATE_LIMITED);
        }
        assertThat(monitoring.alerts()).hasSize(2);
    }

    @Test
    void raisesSlowResponseAlertAboveTheCeiling() {
        monitoring.recordOutcome("receipt_recognition", true, Duration.ofSeconds(30), false, null);
        monitoring.recordOutcome("receipt_recognition", true, Duration.ofSeconds(31), false, null);

        assertThat(monitoring.alerts())
            .extracting(Alert::type, Alert::severity)
            .containsExactly(tuple(AlertType.SLOW_RESPONSE, Severity.MEDIUM));
    }

    @Test
    void raisesFrequentFallbackAlertAfterThreeFallbacksInTenMinutes() {
        monitoring.recordOutcome("receipt_recognition", true, Duration.ofSeconds(2), true, ErrorKind.NETWORK_ERROR);
        clock.advance(Duration.ofMinutes(4));
        monitoring.recordOutcome("receipt_recognition", true, Duration.ofSeconds(2), true, ErrorKind.NETWORK_ERROR);
        assertThat(monitoring.alerts()).isEmpty();
        clock.advance(Duration.ofMinutes(4));

        monitoring.recordOutcome("receipt_recognition", true, Duration.ofSeconds(2), true, ErrorKind.NETWORK_ERROR);

        assertThat(monitoring.alerts()).extracting(Alert::type).containsExactly(AlertType.FREQUENT_FALLBACK);
    }

    @Test
    void aggregatesCountersAcrossOperations() {
        monitoring.recordOutcome("receipt_recognition", true, Duration.ofMillis(100), false, null);
        monitoring.recordOutcome("receipt_recognition", true, Duration.ofMillis(300), true, ErrorKind.RATE_LIMITED);
        monitoring.recordOutcome("model_invoke", false, Duration.ofMillis(200), false, ErrorKind.RATE_LIMITED);
        monitoring.recordRetry("model_invoke");

        MetricsSnapshot snapshot = monitoring.currentMetrics();

        assertThat(snapshot.totalRequests()).isEqualTo(3);
        assertThat(snapshot.successfulRequests()).isEqualTo(2);
        assertThat(snapshot.failedRequests()).isEqualTo(1);
        assertThat(snapshot.fallbackRequests()).isEqualTo(1);
        assertThat(snapshot.retryCount()).isEqualTo(1);
        assertThat(snapshot.errorCounts()).containsEntry(ErrorKind.RATE_LIMITED, 2L);
        OperationSnapshot recognition = snapshot.operation("receipt_recognition").orElseThrow();
        assertThat(recognition.averageLatency()).isEqualTo(Duration.ofMillis(200));
        assertThat(recognition.p99Latency()).isEqualTo(Duration.ofMillis(300));
        assertThat(meterRegistry.get("receipt.recognition.requests").tag("operation", "model_invoke")
            .counter().count()).isEqualTo(1.0);
    }

    @Test
    void keepsOnlyTheMostRecentLatencies() {
        for (int i = 1; i <= 150; i++) {
            monitoring.recordOutcome("receipt_recognition", true, Duration.ofMillis(i), false, null);
        }

        OperationSnapshot snapshot = monitoring.currentMetrics().operation("receipt_recognition").orElseThrow();

        assertThat(snapshot.totalRequests()).isEqualTo(150);
        assertThat(snapshot.p50Latency()).isEqualTo(Duration.ofMillis(100));
        assertThat(snapshot.averageLatency()).isEqualTo(Duration.ofMillis(101));
    }

    @Test
    void recordsEveryAttemptReportedByTheRetryExecutor() {
        monitoring.onAttemptFailed("model_invoke", ErrorInfo.of(ErrorKind.NETWORK_ERROR, "refused"), 1,
            Duration.ofMillis(20));
        monitoring.onRetryScheduled("model_invoke", 2, Duration.ofMillis(100));
        monitoring.onAttemptSucceeded("model_invoke", 2, Duration.ofMillis(40));

        OperationSnapshot snapshot = monitoring.currentMetrics().operation("model_invoke").orElseThrow();

        assertThat(snapshot.totalRequests()).isEqualTo(2);
        assertThat(snapshot.failedRequests()).isEqualTo(1);
        assertThat(snapshot.retryCount()).isEqualTo(1);
        assertThat(snapshot.errorCounts()).containsEntry(ErrorKind.NETWORK_ERROR, 1L);
    }

    @Test
    void reportSummarisesRatesErrorsAndOpenCircuits() {
        memory = new MemoryUsage(900 * MB, 1000 * MB);
        for (int i = 0; i < 5; i++) {
            circuitBreakers.recordFailure("model_invoke");
        }
        monitoring.recordOutcome("receipt_recognition", false, Duration.ofMillis(10), true, ErrorKind.NETWORK_ERROR);
        monitoring.recordOutcome("receipt_recognition", false, Duration.ofMillis(10), true, ErrorKind.NETWORK_ERROR);
        monitoring.recordOutcome("receipt_recognition", true, Duration.ofMillis(10), false, null);

        MonitoringReport report = monitoring.report();

        assertThat(report.successRate()).isCloseTo(1.0 / 3, within(0.001));
        assertThat(report.topErrorKind()).isEqualTo(ErrorKind.NETWORK_ERROR);
        assertThat(report.metrics().openCircuits()).isEqualTo(1);
        assertThat(report.recommendations())
            .anyMatch(text -> text.startsWith("Success rate"))
            .anyMatch(text -> text.startsWith("Fallback rate"))
            .anyMatch(text -> text.contains("network errors"))
            .anyMatch(text -> text.startsWith("Heap usage"))
            .anyMatch(text -> text.contains("circuit breaker"));
    }

    @Test
    void quietReportSaysEverythingIsNormal() {
        monitoring.recordOutcome("receipt_recognition", true, Duration.ofMillis(10), false, null);

        assertThat(monitoring.report().recommendations()).containsExactly("All metrics are within normal ranges.");
        assertThat(monitoring.report().topErrorKind()).isNull();
    }

    @Test
    void resetClearsCountersButKeepsAlerts() {
        monitoring.recordOutcome("receipt_recognition", true, Duration.ofMinutes(1), false, null);

        monitoring.resetStats();

        assertThat(monitoring.currentMetrics().totalRequests()).isZero();
        assertThat(monitoring.currentMetrics().operations()).isEmpty();
        assertThat(monitoring.alerts()).hasSize(1);
    }
}
