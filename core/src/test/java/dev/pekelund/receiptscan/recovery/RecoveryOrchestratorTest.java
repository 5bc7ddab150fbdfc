package dev.pekelund.receiptscan.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.receiptscan.MutableClock;
import dev.pekelund.receiptscan.circuit.CircuitBreakerRegistry;
import dev.pekelund.receiptscan.circuit.CircuitState;
import dev.pekelund.receiptscan.errors.ErrorKind;
import dev.pekelund.receiptscan.metrics.AlertThresholds;
import dev.pekelund.receiptscan.metrics.MemoryUsage;
import dev.pekelund.receiptscan.metrics.MonitoringService;
import dev.pekelund.receiptscan.metrics.OperationSnapshot;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RecoveryOrchestratorTest {

    private static final String RECOGNITION = HealthEvaluator.RECOGNITION_SERVICE;

    private final List<String> executed = new ArrayList<>();
    private final List<Duration> sleeps = new ArrayList<>();
    private MutableClock clock;
    private CircuitBreakerRegistry circuitBreakers;
    private MonitoringService monitoring;
    private RecoveryActionRegistry actions;
    private RecoveryOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        circuitBreakers = new CircuitBreakerRegistry(3, Duration.ofSeconds(60), clock);
        MemoryUsage memory = new MemoryUsage(10, 1000);
        monitoring = new MonitoringService(new SimpleMeterRegistry(), circuitBreakers, () -> memory, clock,
            AlertThresholds.defaults());
        HealthEvaluator evaluator = new HealthEvaluator(monitoring, circuitBreakers, () -> memory, clock,
            "receipt_recognition", "model_invoke");
        actions = new RecoveryActionRegistry();
        orchestrator = new RecoveryOrchestrator(evaluator, actions, monitoring, sleeps::add,
            new RecoverySettings(Duration.ofSeconds(30), Duration.ofMinutes(5), Duration.ofSeconds(5)));
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    @Test
    @DisplayName("does nothing when every watched service is up")
    void healthySystemTriggersNoAction() {
        actions.register(RECOGNITION, action(RecoveryStrategy.IMMEDIATE_RETRY, 8, () -> true));

        List<RecoveryOutcome> outcomes = orchestrator.runAutoRecovery();

        assertThat(orchestrator.systemHealth().overall()).isEqualTo(HealthVerdict.HEALTHY);
        assertThat(outcomes).isEmpty();
        assertThat(executed).isEmpty();
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("runs actions by descending priority and stops once the service is up again")
    void runsActionsInPriorityOrderUntilTheServiceRecovers() {
        degradeRecognition();
        actions.register(RECOGNITION, action(RecoveryStrategy.DELAYED_RETRY, 5, () -> {
            monitoring.resetStats();
            return true;
        }));
        actions.register(RECOGNITION, action(RecoveryStrategy.IMMEDIATE_RETRY, 8, () -> false));
        actions.register(RECOGNITION, action(RecoveryStrategy.FALLBACK_SERVICE, 6, () -> {
            throw new IllegalStateException("boom");
        }));
        actions.register(RECOGNITION, action(RecoveryStrategy.MANUAL_INTERVENTION, 1, () -> true));

        List<RecoveryOutcome> outcomes = orchestrator.runAutoRecovery();

        assertThat(executed).containsExactly("IMMEDIATE_RETRY", "FALLBACK_SERVICE", "DELAYED_RETRY");
        assertThat(outcomes).extracting(RecoveryOutcome::success).containsExactly(false, false, true);
        assertThat(outcomes.get(1).message()).isEqualTo("boom");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(5));
        assertThat(orchestrator.systemHealth().services().get(RECOGNITION).isUp()).isTrue();
        OperationSnapshot recorded = monitoring.currentMetrics().operation("recovery_" + RECOGNITION).orElseThrow();
        assertThat(recorded.totalRequests()).isEqualTo(1);
        assertThat(recorded.successfulRequests()).isEqualTo(1);
    }

    @Test
    @DisplayName("falls through to the fallback service when a circuit reset leaves recognition down")
    void successfulActionThatDoesNotRecoverFallsThroughToTheNextOne() {
        degradeRecognition();
        DegradedMode degradedMode = new DegradedMode(clock);
        actions.register(RECOGNITION, new CircuitBreakerResetAction(circuitBreakers, "model_invoke", 8));
        actions.register(RECOGNITION, new FallbackModeAction(degradedMode, Duration.ofMinutes(10), 6));

        List<RecoveryOutcome> outcomes = orchestrator.runAutoRecovery();

        assertThat(outcomes).extracting(RecoveryOutcome::strategy)
            .containsExactly(RecoveryStrategy.IMMEDIATE_RETRY, RecoveryStrategy.FALLBACK_SERVICE);
        assertThat(outcomes).allMatch(RecoveryOutcome::success);
        assertThat(degradedMode.isActive()).isTrue();
        assertThat(sleeps).containsExactly(Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    @Test
    void manualRecoveryStopsAtTheFirstSuccessfulAction() {
        degradeRecognition();
        actions.register(RECOGNITION, action(RecoveryStrategy.IMMEDIATE_RETRY, 8, () -> true));
        actions.register(RECOGNITION, action(RecoveryStrategy.DELAYED_RETRY, 5, () -> true));

        assertThat(orchestrator.triggerManualRecovery(RECOGNITION, null)).isTrue();

        assertThat(executed).containsExactly("IMMEDIATE_RETRY");
        assertThat(sleeps).isEmpty();
    }

    @Test
    void skipsServicesThatAreAlreadyRecovering() {
        degradeRecognition();
        AtomicReference<List<RecoveryOutcome>> nested = new AtomicReference<>();
        AtomicReference<Throwable> manualFailure = new AtomicReference<>();
        actions.register(RECOGNITION, action(RecoveryStrategy.IMMEDIATE_RETRY, 8, () -> {
            nested.set(orchestrator.runAutoRecovery());
            try {
                orchestrator.triggerManualRecovery(RECOGNITION, null);
            } catch (IllegalStateException ex) {
                manualFailure.set(ex);
            }
            return true;
        }));

        orchestrator.runAutoRecovery();

        assertThat(executed).containsExactly("IMMEDIATE_RETRY");
        assertThat(nested.get()).isEmpty();
        assertThat(manualFailure.get()).hasMessageContaining("already in progress");
        assertThat(orchestrator.activeRecoveries()).isEmpty();
    }

    @Test
    void manualRecoveryFiltersByStrategy() {
        actions.register(RECOGNITION, action(RecoveryStrategy.IMMEDIATE_RETRY, 8, () -> true));
        actions.register(RECOGNITION, action(RecoveryStrategy.DELAYED_RETRY, 5, () -> true));

        boolean recovered = orchestrator.triggerManualRecovery(RECOGNITION, RecoveryStrategy.DELAYED_RETRY);

        assertThat(recovered).isTrue();
        assertThat(executed).containsExactly("DELAYED_RETRY");
    }

    @Test
    void manualRecoveryReportsFailureWhenEveryActionFails() {
        actions.register(RECOGNITION, action(RecoveryStrategy.MANUAL_INTERVENTION, 1, () -> false));

        assertThat(orchestrator.triggerManualRecovery(RECOGNITION, null)).isFalse();
    }

    @Test
    void manualRecoveryRejectsUnknownServicesAndStrategies() {
        actions.register(RECOGNITION, action(RecoveryStrategy.IMMEDIATE_RETRY, 8, () -> true));

        assertThatThrownBy(() -> orchestrator.triggerManualRecovery("billing", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown service");
        assertThatThrownBy(() -> orchestrator.triggerManualRecovery(RECOGNITION,
            RecoveryStrategy.GRACEFUL_DEGRADATION))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("GRACEFUL_DEGRADATION");
        assertThat(executed).isEmpty();
    }

    @Test
    void circuitBreakerResetActionClosesTheModelCircuit() {
        for (int i = 0; i < 3; i++) {
            circuitBreakers.recordFailure("model_invoke");
        }
        actions.register(RECOGNITION, new CircuitBreakerResetAction(circuitBreakers, "model_invoke", 8));

        List<RecoveryOutcome> outcomes = orchestrator.runAutoRecovery();

        assertThat(outcomes).extracting(RecoveryOutcome::strategy).containsExactly(RecoveryStrategy.IMMEDIATE_RETRY);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(5));
        assertThat(circuitBreakers.statusOf("model_invoke").state()).isEqualTo(CircuitState.CLOSED);
        assertThat(orchestrator.systemHealth().overall()).isEqualTo(HealthVerdict.HEALTHY);
    }

    @Test
    void listsAvailableStrategiesByService() {
        actions.register(RECOGNITION, action(RecoveryStrategy.DELAYED_RETRY, 5, () -> true));
        actions.register(RECOGNITION, action(RecoveryStrategy.IMMEDIATE_RETRY, 8, () -> true));
        actions.register(HealthEvaluator.MEMORY_MANAGEMENT,
            action(RecoveryStrategy.GRACEFUL_DEGRADATION, 7, () -> true));

        assertThat(orchestrator.availableStrategies()).containsOnlyKeys(RECOGNITION,
            HealthEvaluator.MEMORY_MANAGEMENT);
        assertThat(orchestrator.availableStrategies().get(RECOGNITION))
            .extracting(RecoveryActionDescriptor::strategy)
            .containsExactly(RecoveryStrategy.IMMEDIATE_RETRY, RecoveryStrategy.DELAYED_RETRY);
    }

    @Test
    void startsAndStopsTheSchedule() {
        orchestrator.start();
        assertThat(orchestrator.isRunning()).isTrue();

        orchestrator.close();

        assertThat(orchestrator.isRunning()).isFalse();
    }

    private void degradeRecognition() {
        for (int i = 0; i < 4; i++) {
            monitoring.recordOutcome("receipt_recognition", false, Duration.ofSeconds(1), false,
                ErrorKind.PARSING_ERROR);
        }
    }

    private RecoveryAction action(RecoveryStrategy strategy, int priority, Supplier<Boolean> behaviour) {
        return new AbstractRecoveryAction(strategy, strategy.name(), Duration.ofSeconds(1), priority, List.of()) {
            @Override
            public boolean execute() {
                executed.add(strategy.name());
                return behaviour.get();
            }
        };
    }
}
