package dev.pekelund.receiptscan.recovery;

import dev.pekelund.receiptscan.metrics.MonitoringService;
import dev.pekelund.receiptscan.retry.Sleeper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Periodic control loop that checks system health and runs recovery actions for every service that
 * is not up.
 *
 * <p>Health checks and recovery passes run on a dedicated daemon scheduler, independent of request
 * traffic. A service that is already being recovered is skipped, whether recovery was started by
 * the loop or by an operator.
 */
public class RecoveryOrchestrator implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecoveryOrchestrator.class);

    private final HealthEvaluator healthEvaluator;
    private final RecoveryActionRegistry actionRegistry;
    private final MonitoringService monitoringService;
    private final Sleeper sleeper;
    private final RecoverySettings settings;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final Set<String> activeRecoveries = ConcurrentHashMap.newKeySet();
    private final ConcurrentMap<String, RecoveryActionDescriptor> activeActions = new ConcurrentHashMap<>();
    private volatile SystemHealth currentHealth;

    public RecoveryOrchestrator(HealthEvaluator healthEvaluator, RecoveryActionRegistry actionRegistry,
        MonitoringService monitoringService, Sleeper sleeper, RecoverySettings settings) {
        Assert.notNull(healthEvaluator, "HealthEvaluator must not be null");
        Assert.notNull(actionRegistry, "RecoveryActionRegistry must not be null");
        Assert.notNull(monitoringService, "MonitoringService must not be null");
        this.healthEvaluator = healthEvaluator;
        this.actionRegistry = actionRegistry;
        this.monitoringService = monitoringService;
        this.sleeper = sleeper != null ? sleeper : Sleeper.THREAD;
        this.settings = settings != null ? settings : RecoverySettings.defaults();
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread thread = new Thread(r, "recovery-orchestrator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(this::scheduledHealthCheck, 0,
                settings.healthCheckInterval().toMillis(), TimeUnit.MILLISECONDS);
            scheduler.scheduleWithFixedDelay(this::scheduledAutoRecovery,
                settings.autoRecoveryInterval().toMillis(), settings.autoRecoveryInterval().toMillis(),
                TimeUnit.MILLISECONDS);
            LOGGER.info("Recovery orchestrator started - health check every {}, auto recovery every {}",
                settings.healthCheckInterval(), settings.autoRecoveryInterval());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Recomputes system health and replaces the stored snapshot.
     */
    public SystemHealth checkSystemHealth() {
        SystemHealth previous = currentHealth;
        SystemHealth health = healthEvaluator.evaluate(List.copyOf(activeActions.values()));
        currentHealth = health;
        if (previous == null || previous.overall() != health.overall()) {
            LOGGER.info("System health is {} - services: {}", health.overall(), health.services());
        } else {
            LOGGER.debug("System health unchanged: {}", health.overall());
        }
        return health;
    }

    /**
     * @return the last computed snapshot, computing one if no check has run yet
     */
    public SystemHealth systemHealth() {
        SystemHealth health = currentHealth;
        return health != null ? health : checkSystemHealth();
    }

    /**
     * Runs one automatic recovery pass.
     *
     * @return the outcome of every action executed; empty when all services are up
     */
    public List<RecoveryOutcome> runAutoRecovery() {
        SystemHealth health = checkSystemHealth();
        if (health.overall() == HealthVerdict.HEALTHY) {
            LOGGER.debug("All services healthy; no recovery needed");
            return List.of();
        }

        List<RecoveryOutcome> outcomes = new ArrayList<>();
        for (Map.Entry<String, ServiceStatus> entry : health.services().entrySet()) {
            String service = entry.getKey();
            if (entry.getValue().isUp()) {
                continue;
            }
            if (!activeRecoveries.add(service)) {
                LOGGER.info("Recovery already in progress for '{}'; skipping", service);
                continue;
            }
            try {
                LOGGER.warn("Starting automatic recovery for '{}' ({})", service, entry.getValue().state());
                outcomes.addAll(recover(service, actionRegistry.actionsFor(service), true));
            } finally {
                activeRecoveries.remove(service);
            }
        }
        return outcomes;
    }

    /**
     * Runs the recovery actions of one service synchronously, optionally restricted to one strategy.
     *
     * @return {@code true} when one of the actions succeeded
     * @throws IllegalArgumentException when the service is unknown or no action matches the strategy
     * @throws IllegalStateException when recovery for the service is already running
     */
    public boolean triggerManualRecovery(String service, RecoveryStrategy strategy) {
        if (!actionRegistry.isKnown(service)) {
            throw new IllegalArgumentException("Unknown service: " + service);
        }
        List<RecoveryAction> candidates = actionRegistry.actionsFor(service).stream()
            .filter(action -> strategy == null || action.strategy() == strategy)
            .toList();
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException(
                "No recovery action with strategy " + strategy + " for service '" + service + "'");
        }
        if (!activeRecoveries.add(service)) {
            throw new IllegalStateException("Recovery already in progress for service '" + service + "'");
        }
        try {
            LOGGER.info("Manual recovery requested for '{}' (strategy: {})", service,
                strategy != null ? strategy : "any");
            List<RecoveryOutcome> outcomes = recover(service, candidates, false);
            boolean success = outcomes.stream().anyMatch(RecoveryOutcome::success);
            checkSystemHealth();
            return success;
        } finally {
            activeRecoveries.remove(service);
        }
    }

    public Map<String, List<RecoveryActionDescriptor>> availableStrategies() {
        return actionRegistry.descriptors();
    }

    public Set<String> activeRecoveries() {
        return Set.copyOf(activeRecoveries);
    }

    /**
     * Runs {@code actions} in priority order. Without {@code verifyHealth} the first successful action
     * ends the run. With it, every successful action is followed by the cool-down and a fresh health
     * check, and only a service that is up again ends the run.
     */
    private List<RecoveryOutcome> recover(String service, List<RecoveryAction> actions, boolean verifyHealth) {
        List<RecoveryOutcome> outcomes = new ArrayList<>();
        for (RecoveryAction action : actions) {
            RecoveryOutcome outcome = execute(service, action);
            outcomes.add(outcome);
            if (outcome.success()) {
                if (!verifyHealth) {
                    LOGGER.info("Recovery of '{}' succeeded with {}", service, action.strategy());
                    return outcomes;
                }
                if (isUpAfterCoolDown(service)) {
                    LOGGER.info("Service '{}' is up again after {}", service, action.strategy());
                    return outcomes;
                }
                LOGGER.warn("Service '{}' is still not up after {}; trying the next action", service,
                    action.strategy());
            }
            if (Thread.currentThread().isInterrupted()) {
                return outcomes;
            }
        }
        LOGGER.error("No recovery action brought '{}' back up; service stays degraded until the next pass", service);
        return outcomes;
    }

    private boolean isUpAfterCoolDown(String service) {
        try {
            sleeper.sleep(settings.coolDown());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for recovery cool-down of '{}'", service);
            return false;
        }
        ServiceStatus status = checkSystemHealth().services().get(service);
        return status != null && status.isUp();
    }

    private RecoveryOutcome execute(String service, RecoveryAction action) {
        activeActions.put(service, action.descriptor());
        long startedAt = System.nanoTime();
        boolean success = false;
        String message;
        try {
            success = action.execute();
            message = success ? "Recovered" : "Action reported no recovery";
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            message = "Interrupted";
            LOGGER.warn("Recovery action {} for '{}' was interrupted", action.strategy(), service);
        } catch (Exception ex) {
            message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            LOGGER.error("Recovery action {} for '{}' failed", action.strategy(), service, ex);
        } finally {
            activeActions.remove(service);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
        monitoringService.recordOutcome("recovery_" + service, success, elapsed, false, null);
        if (!success) {
            LOGGER.warn("Recovery action {} for '{}' did not recover the service: {}", action.strategy(), service,
                message);
        }
        return new RecoveryOutcome(service, action.strategy(), success, elapsed, message);
    }

    private void scheduledHealthCheck() {
        try {
            checkSystemHealth();
        } catch (RuntimeException ex) {
            LOGGER.error("Scheduled health check failed", ex);
        }
    }

    private void scheduledAutoRecovery() {
        try {
            runAutoRecovery();
        } catch (RuntimeException ex) {
            LOGGER.error("Scheduled automatic recovery failed", ex);
        }
    }

    @Override
    public void close() {
        running.set(false);
        scheduler.shutdownNow();
        LOGGER.info("Recovery orchestrator stopped");
    }
}
