package dev.pekelund.receiptscan.retry;

import dev.pekelund.receiptscan.circuit.CircuitBreakerRegistry;
import dev.pekelund.receiptscan.errors.ClassifiedFailureException;
import dev.pekelund.receiptscan.errors.ErrorClassifier;
import dev.pekelund.receiptscan.errors.ErrorInfo;
import dev.pekelund.receiptscan.errors.ErrorKind;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.util.Assert;

/**
 * Runs a unit of work with bounded attempts, a per-attempt deadline and exponential backoff.
 *
 * <p>Before every attempt the circuit breaker for the operation key is consulted. An open circuit
 * stops the loop at once with a {@link ErrorKind#SERVICE_UNAVAILABLE} failure and the work is not
 * invoked. Attempts that overrun their deadline are cancelled and counted as
 * {@link ErrorKind#API_TIMEOUT}. Non-retryable failures are propagated without further attempts.
 */
public class RetryExecutor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryExecutor.class);

    private final ErrorClassifier classifier;
    private final CircuitBreakerRegistry circuitBreakers;
    private final ExecutorService workers;
    private final Sleeper sleeper;
    private final RetryListener listener;

    public RetryExecutor(ErrorClassifier classifier, CircuitBreakerRegistry circuitBreakers,
        RetryListener listener) {
        this(classifier, circuitBreakers, newWorkerPool(), Sleeper.THREAD, listener);
    }

    public RetryExecutor(ErrorClassifier classifier, CircuitBreakerRegistry circuitBreakers,
        ExecutorService workers, Sleeper sleeper, RetryListener listener) {
        Assert.notNull(classifier, "ErrorClassifier must not be null");
        Assert.notNull(circuitBreakers, "CircuitBreakerRegistry must not be null");
        Assert.notNull(workers, "Worker executor must not be null");
        this.classifier = classifier;
        this.circuitBreakers = circuitBreakers;
        this.workers = workers;
        this.sleeper = sleeper != null ? sleeper : Sleeper.THREAD;
        this.listener = listener != null ? listener : RetryListener.NOOP;
    }

    /**
     * Executes {@code task} under {@code config}.
     *
     * @return the first successful result
     * @throws ClassifiedFailureException carrying the classification of the last failure
     */
    public <T> T execute(String operation, Callable<T> task, RetryConfig config) {
        Assert.hasText(operation, "Operation key must not be empty");
        Assert.notNull(task, "Task must not be null");
        Assert.notNull(config, "RetryConfig must not be null");

        int invocations = 0;
        for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
            if (!circuitBreakers.tryAcquire(operation)) {
                ErrorInfo rejected = ErrorInfo.of(ErrorKind.SERVICE_UNAVAILABLE,
                        "Circuit breaker is open for operation '" + operation + "'")
                    .withContext("operation", operation)
                    .withContext("attempt", attempt + 1);
                LOGGER.warn("Skipping attempt {} of '{}': circuit breaker is open", attempt + 1, operation);
                listener.onAttemptFailed(operation, rejected, attempt + 1, null);
                throw new ClassifiedFailureException(rejected, invocations, null);
            }

            invocations++;
            Throwable failure;
            long startedAt = System.nanoTime();
            try {
                T result = invokeWithDeadline(operation, task, config.timeout());
                circuitBreakers.recordSuccess(operation);
                listener.onAttemptSucceeded(operation, attempt + 1, Duration.ofNanos(System.nanoTime() - startedAt));
                if (attempt > 0) {
                    LOGGER.info("Operation '{}' succeeded on attempt {}", operation, attempt + 1);
                }
                return result;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                circuitBreakers.recordFailure(operation);
                throw new ClassifiedFailureException(ErrorInfo.of(ErrorKind.UNKNOWN,
                    "Operation '" + operation + "' was interrupted"), invocations, ex);
            } catch (Exception ex) {
                failure = ex;
            } catch (Error ex) {
                // A half-open trial must always be released.
                circuitBreakers.recordFailure(operation);
                LOGGER.error("Attempt {} of '{}' failed with a fatal error", attempt + 1, operation, ex);
                throw ex;
            }

            Duration latency = Duration.ofNanos(System.nanoTime() - startedAt);
            circuitBreakers.recordFailure(operation);
            ErrorInfo error = classifier.classify(failure, attemptContext(operation, attempt, config));
            boolean lastAttempt = attempt == config.maxRetries();
            LOGGER.warn("Attempt {}/{} of '{}' failed - kind: {}, severity: {}, retryable: {}, message: {}",
                attempt + 1, config.maxAttempts(), operation, error.kind(), error.severity(),
                error.isRetryable(), error.message());
            listener.onAttemptFailed(operation, error, attempt + 1, latency);

            if (!error.isRetryable() || lastAttempt) {
                throw new ClassifiedFailureException(error, invocations, failure);
            }

            Duration delay = config.delayForAttempt(attempt, ThreadLocalRandom.current());
            listener.onRetryScheduled(operation, attempt + 2, delay);
            LOGGER.info("Retrying '{}' in {} ms (attempt {}/{})", operation, delay.toMillis(), attempt + 2,
                config.maxAttempts());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new ClassifiedFailureException(error, invocations, ex);
            }
        }
        throw new IllegalStateException("Retry loop for '" + operation + "' ended without an outcome");
    }

    private <T> T invokeWithDeadline(String operation, Callable<T> task, Duration timeout) throws Exception {
        if (timeout.isZero()) {
            return task.call();
        }
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = workers.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        });
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            TimeoutException overrun = new TimeoutException(
                "Operation '" + operation + "' timed out after " + timeout.toMillis() + " ms");
            overrun.initCause(ex);
            throw overrun;
        } catch (InterruptedException ex) {
            future.cancel(true);
            throw ex;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw ex;
        }
    }

    private static Map<String, Object> attemptContext(String operation, int attempt, RetryConfig config) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("operation", operation);
        context.put("attempt", attempt + 1);
        context.put("maxAttempts", config.maxAttempts());
        return context;
    }

    private static ExecutorService newWorkerPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "retry-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void close() {
        workers.shutdownNow();
        LOGGER.info("Retry executor worker pool shut down");
    }
}
