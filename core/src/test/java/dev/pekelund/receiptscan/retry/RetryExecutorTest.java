package dev.pekelund.receiptscan.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import dev.pekelund.receiptscan.MutableClock;
import dev.pekelund.receiptscan.circuit.CircuitBreakerRegistry;
import dev.pekelund.receiptscan.circuit.CircuitState;
import dev.pekelund.receiptscan.errors.ClassifiedFailureException;
import dev.pekelund.receiptscan.errors.ErrorClassifier;
import dev.pekelund.receiptscan.errors.ErrorInfo;
import dev.pekelund.receiptscan.errors.ErrorKind;
import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RetryExecutorTest {

    private static final String OPERATION = "model_invoke";

    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private final RecordingListener listener = new RecordingListener();
    private CircuitBreakerRegistry circuitBreakers;
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        circuitBreakers = new CircuitBreakerRegistry(10, Duration.ofSeconds(60), Clock.systemUTC());
        executor = new RetryExecutor(new ErrorClassifier(), circuitBreakers, Executors.newCachedThreadPool(),
            sleeps::add, listener);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    @DisplayName("invokes a permanently failing call 1 + maxRetries times and propagates the last failure")
    void exhaustsRetriesAndPropagatesLastClassification() {
        AtomicInteger invocations = new AtomicInteger();
        RetryConfig config = new RetryConfig(3, Duration.ofMillis(100), Duration.ofMillis(1000), 2.0, false,
            Duration.ofSeconds(5));

        ClassifiedFailureException failure = catchThrowableOfType(() -> executor.execute(OPERATION, () -> {
            int attempt = invocations.incrementAndGet();
            throw attempt < 4
                ? new IllegalStateException("HTTP 503 Service Unavailable")
                : new IllegalStateException("HTTP 429 rate limit exceeded");
        }, config), ClassifiedFailureException.class);

        assertThat(invocations).hasValue(4);
        assertThat(failure.getAttempts()).isEqualTo(4);
        assertThat(failure.getKind()).isEqualTo(ErrorKind.RATE_LIMITED);
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400));
        assertThat(listener.failedAttempts).containsExactly(1, 2, 3, 4);
        assertThat(listener.retries).isEqualTo(3);
    }

    @Test
    void returnsTheFirstSuccessfulResult() {
        AtomicInteger invocations = new AtomicInteger();

        String result = executor.execute(OPERATION, () -> {
            if (invocations.incrementAndGet() < 3) {
                throw new ConnectException("Connection refused");
            }
            return "ok";
        }, RetryConfig.defaults().withJitter(false));

        assertThat(result).isEqualTo("ok");
        assertThat(invocations).hasValue(3);
        assertThat(sleeps).hasSize(2);
        assertThat(listener.succeededAttempts).containsExactly(3);
        assertThat(circuitBreakers.statusOf(OPERATION).consecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("fails fast on authentication errors")
    void doesNotRetryNonRetryableKinds() {
        AtomicInteger invocations = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(OPERATION, () -> {
            invocations.incrementAndGet();
            throw new IllegalStateException("HTTP 401 Unauthorized");
        }, RetryConfig.defaults()))
            .isInstanceOfSatisfying(ClassifiedFailureException.class,
                ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.AUTHENTICATION_ERROR));

        assertThat(invocations).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("stops without invoking the call once the circuit opens")
    void shortCircuitsWhenTheBreakerOpens() {
        executor.close();
        circuitBreakers = new CircuitBreakerRegistry(2, Duration.ofSeconds(60), Clock.systemUTC());
        executor = new RetryExecutor(new ErrorClassifier(), circuitBreakers, Executors.newCachedThreadPool(),
            sleeps::add, listener);
        AtomicInteger invocations = new AtomicInteger();

        ClassifiedFailureException failure = catchThrowableOfType(() -> executor.execute(OPERATION, () -> {
            invocations.incrementAndGet();
            throw new ConnectException("Connection refused");
        }, RetryConfig.defaults().withMaxRetries(5)), ClassifiedFailureException.class);

        assertThat(invocations).hasValue(2);
        assertThat(failure.getKind()).isEqualTo(ErrorKind.SERVICE_UNAVAILABLE);
        assertThat(failure.getAttempts()).isEqualTo(2);
        assertThat(circuitBreakers.statusOf(OPERATION).state()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    @DisplayName("abandons attempts that overrun the deadline and counts them as timeouts")
    void timesOutSlowAttempts() {
        AtomicInteger invocations = new AtomicInteger();
        RetryConfig config = new RetryConfig(2, Duration.ofMillis(10), Duration.ofMillis(50), 2.0, false,
            Duration.ofMillis(50));

        ClassifiedFailureException failure = catchThrowableOfType(() -> executor.execute(OPERATION, () -> {
            invocations.incrementAndGet();
            Thread.sleep(5_000);
            return "too late";
        }, config), ClassifiedFailureException.class);

        assertThat(invocations).hasValue(3);
        assertThat(failure.getKind()).isEqualTo(ErrorKind.API_TIMEOUT);
        assertThat(failure.getAttempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("a fatal error during the half-open trial reopens the circuit instead of wedging it")
    void fatalErrorInHalfOpenTrialReopensTheCircuit() {
        executor.close();
        MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        circuitBreakers = new CircuitBreakerRegistry(1, Duration.ofSeconds(60), clock);
        executor = new RetryExecutor(new ErrorClassifier(), circuitBreakers, Executors.newCachedThreadPool(),
            sleeps::add, listener);
        RetryConfig once = RetryConfig.defaults().withMaxRetries(0);

        assertThatThrownBy(() -> executor.execute(OPERATION, () -> {
            throw new ConnectException("Connection refused");
        }, once)).isInstanceOf(ClassifiedFailureException.class);
        clock.advance(Duration.ofSeconds(61));

        assertThatThrownBy(() -> executor.execute(OPERATION, () -> {
            throw new StackOverflowError();
        }, once)).isInstanceOf(StackOverflowError.class);

        assertThat(circuitBreakers.statusOf(OPERATION).state()).isEqualTo(CircuitState.OPEN);
        clock.advance(Duration.ofSeconds(61));
        assertThat(executor.execute(OPERATION, () -> "ok", once)).isEqualTo("ok");
        assertThat(circuitBreakers.statusOf(OPERATION).state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void keepsTheInterruptFlagWhenInterruptedWhileWaiting() {
        RetryExecutor interrupting = new RetryExecutor(new ErrorClassifier(), circuitBreakers,
            Executors.newCachedThreadPool(), duration -> {
                throw new InterruptedException("stop");
            }, listener);
        try {
            assertThatThrownBy(() -> interrupting.execute(OPERATION, () -> {
                throw new ConnectException("Connection refused");
            }, RetryConfig.defaults()))
                .isInstanceOf(ClassifiedFailureException.class);
            assertThat(Thread.interrupted()).isTrue();
        } finally {
            interrupting.close();
        }
    }

    private static final class RecordingListener implements RetryListener {

        private final List<Integer> failedAttempts = new CopyOnWriteArrayList<>();
        private final List<Integer> succeededAttempts = new ArrayList<>();
        private int retries;

        @Override
        public void onAttemptSucceeded(String operation, int attempt, Duration latency) {
            succeededAttempts.add(attempt);
        }

        @Override
        public void onAttemptFailed(String operation, ErrorInfo error, int attempt, Duration latency) {
            failedAttempts.add(attempt);
        }

        @Override
        public void onRetryScheduled(String operation, int nextAttempt, Duration delay) {
            retries++;
        }
    }
}
