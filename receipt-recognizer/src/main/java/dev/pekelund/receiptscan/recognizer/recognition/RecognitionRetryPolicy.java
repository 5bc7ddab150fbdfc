package dev.pekelund.receiptscan.recognizer.recognition;

import dev.pekelund.receiptscan.recognizer.image.QualityGrade;
import dev.pekelund.receiptscan.retry.RetryConfig;
import java.time.Duration;
import org.springframework.util.Assert;

/**
 * Derives the retry settings of a model call from the image being sent. Better images get more retries
 * and longer attempt timeouts; big payloads get more time, small ones less.
 */
public class RecognitionRetryPolicy {

    private static final long LARGE_PAYLOAD_BYTES = 5L * 1024 * 1024;
    private static final long SMALL_PAYLOAD_BYTES = 500L * 1024;
    private static final Duration BASE_TIMEOUT = Duration.ofSeconds(60);
    private static final Duration POOR_TIMEOUT = Duration.ofSeconds(45);
    private static final Duration EXCELLENT_TIMEOUT = Duration.ofSeconds(90);
    private static final Duration MAX_TIMEOUT = Duration.ofSeconds(120);
    private static final Duration MIN_TIMEOUT = Duration.ofSeconds(30);

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double backoffMultiplier;
    private final boolean jitterEnabled;

    public RecognitionRetryPolicy() {
        this(Duration.ofSeconds(2), Duration.ofSeconds(60), 2.5, true);
    }

    public RecognitionRetryPolicy(Duration baseDelay, Duration maxDelay, double backoffMultiplier,
        boolean jitterEnabled) {
        Assert.notNull(baseDelay, "baseDelay must not be null");
        Assert.notNull(maxDelay, "maxDelay must not be null");
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.backoffMultiplier = backoffMultiplier;
        this.jitterEnabled = jitterEnabled;
    }

    public RetryConfig configFor(QualityGrade grade, long payloadBytes) {
        return new RetryConfig(maxRetries(grade), baseDelay, maxDelay, backoffMultiplier, jitterEnabled,
            timeout(grade, payloadBytes));
    }

    static int maxRetries(QualityGrade grade) {
        if (grade == null) {
            return 3;
        }
        return switch (grade) {
            case EXCELLENT, GOOD -> 4;
            case FAIR -> 3;
            case POOR -> 2;
        };
    }

    static Duration timeout(QualityGrade grade, long payloadBytes) {
        long millis = BASE_TIMEOUT.toMillis();
        if (grade == QualityGrade.POOR) {
            millis = POOR_TIMEOUT.toMillis();
        } else if (grade == QualityGrade.EXCELLENT) {
            millis = EXCELLENT_TIMEOUT.toMillis();
        }
        if (payloadBytes > LARGE_PAYLOAD_BYTES) {
            millis = Math.min(Math.round(millis * 1.5), MAX_TIMEOUT.toMillis());
        } else if (payloadBytes < SMALL_PAYLOAD_BYTES) {
            millis = Math.max(Math.round(millis * 0.8), MIN_TIMEOUT.toMillis());
        }
        return Duration.ofMillis(millis);
    }
}
