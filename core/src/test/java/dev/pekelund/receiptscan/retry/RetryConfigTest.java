package dev.pekelund.receiptscan.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Random;
import org.junit.jupiter.api.Test;

class RetryConfigTest {

    private final Random random = new Random(42);

    @Test
    void growsExponentiallyUntilTheCap() {
        RetryConfig config = new RetryConfig(5, Duration.ofMillis(100), Duration.ofMillis(1000), 2.0, false,
            Duration.ofSeconds(1));

        assertThat(config.delayForAttempt(0, random)).isEqualTo(Duration.ofMillis(100));
        assertThat(config.delayForAttempt(1, random)).isEqualTo(Duration.ofMillis(200));
        assertThat(config.delayForAttempt(2, random)).isEqualTo(Duration.ofMillis(400));
        assertThat(config.delayForAttempt(3, random)).isEqualTo(Duration.ofMillis(800));
        assertThat(config.delayForAttempt(4, random)).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    void jitterStaysWithinAQuarterAndUnderTheCap() {
        RetryConfig config = new RetryConfig(5, Duration.ofMillis(400), Duration.ofMillis(1000), 2.0, true,
            Duration.ofSeconds(1));

        for (int i = 0; i < 200; i++) {
            assertThat(config.delayForAttempt(0, random).toMillis()).isBetween(300L, 500L);
            assertThat(config.delayForAttempt(3, random).toMillis()).isBetween(750L, 1000L);
        }
    }

    @Test
    void copiesLeaveTheOriginalUntouched() {
        RetryConfig original = RetryConfig.defaults();

        RetryConfig tuned = original.withMaxRetries(1).withTimeout(Duration.ofSeconds(5));

        assertThat(original.maxRetries()).isEqualTo(3);
        assertThat(original.timeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(tuned.maxAttempts()).isEqualTo(2);
        assertThat(tuned.timeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void rejectsShrinkingMultiplier() {
        assertThatThrownBy(() -> new RetryConfig(1, Duration.ZERO, Duration.ZERO, 0.5, false, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("backoffMultiplier");
    }
}
