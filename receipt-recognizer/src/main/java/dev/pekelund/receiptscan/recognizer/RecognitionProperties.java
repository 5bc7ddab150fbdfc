package dev.pekelund.receiptscan.recognizer;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "receipt.recognition")
public class RecognitionProperties {

    private final Retry retry = new Retry();

    private final CircuitBreaker circuitBreaker = new CircuitBreaker();

    private final Alerts alerts = new Alerts();

    private final Recovery recovery = new Recovery();

    private final Image image = new Image();

    public Retry getRetry() {
        return retry;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public Alerts getAlerts() {
        return alerts;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public Image getImage() {
        return image;
    }

    public static class Retry {

        /**
         * Delay before the first retry of a model call.
         */
        private Duration baseDelay = Duration.ofSeconds(2);

        /**
         * Upper bound for any single retry delay.
         */
        private Duration maxDelay = Duration.ofSeconds(60);

        /**
         * Growth factor applied to the delay after every failed attempt.
         */
        private double backoffMultiplier = 2.5;

        /**
         * Whether retry delays are randomised by up to 25 percent.
         */
        private boolean jitterEnabled = true;

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public boolean isJitterEnabled() {
            return jitterEnabled;
        }

        public void setJitterEnabled(boolean jitterEnabled) {
            this.jitterEnabled = jitterEnabled;
        }
    }

    public static class CircuitBreaker {

        /**
         * Consecutive failures that open a circuit.
         */
        private int failureThreshold = 5;

        /**
         * How long an open circuit rejects calls before admitting a trial call.
         */
        private Duration coolDown = Duration.ofSeconds(60);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getCoolDown() {
            return coolDown;
        }

        public void setCoolDown(Duration coolDown) {
            this.coolDown = coolDown;
        }
    }

    public static class Alerts {

        /**
         * Latency above which a slow response alert is raised.
         */
        private Duration slowResponse = Duration.ofSeconds(30);

        /**
         * Trailing window for counting failures of one operation.
         */
        private Duration failureWindow = Duration.ofMinutes(5);

        /**
         * Failures within the failure window that raise a high failure rate alert.
         */
        private int failureCount = 5;

        /**
         * Trailing window for counting fallback results of one operation.
         */
        private Duration fallbackWindow = Duration.ofMinutes(10);

        /**
         * Fallback results within the fallback window that raise a frequent fallback alert.
         */
        private int fallbackCount = 3;

        /**
         * Number of most recent latencies kept per operation for percentiles.
         */
        private int latencySamples = 100;

        /**
         * Number of most recent alerts kept in memory.
         */
        private int retention = 500;

        public Duration getSlowResponse() {
            return slowResponse;
        }

        public void setSlowResponse(Duration slowResponse) {
            this.slowResponse = slowResponse;
        }

        public Duration getFailureWindow() {
            return failureWindow;
        }

        public void setFailureWindow(Duration failureWindow) {
            this.failureWindow = failureWindow;
        }

        public int getFailureCount() {
            return failureCount;
        }

        public void setFailureCount(int failureCount) {
            this.failureCount = failureCount;
        }

        public Duration getFallbackWindow() {
            return fallbackWindow;
        }

        public void setFallbackWindow(Duration fallbackWindow) {
            this.fallbackWindow = fallbackWindow;
        }

        public int getFallbackCount() {
            return fallbackCount;
        }

        public void setFallbackCount(int fallbackCount) {
            this.fallbackCount = fallbackCount;
        }

        public int getLatencySamples() {
            return latencySamples;
        }

        public void setLatencySamples(int latencySamples) {
            this.latencySamples = latencySamples;
        }

        public int getRetention() {
            return retention;
        }

        public void setRetention(int retention) {
            this.retention = retention;
        }
    }

    public static class Recovery {

        /**
         * Whether the periodic health check and automatic recovery loop run.
         */
        private boolean enabled = true;

        /**
         * Interval between health checks.
         */
        private Duration healthCheckInterval = Duration.ofSeconds(30);

        /**
         * Interval between automatic recovery passes.
         */
        private Duration autoRecoveryInterval = Duration.ofMinutes(5);

        /**
         * Pause after a recovery pass before health is checked again.
         */
        private Duration coolDown = Duration.ofSeconds(5);

        /**
         * Wait before the delayed circuit breaker reset closes the model circuit.
         */
        private Duration delayedRetryDelay = Duration.ofSeconds(30);

        /**
         * How long degraded mode routes every request to the fallback once enabled.
         */
        private Duration fallbackModeDuration = Duration.ofMinutes(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getHealthCheckInterval() {
            return healthCheckInterval;
        }

        public void setHealthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = healthCheckInterval;
        }

        public Duration getAutoRecoveryInterval() {
            return autoRecoveryInterval;
        }

        public void setAutoRecoveryInterval(Duration autoRecoveryInterval) {
            this.autoRecoveryInterval = autoRecoveryInterval;
        }

        public Duration getCoolDown() {
            return coolDown;
        }

        public void setCoolDown(Duration coolDown) {
            this.coolDown = coolDown;
        }

        public Duration getDelayedRetryDelay() {
            return delayedRetryDelay;
        }

        public void setDelayedRetryDelay(Duration delayedRetryDelay) {
            this.delayedRetryDelay = delayedRetryDelay;
        }

        public Duration getFallbackModeDuration() {
            return fallbackModeDuration;
        }

        public void setFallbackModeDuration(Duration fallbackModeDuration) {
            this.fallbackModeDuration = fallbackModeDuration;
        }
    }

    public static class Image {

        /**
         * Largest accepted upload in bytes.
         */
        private long maxBytes = 10L * 1024 * 1024;

        /**
         * Longest side in pixels of the image sent to the model.
         */
        private int maxDimension = 2048;

        public long getMaxBytes() {
            return maxBytes;
        }

        public void setMaxBytes(long maxBytes) {
            this.maxBytes = maxBytes;
        }

        public int getMaxDimension() {
            return maxDimension;
        }

        public void setMaxDimension(int maxDimension) {
            this.maxDimension = maxDimension;
        }
    }
}
