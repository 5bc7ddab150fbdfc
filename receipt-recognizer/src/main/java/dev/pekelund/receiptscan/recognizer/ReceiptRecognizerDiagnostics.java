package dev.pekelund.receiptscan.recognizer;

import dev.pekelund.receiptscan.circuit.CircuitBreakerRegistry;
import dev.pekelund.receiptscan.recognizer.googleai.GeminiClient;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Emits diagnostic logging when the service boots so we can verify the deployed artifact and the
 * resolved resilience settings.
 */
@Component
public class ReceiptRecognizerDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptRecognizerDiagnostics.class);

    private final Environment environment;
    private final RecognitionProperties properties;
    private final ObjectProvider<GeminiClient> geminiClientProvider;
    private final ObjectProvider<CircuitBreakerRegistry> circuitBreakerRegistryProvider;

    public ReceiptRecognizerDiagnostics(Environment environment, RecognitionProperties properties,
        ObjectProvider<GeminiClient> geminiClientProvider,
        ObjectProvider<CircuitBreakerRegistry> circuitBreakerRegistryProvider) {
        this.environment = environment;
        this.properties = properties;
        this.geminiClientProvider = geminiClientProvider;
        this.circuitBreakerRegistryProvider = circuitBreakerRegistryProvider;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Receipt recognizer diagnostics starting");
        LOGGER.info("Active Spring profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("Retry settings - baseDelay: {}, maxDelay: {}, multiplier: {}, jitter: {}",
            properties.getRetry().getBaseDelay(), properties.getRetry().getMaxDelay(),
            properties.getRetry().getBackoffMultiplier(), properties.getRetry().isJitterEnabled());
        LOGGER.info("Recovery settings - enabled: {}, health check every {}, auto recovery every {}",
            properties.getRecovery().isEnabled(), properties.getRecovery().getHealthCheckInterval(),
            properties.getRecovery().getAutoRecoveryInterval());

        CircuitBreakerRegistry circuitBreakers = circuitBreakerRegistryProvider.getIfAvailable();
        if (circuitBreakers != null) {
            LOGGER.info("Circuit breakers open after {} consecutive failures for {}", circuitBreakers.getThreshold(),
                circuitBreakers.getCoolDown());
        }

        GeminiClient geminiClient = geminiClientProvider.getIfAvailable();
        if (geminiClient != null) {
            LOGGER.info("Gemini client implementation: {} - default options: {}", geminiClient.getClass().getName(),
                geminiClient.getDefaultOptions());
        } else {
            LOGGER.info("Gemini client bean not available; skipping client diagnostics");
        }
    }
}
