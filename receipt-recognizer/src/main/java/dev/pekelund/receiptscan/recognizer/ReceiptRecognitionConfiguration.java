package dev.pekelund.receiptscan.recognizer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.pekelund.receiptscan.circuit.CircuitBreakerRegistry;
import dev.pekelund.receiptscan.errors.ErrorClassifier;
import dev.pekelund.receiptscan.metrics.AlertThresholds;
import dev.pekelund.receiptscan.metrics.MemoryUsageProbe;
import dev.pekelund.receiptscan.metrics.MonitoringService;
import dev.pekelund.receiptscan.recognizer.fallback.FallbackRecognizer;
import dev.pekelund.receiptscan.recognizer.googleai.GeminiClient;
import dev.pekelund.receiptscan.recognizer.googleai.GeminiRequestOptions;
import dev.pekelund.receiptscan.recognizer.googleai.GoogleAiGeminiClient;
import dev.pekelund.receiptscan.recognizer.image.ImageIoReceiptImageInspector;
import dev.pekelund.receiptscan.recognizer.image.ReceiptImageInspector;
import dev.pekelund.receiptscan.recognizer.recognition.ReceiptRecognitionService;
import dev.pekelund.receiptscan.recognizer.recognition.ReceiptResponseParser;
import dev.pekelund.receiptscan.recognizer.recognition.RecognitionRetryPolicy;
import dev.pekelund.receiptscan.recovery.CircuitBreakerResetAction;
import dev.pekelund.receiptscan.recovery.ConnectivityProbeAction;
import dev.pekelund.receiptscan.recovery.DegradedMode;
import dev.pekelund.receiptscan.recovery.DelayedCircuitBreakerResetAction;
import dev.pekelund.receiptscan.recovery.FallbackModeAction;
import dev.pekelund.receiptscan.recovery.HealthEvaluator;
import dev.pekelund.receiptscan.recovery.ManualInterventionAction;
import dev.pekelund.receiptscan.recovery.MemoryReclaimAction;
import dev.pekelund.receiptscan.recovery.RecoveryActionRegistry;
import dev.pekelund.receiptscan.recovery.RecoveryOrchestrator;
import dev.pekelund.receiptscan.recovery.RecoverySettings;
import dev.pekelund.receiptscan.retry.RetryExecutor;
import dev.pekelund.receiptscan.retry.Sleeper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Service configuration for the receipt recognizer: the Gemini client, the resilience machinery from
 * the core library and the recovery action table.
 */
@Configuration
@EnableConfigurationProperties(RecognitionProperties.class)
public class ReceiptRecognitionConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptRecognitionConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock recognitionClock() {
        return Clock.systemUTC();
    }

    @Bean
    public GeminiRequestOptions receiptGeminiRequestOptions(Environment environment) {
        String modelName = environment.getProperty("google.ai.gemini.model", "gemini-2.0-flash");
        Double temperature = environment.getProperty("google.ai.gemini.temperature", Double.class);
        Double topP = environment.getProperty("google.ai.gemini.top-p", Double.class);
        Integer topK = environment.getProperty("google.ai.gemini.top-k", Integer.class);
        Integer maxOutputTokens = environment.getProperty("google.ai.gemini.max-output-tokens", Integer.class);
        String responseMimeType = environment.getProperty("google.ai.gemini.response-mime-type",
            "application/json");
        LOGGER.info("Configured Google AI Gemini settings - model: {}, temperature: {}, topP: {}, topK: {}, "
            + "maxOutputTokens: {}, responseMimeType: {}", modelName, temperature, topP, topK, maxOutputTokens,
            responseMimeType);
        return GeminiRequestOptions.builder()
            .model(modelName)
            .temperature(temperature)
            .topP(topP)
            .topK(topK)
            .maxOutputTokens(maxOutputTokens)
            .responseMimeType(responseMimeType)
            .build();
    }

    @Bean
    public GeminiClient geminiClient(Environment environment, GeminiRequestOptions receiptGeminiRequestOptions,
        ObjectProvider<ObservationRegistry> observationRegistry) {

        String apiKey = environment.getProperty("AI_STUDIO_API_KEY");
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalStateException("Google AI Studio API key must be configured (AI_STUDIO_API_KEY)");
        }

        ObservationRegistry resolvedObservationRegistry = observationRegistry
            .getIfAvailable(() -> ObservationRegistry.NOOP);

        String baseUrl = environment.getProperty("google.ai.gemini.base-url", GoogleAiGeminiClient.DEFAULT_BASE_URL);
        RestClient restClient = RestClient.builder().baseUrl(baseUrl).build();

        GoogleAiGeminiClient client = new GoogleAiGeminiClient(restClient, apiKey, receiptGeminiRequestOptions,
            resolvedObservationRegistry);
        LOGGER.info("Google AI Gemini client targets {} with default options {}", baseUrl,
            client.getDefaultOptions());
        return client;
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(RecognitionProperties properties, Clock recognitionClock) {
        RecognitionProperties.CircuitBreaker settings = properties.getCircuitBreaker();
        return new CircuitBreakerRegistry(settings.getFailureThreshold(), settings.getCoolDown(), recognitionClock);
    }

    @Bean
    public ErrorClassifier errorClassifier(Clock recognitionClock) {
        return new ErrorClassifier(ReceiptRecognitionService.errorMappings(), recognitionClock);
    }

    @Bean
    public MonitoringService monitoringService(ObjectProvider<MeterRegistry> meterRegistry,
        CircuitBreakerRegistry circuitBreakerRegistry, Clock recognitionClock, RecognitionProperties properties) {
        RecognitionProperties.Alerts alerts = properties.getAlerts();
        AlertThresholds thresholds = new AlertThresholds(alerts.getSlowResponse(), alerts.getFailureWindow(),
            alerts.getFailureCount(), alerts.getFallbackWindow(), alerts.getFallbackCount(),
            alerts.getLatencySamples(), alerts.getRetention());
        return new MonitoringService(meterRegistry.getIfAvailable(SimpleMeterRegistry::new), circuitBreakerRegistry,
            MemoryUsageProbe.RUNTIME, recognitionClock, thresholds);
    }

    @Bean(destroyMethod = "close")
    public RetryExecutor retryExecutor(ErrorClassifier errorClassifier, CircuitBreakerRegistry circuitBreakerRegistry,
        MonitoringService monitoringService) {
        return new RetryExecutor(errorClassifier, circuitBreakerRegistry, monitoringService);
    }

    @Bean
    public DegradedMode degradedMode(Clock recognitionClock) {
        return new DegradedMode(recognitionClock);
    }

    @Bean
    public ReceiptImageInspector receiptImageInspector(RecognitionProperties properties) {
        return new ImageIoReceiptImageInspector(properties.getImage().getMaxBytes(),
            properties.getImage().getMaxDimension());
    }

    @Bean
    public ReceiptResponseParser receiptResponseParser(ObjectMapper objectMapper) {
        return new ReceiptResponseParser(objectMapper);
    }

    @Bean
    public FallbackRecognizer fallbackRecognizer() {
        return new FallbackRecognizer();
    }

    @Bean
    public RecognitionRetryPolicy recognitionRetryPolicy(RecognitionProperties properties) {
        RecognitionProperties.Retry retry = properties.getRetry();
        return new RecognitionRetryPolicy(retry.getBaseDelay(), retry.getMaxDelay(), retry.getBackoffMultiplier(),
            retry.isJitterEnabled());
    }

    @Bean
    public ReceiptRecognitionService receiptRecognitionService(ReceiptImageInspector receiptImageInspector,
        GeminiClient geminiClient, ReceiptResponseParser receiptResponseParser, FallbackRecognizer fallbackRecognizer,
        RetryExecutor retryExecutor, RecognitionRetryPolicy recognitionRetryPolicy, ErrorClassifier errorClassifier,
        MonitoringService monitoringService, DegradedMode degradedMode) {
        return new ReceiptRecognitionService(receiptImageInspector, geminiClient, receiptResponseParser,
            fallbackRecognizer, retryExecutor, recognitionRetryPolicy, errorClassifier, monitoringService,
            degradedMode);
    }

    @Bean
    public HealthEvaluator healthEvaluator(MonitoringService monitoringService,
        CircuitBreakerRegistry circuitBreakerRegistry, Clock recognitionClock) {
        return new HealthEvaluator(monitoringService, circuitBreakerRegistry, MemoryUsageProbe.RUNTIME,
            recognitionClock, ReceiptRecognitionService.RECOGNITION_OPERATION,
            ReceiptRecognitionService.MODEL_OPERATION);
    }

    @Bean
    public RecoveryActionRegistry recoveryActionRegistry(CircuitBreakerRegistry circuitBreakerRegistry,
        DegradedMode degradedMode, GeminiClient geminiClient, MonitoringService monitoringService,
        RecognitionProperties properties) {
        RecognitionProperties.Recovery recovery = properties.getRecovery();
        RecoveryActionRegistry registry = new RecoveryActionRegistry()
            .register(HealthEvaluator.RECOGNITION_SERVICE, new CircuitBreakerResetAction(circuitBreakerRegistry,
                ReceiptRecognitionService.MODEL_OPERATION, 8))
            .register(HealthEvaluator.RECOGNITION_SERVICE, new FallbackModeAction(degradedMode,
                recovery.getFallbackModeDuration(), 6))
            .register(HealthEvaluator.RECOGNITION_SERVICE, new DelayedCircuitBreakerResetAction(circuitBreakerRegistry,
                ReceiptRecognitionService.MODEL_OPERATION, recovery.getDelayedRetryDelay(), Sleeper.THREAD, 5))
            .register(HealthEvaluator.RECOGNITION_SERVICE, new CircuitBreakerResetAction(circuitBreakerRegistry,
                null, 4))
            .register(HealthEvaluator.RECOGNITION_SERVICE, new ManualInterventionAction(
                HealthEvaluator.RECOGNITION_SERVICE, 1))
            .register(HealthEvaluator.NETWORK_CONNECTIVITY, new ConnectivityProbeAction(geminiClient::probe, 9))
            .register(HealthEvaluator.MEMORY_MANAGEMENT, new MemoryReclaimAction(monitoringService,
                circuitBreakerRegistry, MemoryUsageProbe.RUNTIME, 7));
        LOGGER.info("Registered recovery actions: {}", registry.descriptors().keySet());
        return registry;
    }

    @Bean(destroyMethod = "close")
    public RecoveryOrchestrator recoveryOrchestrator(HealthEvaluator healthEvaluator,
        RecoveryActionRegistry recoveryActionRegistry, MonitoringService monitoringService,
        RecognitionProperties properties) {
        RecognitionProperties.Recovery recovery = properties.getRecovery();
        RecoveryOrchestrator orchestrator = new RecoveryOrchestrator(healthEvaluator, recoveryActionRegistry,
            monitoringService, Sleeper.THREAD, new RecoverySettings(recovery.getHealthCheckInterval(),
                recovery.getAutoRecoveryInterval(), recovery.getCoolDown()));
        if (recovery.isEnabled()) {
            orchestrator.start();
        } else {
            LOGGER.info("Automatic recovery disabled (receipt.recognition.recovery.enabled=false)");
        }
        return orchestrator;
    }
}
