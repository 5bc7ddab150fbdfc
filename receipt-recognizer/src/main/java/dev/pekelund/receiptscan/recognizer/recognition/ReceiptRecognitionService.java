package dev.pekelund.receiptscan.recognizer.recognition;

import dev.pekelund.receiptscan.errors.ErrorClassifier;
import dev.pekelund.receiptscan.errors.ErrorInfo;
import dev.pekelund.receiptscan.errors.ErrorKind;
import dev.pekelund.receiptscan.metrics.MonitoringService;
import dev.pekelund.receiptscan.recognizer.fallback.FallbackRecognizer;
import dev.pekelund.receiptscan.recognizer.googleai.GeminiClient;
import dev.pekelund.receiptscan.recognizer.googleai.GeminiResponseException;
import dev.pekelund.receiptscan.recognizer.image.ImageQualityAnalysis;
import dev.pekelund.receiptscan.recognizer.image.ImageValidation;
import dev.pekelund.receiptscan.recognizer.image.PreprocessedImage;
import dev.pekelund.receiptscan.recognizer.image.QualityGrade;
import dev.pekelund.receiptscan.recognizer.image.ReceiptImage;
import dev.pekelund.receiptscan.recognizer.image.ReceiptImageException;
import dev.pekelund.receiptscan.recognizer.image.ReceiptImageInspector;
import dev.pekelund.receiptscan.recognizer.model.RecognitionResult;
import dev.pekelund.receiptscan.recovery.DegradedMode;
import dev.pekelund.receiptscan.retry.RetryConfig;
import dev.pekelund.receiptscan.retry.RetryExecutor;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Recognises the line items on a receipt photo. The model is called through the {@link RetryExecutor};
 * when it cannot deliver, the {@link FallbackRecognizer} produces a low-confidence draft instead.
 * Every request is recorded with the {@link MonitoringService} under {@link #RECOGNITION_OPERATION}.
 */
public class ReceiptRecognitionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptRecognitionService.class);

    public static final String RECOGNITION_OPERATION = "receipt_recognition";
    public static final String MODEL_OPERATION = "model_invoke";

    private static final Set<ErrorKind> FALLBACK_ELIGIBLE = EnumSet.of(ErrorKind.NETWORK_ERROR,
        ErrorKind.API_TIMEOUT, ErrorKind.RATE_LIMITED, ErrorKind.SERVICE_UNAVAILABLE, ErrorKind.PARSING_ERROR,
        ErrorKind.AUTHENTICATION_ERROR);

    static final String PROMPT = """
        Analyse the attached photo of a purchase receipt and extract the purchased items.
        Read product names exactly as printed, in whatever language they appear.

        Rules:
        1. Extract the unit price, quantity and line total of every product.
        2. If a product has no explicit quantity, use 1. Quantities are whole numbers.
        3. Ignore everything that is not a product: store name, address, phone number, date, time,
           cashier, subtotal, tax, change and greetings.
        4. Make sure every line total equals unit price times quantity and the overall total equals the
           sum of the line totals.

        Return only a JSON object with this structure, without code fences or commentary:
        {
          "items": [
            {"name": string, "unitPrice": number, "quantity": integer, "totalPrice": number}
          ],
          "totalAmount": number,
          "confidence": number between 0 and 1
        }
        Prices are plain numbers with a dot as decimal separator and no currency symbol.
        Use a low confidence when the photo is hard to read.
        """;

    private final ReceiptImageInspector imageInspector;
    private final GeminiClient geminiClient;
    private final ReceiptResponseParser responseParser;
    private final FallbackRecognizer fallbackRecognizer;
    private final RetryExecutor retryExecutor;
    private final RecognitionRetryPolicy retryPolicy;
    private final ErrorClassifier errorClassifier;
    private final MonitoringService monitoringService;
    private final DegradedMode degradedMode;

    public ReceiptRecognitionService(ReceiptImageInspector imageInspector, GeminiClient geminiClient,
        ReceiptResponseParser responseParser, FallbackRecognizer fallbackRecognizer, RetryExecutor retryExecutor,
        RecognitionRetryPolicy retryPolicy, ErrorClassifier errorClassifier, MonitoringService monitoringService,
        DegradedMode degradedMode) {
        this.imageInspector = imageInspector;
        this.geminiClient = geminiClient;
        this.responseParser = responseParser;
        this.fallbackRecognizer = fallbackRecognizer;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
        this.errorClassifier = errorClassifier;
        this.monitoringService = monitoringService;
        this.degradedMode = degradedMode;
    }

    /**
     * Exception types of this service that the {@link ErrorClassifier} should map directly.
     */
    public static Map<Class<? extends Throwable>, ErrorKind> errorMappings() {
        Map<Class<? extends Throwable>, ErrorKind> mappings = new LinkedHashMap<>();
        mappings.put(ReceiptParsingException.class, ErrorKind.PARSING_ERROR);
        mappings.put(GeminiResponseException.class, ErrorKind.PARSING_ERROR);
        mappings.put(ReceiptImageException.class, ErrorKind.IMAGE_PROCESSING_ERROR);
        return mappings;
    }

    /**
     * @param enableFallback whether a fallback draft may be returned instead of failing
     * @throws ReceiptRecognitionException when the image is invalid, or recognition failed and no
     *     fallback applies
     */
    public RecognitionResult recognize(ReceiptImage image, boolean enableFallback) {
        Assert.notNull(image, "Receipt image must not be null");
        long started = System.nanoTime();
        try (RecognitionMdc.Context ignored = RecognitionMdc.open(UUID.randomUUID().toString(), image.fileName())) {
            RecognitionMdc.setStage("validate");
            ImageValidation validation;
            ImageQualityAnalysis quality = null;
            try {
                validation = imageInspector.validate(image);
                if (validation.valid()) {
                    RecognitionMdc.setStage("analyze");
                    quality = imageInspector.analyzeQuality(image);
                }
            } catch (RuntimeException ex) {
                return handleFailure(image, null, enableFallback, started, ex);
            }
            if (!validation.valid()) {
                ErrorInfo error = new ErrorInfo(ErrorKind.IMAGE_PROCESSING_ERROR, null,
                    String.join("; ", validation.errors()),
                    Map.of("operation", RECOGNITION_OPERATION, "file", image.fileName()), null);
                LOGGER.warn("Rejected receipt image {}: {}", image, validation.errors());
                monitoringService.recordOutcome(RECOGNITION_OPERATION, false, elapsedSince(started), false,
                    error.kind());
                throw new ReceiptRecognitionException(error, null);
            }
            if (!validation.warnings().isEmpty()) {
                LOGGER.info("Image warnings for {}: {}", image, validation.warnings());
            }

            if (enableFallback && (quality.grade() == QualityGrade.POOR || degradedMode.isActive())) {
                LOGGER.info("Skipping the model for {} (grade {}, degraded mode {})", image, quality.grade(),
                    degradedMode.isActive());
                RecognitionMdc.setStage("fallback");
                RecognitionResult result = fallbackRecognizer.recognize(image, quality, null)
                    .withProcessingTime(elapsedSince(started));
                monitoringService.recordOutcome(RECOGNITION_OPERATION, true, result.processingTime(), true, null);
                return result;
            }

            try {
                RecognitionResult result = recognizeWithModel(image, quality).withProcessingTime(
                    elapsedSince(started));
                monitoringService.recordOutcome(RECOGNITION_OPERATION, true, result.processingTime(), false, null);
                LOGGER.info("Recognised {} item(s) totalling {} with confidence {} in {} ms", result.items().size(),
                    result.totalAmount(), String.format(Locale.ROOT, "%.2f", result.confidence()),
                    result.processingTime().toMillis());
                return result;
            } catch (RuntimeException ex) {
                return handleFailure(image, quality, enableFallback, started, ex);
            }
        }
    }

    /**
     * Recognises the images one after the other. Failures of single images are reported in the result
     * instead of aborting the batch.
     */
    public BatchRecognitionResult recognizeBatch(List<ReceiptImage> images, boolean enableFallback) {
        Assert.notNull(images, "Images must not be null");
        List<BatchRecognitionResult.ImageOutcome> outcomes = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        int fallbacks = 0;
        for (ReceiptImage image : images) {
            try {
                RecognitionResult result = recognize(image, enableFallback);
                if (result.fallbackUsed()) {
                    fallbacks++;
                }
                outcomes.add(new BatchRecognitionResult.ImageOutcome(image.fileName(), result, null));
            } catch (ReceiptRecognitionException ex) {
                outcomes.add(new BatchRecognitionResult.ImageOutcome(image.fileName(), null, ex.getMessage()));
                failures.add(image.fileName());
            }
        }
        int failed = failures.size();
        LOGGER.info("Batch of {} image(s) finished: {} succeeded, {} failed, {} used the fallback", images.size(),
            images.size() - failed, failed, fallbacks);
        return new BatchRecognitionResult(outcomes, images.size(), images.size() - failed, failed, fallbacks,
            failures);
    }

    private RecognitionResult recognizeWithModel(ReceiptImage image, ImageQualityAnalysis quality) {
        RecognitionMdc.setStage("preprocess");
        PreprocessedImage prepared = imageInspector.preprocess(image);

        RecognitionMdc.setStage("model");
        RetryConfig config = retryPolicy.configFor(quality.grade(), prepared.processedSize());
        LOGGER.debug("Calling the model for {} with {}", prepared, config);
        String response = retryExecutor.execute(MODEL_OPERATION,
            () -> geminiClient.generateContent(PROMPT, prepared, null), config);

        RecognitionMdc.setStage("parse");
        ParsedReceipt parsed = responseParser.parse(response);
        return RecognitionResult.recognised(parsed.items(), parsed.confidence(), quality);
    }

    private RecognitionResult handleFailure(ReceiptImage image, ImageQualityAnalysis quality, boolean enableFallback,
        long started, RuntimeException failure) {
        ErrorInfo error = errorClassifier.classify(failure,
            Map.of("operation", RECOGNITION_OPERATION, "file", image.fileName()));
        if (enableFallback && FALLBACK_ELIGIBLE.contains(error.kind())) {
            LOGGER.warn("Recognition of {} failed with {} ({}); using the fallback", image, error.kind(),
                error.message());
            RecognitionMdc.setStage("fallback");
            RecognitionResult result = fallbackRecognizer.recognize(image, quality, error)
                .withProcessingTime(elapsedSince(started));
            monitoringService.recordOutcome(RECOGNITION_OPERATION, false, result.processingTime(), true,
                error.kind());
            return result;
        }
        LOGGER.error("Recognition of {} failed with {}: {}", image, error.kind(), error.message(), failure);
        monitoringService.recordOutcome(RECOGNITION_OPERATION, false, elapsedSince(started), false, error.kind());
        throw new ReceiptRecognitionException(error, failure);
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
