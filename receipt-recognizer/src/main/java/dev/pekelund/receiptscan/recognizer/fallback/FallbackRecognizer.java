package dev.pekelund.receiptscan.recognizer.fallback;

import dev.pekelund.receiptscan.errors.ErrorInfo;
import dev.pekelund.receiptscan.errors.ErrorKind;
import dev.pekelund.receiptscan.recognizer.image.ImageQualityAnalysis;
import dev.pekelund.receiptscan.recognizer.image.QualityGrade;
import dev.pekelund.receiptscan.recognizer.image.ReceiptImage;
import dev.pekelund.receiptscan.recognizer.model.FallbackDetails;
import dev.pekelund.receiptscan.recognizer.model.FallbackStrategy;
import dev.pekelund.receiptscan.recognizer.model.LineItem;
import dev.pekelund.receiptscan.recognizer.model.RecognitionResult;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces low-confidence placeholder results when the model cannot be used, so the user gets an
 * editable draft instead of an error.
 *
 * <p>{@link #recognize} never throws. Whatever goes wrong inside a strategy, the caller receives at
 * least a single blank item with confidence 0.
 */
public class FallbackRecognizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(FallbackRecognizer.class);

    static final double ENHANCED_MAX_CONFIDENCE = 0.30;
    static final double TEMPLATE_MAX_CONFIDENCE = 0.10;
    static final double BASIC_MAX_CONFIDENCE = 0.20;

    private static final long ONE_MIB = 1024L * 1024;
    private static final List<String> COMMON_ITEM_NAMES = List.of("Groceries", "Beverage", "Household item",
        "Snack", "Other item");
    private static final List<BigDecimal> ESTIMATED_PRICES = List.of(BigDecimal.ZERO, BigDecimal.valueOf(10),
        BigDecimal.valueOf(15), BigDecimal.valueOf(8), BigDecimal.valueOf(25), BigDecimal.valueOf(12));
    private static final BigDecimal DEFAULT_PRICE = BigDecimal.valueOf(10);

    /**
     * @param quality quality analysis of the image, may be {@code null}
     * @param originalError the failure that led here, {@code null} when the fallback was chosen up front
     */
    public RecognitionResult recognize(ReceiptImage image, ImageQualityAnalysis quality, ErrorInfo originalError) {
        ErrorKind kind = originalError != null ? originalError.kind() : null;
        FallbackStrategy strategy = strategyFor(kind);
        RecognitionResult result;
        try {
            result = switch (strategy) {
                case ENHANCED_HEURISTIC -> enhancedHeuristic(image, quality, kind);
                case TEMPLATE_BASED -> templateBased(quality, kind);
                case BASIC_HEURISTIC -> basicHeuristic(image, quality, kind);
                case EMPTY_TEMPLATE -> emptyTemplate(quality, kind);
            };
        } catch (RuntimeException ex) {
            LOGGER.error("Fallback strategy {} failed; returning an empty template", strategy, ex);
            result = emptyTemplate(quality, kind);
        }
        LOGGER.info("Fallback recognition strategy={} reason='{}' grade={} items={} confidence={}",
            result.fallbackDetails().strategy(), result.fallbackDetails().reason(),
            quality != null ? quality.grade() : "n/a", result.items().size(),
            String.format(Locale.ROOT, "%.2f", result.confidence()));
        return result;
    }

    static FallbackStrategy strategyFor(ErrorKind kind) {
        if (kind == null) {
            return FallbackStrategy.BASIC_HEURISTIC;
        }
        return switch (kind) {
            case NETWORK_ERROR, PARSING_ERROR, API_TIMEOUT, SERVICE_UNAVAILABLE -> FallbackStrategy.ENHANCED_HEURISTIC;
            case RATE_LIMITED -> FallbackStrategy.TEMPLATE_BASED;
            case AUTHENTICATION_ERROR, IMAGE_PROCESSING_ERROR, UNKNOWN -> FallbackStrategy.BASIC_HEURISTIC;
        };
    }

    private RecognitionResult enhancedHeuristic(ReceiptImage image, ImageQualityAnalysis quality, ErrorKind kind) {
        double confidence = 0.15;
        int itemCount = 1;
        if (quality != null) {
            switch (quality.grade()) {
                case EXCELLENT, GOOD -> {
                    confidence = 0.25;
                    itemCount = 2;
                }
                case FAIR -> {
                    confidence = 0.20;
                    itemCount = 2;
                }
                case POOR -> {
                    confidence = 0.10;
                    itemCount = 1;
                }
            }
        }
        long size = image.sizeBytes();
        if (size > 3 * ONE_MIB) {
            itemCount = Math.min(itemCount + 2, 5);
            confidence += 0.05;
        } else if (size > ONE_MIB) {
            itemCount = Math.min(itemCount + 1, 4);
            confidence += 0.03;
        }
        if (image.fileName().toLowerCase(Locale.ROOT).contains("receipt")) {
            confidence += 0.10;
            itemCount = Math.max(itemCount, 2);
        }

        List<LineItem> items = new ArrayList<>();
        for (int i = 0; i < itemCount; i++) {
            String name = i == 0 ? "" : COMMON_ITEM_NAMES.get((i - 1) % COMMON_ITEM_NAMES.size()) + " " + i;
            BigDecimal price = i < ESTIMATED_PRICES.size() ? ESTIMATED_PRICES.get(i) : DEFAULT_PRICE;
            items.add(LineItem.placeholder(name, price));
        }
        return RecognitionResult.fallback(items, Math.min(confidence, ENHANCED_MAX_CONFIDENCE), quality,
            details(FallbackStrategy.ENHANCED_HEURISTIC, kind));
    }

    private RecognitionResult templateBased(ImageQualityAnalysis quality, ErrorKind kind) {
        List<LineItem> items;
        double confidence;
        if (quality == null || quality.grade() == QualityGrade.POOR) {
            items = List.of(LineItem.placeholder("", BigDecimal.ZERO));
            confidence = 0.05;
        } else {
            items = List.of(LineItem.placeholder("", BigDecimal.ZERO), LineItem.placeholder("", BigDecimal.ZERO));
            confidence = TEMPLATE_MAX_CONFIDENCE;
        }
        return RecognitionResult.fallback(items, confidence, quality, details(FallbackStrategy.TEMPLATE_BASED, kind));
    }

    private RecognitionResult basicHeuristic(ReceiptImage image, ImageQualityAnalysis quality, ErrorKind kind) {
        int itemCount = 1;
        double confidence = 0.10;
        if (image.sizeBytes() > 2 * ONE_MIB) {
            itemCount = 3;
            confidence = BASIC_MAX_CONFIDENCE;
        } else if (image.sizeBytes() > ONE_MIB) {
            itemCount = 2;
            confidence = 0.15;
        }
        List<LineItem> items = new ArrayList<>();
        for (int i = 1; i <= itemCount; i++) {
            items.add(LineItem.placeholder("Item " + i, BigDecimal.ZERO));
        }
        return RecognitionResult.fallback(items, confidence, quality, details(FallbackStrategy.BASIC_HEURISTIC, kind));
    }

    private RecognitionResult emptyTemplate(ImageQualityAnalysis quality, ErrorKind kind) {
        return RecognitionResult.fallback(List.of(LineItem.placeholder("", BigDecimal.ZERO)), 0.0, quality,
            details(FallbackStrategy.EMPTY_TEMPLATE, kind));
    }

    static FallbackDetails details(FallbackStrategy strategy, ErrorKind kind) {
        if (kind == null) {
            return new FallbackDetails(strategy, "Image quality too low for automatic recognition",
                List.of("Retake the photo in good lighting", "Make sure the whole receipt is in frame"),
                List.of("Review the draft and enter the items manually"));
        }
        return switch (kind) {
            case NETWORK_ERROR -> new FallbackDetails(strategy, "Network problems made the recognition service unavailable",
                List.of("Check your network connection", "Try again in a little while"),
                List.of("Enter the receipt items manually"));
            case API_TIMEOUT -> new FallbackDetails(strategy, "The recognition service timed out",
                List.of("The image may be too large or complex", "Try a compressed or sharper photo"),
                List.of("Enter the receipt items manually"));
            case RATE_LIMITED -> new FallbackDetails(strategy, "Too many recognition requests",
                List.of("Wait a moment before trying again"),
                List.of("Or enter the receipt items manually"));
            case IMAGE_PROCESSING_ERROR -> new FallbackDetails(strategy, "The image could not be processed",
                List.of("Check that the file is a JPEG or PNG photo", "Make sure the file is not damaged"),
                List.of("Upload the image again or enter the items manually"));
            case PARSING_ERROR -> new FallbackDetails(strategy, "The recognition result could not be interpreted",
                List.of("The receipt may be too complex", "Try a clearer photo"),
                List.of("Enter the receipt items manually"));
            case AUTHENTICATION_ERROR, SERVICE_UNAVAILABLE, UNKNOWN -> new FallbackDetails(strategy,
                "Automatic recognition is currently unavailable",
                List.of("Check the image quality and format", "Make sure the network connection works"),
                List.of("Enter the receipt items manually", "Contact support if the problem persists"));
        };
    }
}
