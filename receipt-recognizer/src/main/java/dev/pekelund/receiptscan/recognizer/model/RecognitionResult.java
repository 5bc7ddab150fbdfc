package dev.pekelund.receiptscan.recognizer.model;

import dev.pekelund.receiptscan.recognizer.image.ImageQualityAnalysis;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Items read from a receipt photo, either by the model or by a fallback strategy.
 *
 * @param confidence between 0 and 1
 * @param totalAmount always the sum of the item totals
 * @param qualityAnalysis may be {@code null} when the image was never analysed
 * @param fallbackDetails {@code null} unless {@code fallbackUsed}
 */
public record RecognitionResult(List<LineItem> items, double confidence, BigDecimal totalAmount,
    boolean fallbackUsed, Duration processingTime, ImageQualityAnalysis qualityAnalysis,
    FallbackDetails fallbackDetails) {

    public RecognitionResult {
        items = items != null ? List.copyOf(items) : List.of();
        confidence = clamp(confidence);
        totalAmount = sum(items);
        processingTime = processingTime != null ? processingTime : Duration.ZERO;
    }

    public static RecognitionResult recognised(List<LineItem> items, double confidence,
        ImageQualityAnalysis qualityAnalysis) {
        return new RecognitionResult(items, confidence, null, false, Duration.ZERO, qualityAnalysis, null);
    }

    public static RecognitionResult fallback(List<LineItem> items, double confidence,
        ImageQualityAnalysis qualityAnalysis, FallbackDetails details) {
        return new RecognitionResult(items, confidence, null, true, Duration.ZERO, qualityAnalysis, details);
    }

    public RecognitionResult withProcessingTime(Duration value) {
        return new RecognitionResult(items, confidence, totalAmount, fallbackUsed, value, qualityAnalysis,
            fallbackDetails);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static BigDecimal sum(List<LineItem> items) {
        return items.stream()
            .map(LineItem::totalPrice)
            .reduce(BigDecimal.ZERO.setScale(2), BigDecimal::add);
    }
}
