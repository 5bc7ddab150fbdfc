package dev.pekelund.receiptscan.recognizer.recognition;

import dev.pekelund.receiptscan.recognizer.model.RecognitionResult;
import java.util.List;

/**
 * Summary of a batch run.
 *
 * @param results one entry per input image, in input order
 * @param failures images that produced neither a result nor a fallback
 */
public record BatchRecognitionResult(List<ImageOutcome> results, int total, int successful, int failed,
    int fallbackUsed, List<String> failures) {

    public BatchRecognitionResult {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
    }

    /**
     * @param result {@code null} when recognition failed
     * @param error user-facing failure message, {@code null} on success
     */
    public record ImageOutcome(String fileName, RecognitionResult result, String error) {

        public boolean succeeded() {
            return result != null;
        }
    }
}
