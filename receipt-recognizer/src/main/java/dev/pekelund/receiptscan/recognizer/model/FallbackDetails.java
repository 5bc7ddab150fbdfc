package dev.pekelund.receiptscan.recognizer.model;

import java.util.List;

/**
 * Explains why a fallback result was produced and what the user can do about it.
 */
public record FallbackDetails(FallbackStrategy strategy, String reason, List<String> suggestions,
    List<String> nextSteps) {

    public FallbackDetails {
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
        nextSteps = nextSteps != null ? List.copyOf(nextSteps) : List.of();
    }
}
