package dev.pekelund.receiptscan.recognizer.image;

import java.util.List;

/**
 * Outcome of a quality assessment.
 *
 * @param score 0 to 100, higher is better
 */
public record ImageQualityAnalysis(QualityGrade grade, int score, List<String> issues, List<String> suggestions,
    ImageMetadata metadata) {

    public ImageQualityAnalysis {
        issues = issues != null ? List.copyOf(issues) : List.of();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }
}
