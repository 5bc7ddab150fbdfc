package dev.pekelund.receiptscan.recognizer.image;

/**
 * Discrete image quality tiers, best first.
 */
public enum QualityGrade {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR;

    public static QualityGrade fromScore(int score) {
        if (score >= 90) {
            return EXCELLENT;
        }
        if (score >= 75) {
            return GOOD;
        }
        if (score >= 60) {
            return FAIR;
        }
        return POOR;
    }
}
