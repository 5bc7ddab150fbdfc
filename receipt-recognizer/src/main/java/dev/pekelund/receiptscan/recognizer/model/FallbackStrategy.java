package dev.pekelund.receiptscan.recognizer.model;

/**
 * Ways of producing a result when the model cannot be used.
 */
public enum FallbackStrategy {
    ENHANCED_HEURISTIC,
    TEMPLATE_BASED,
    BASIC_HEURISTIC,
    EMPTY_TEMPLATE
}
