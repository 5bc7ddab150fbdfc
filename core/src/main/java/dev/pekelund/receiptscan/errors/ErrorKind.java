package dev.pekelund.receiptscan.errors;

/**
 * Closed taxonomy of failures raised while recognising a receipt.
 */
public enum ErrorKind {
    NETWORK_ERROR,
    API_TIMEOUT,
    RATE_LIMITED,
    AUTHENTICATION_ERROR,
    PARSING_ERROR,
    IMAGE_PROCESSING_ERROR,
    SERVICE_UNAVAILABLE,
    UNKNOWN;

    /**
     * @return {@code true} when another attempt against the same dependency may succeed.
     */
    public boolean isRetryable() {
        return switch (this) {
            case NETWORK_ERROR, API_TIMEOUT, RATE_LIMITED, SERVICE_UNAVAILABLE -> true;
            case AUTHENTICATION_ERROR, PARSING_ERROR, IMAGE_PROCESSING_ERROR, UNKNOWN -> false;
        };
    }

    public Severity defaultSeverity() {
        return switch (this) {
            case NETWORK_ERROR, AUTHENTICATION_ERROR, SERVICE_UNAVAILABLE -> Severity.HIGH;
            case API_TIMEOUT, RATE_LIMITED, PARSING_ERROR, IMAGE_PROCESSING_ERROR, UNKNOWN -> Severity.MEDIUM;
        };
    }

    /**
     * Message that is safe to show to an end user. Never contains internal error text.
     */
    public String userMessage() {
        return switch (this) {
            case NETWORK_ERROR -> "Network connection failed. Check your connection and try again.";
            case API_TIMEOUT -> "The recognition service took too long to respond. Please try again.";
            case RATE_LIMITED -> "Too many requests right now. Please wait a moment and try again.";
            case AUTHENTICATION_ERROR -> "The recognition service rejected our credentials. Please contact support.";
            case PARSING_ERROR -> "The receipt could not be read. Try a clearer photo or enter the items manually.";
            case IMAGE_PROCESSING_ERROR -> "The image could not be processed. Make sure it is a valid photo of a receipt.";
            case SERVICE_UNAVAILABLE -> "The recognition service is temporarily unavailable. Please try again later.";
            case UNKNOWN -> "Something went wrong while recognising the receipt. Please try again.";
        };
    }
}
