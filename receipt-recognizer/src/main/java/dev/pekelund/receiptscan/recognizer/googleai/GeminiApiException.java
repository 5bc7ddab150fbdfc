package dev.pekelund.receiptscan.recognizer.googleai;

/**
 * Raised when the Gemini API cannot be reached or responds with an error status.
 */
public class GeminiApiException extends RuntimeException {

    private final int statusCode;

    public GeminiApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public GeminiApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    /**
     * @return the HTTP status, or {@code 0} when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
