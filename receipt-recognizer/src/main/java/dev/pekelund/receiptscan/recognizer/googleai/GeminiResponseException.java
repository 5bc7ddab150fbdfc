package dev.pekelund.receiptscan.recognizer.googleai;

/**
 * Raised when Gemini answers successfully but the body holds nothing to parse.
 */
public class GeminiResponseException extends RuntimeException {

    public GeminiResponseException(String message) {
        super(message);
    }

    public GeminiResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
