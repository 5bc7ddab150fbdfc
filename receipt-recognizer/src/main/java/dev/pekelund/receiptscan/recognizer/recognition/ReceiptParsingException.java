package dev.pekelund.receiptscan.recognizer.recognition;

/**
 * Signals that the model's answer could not be turned into receipt items.
 */
public class ReceiptParsingException extends RuntimeException {

    public ReceiptParsingException(String message) {
        super(message);
    }

    public ReceiptParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
