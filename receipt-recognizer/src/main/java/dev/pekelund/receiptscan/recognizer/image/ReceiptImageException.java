package dev.pekelund.receiptscan.recognizer.image;

/**
 * Signals that a receipt image could not be decoded or re-encoded.
 */
public class ReceiptImageException extends RuntimeException {

    public ReceiptImageException(String message) {
        super(message);
    }

    public ReceiptImageException(String message, Throwable cause) {
        super(message, cause);
    }
}
