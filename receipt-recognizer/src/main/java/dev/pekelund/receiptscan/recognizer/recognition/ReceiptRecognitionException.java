package dev.pekelund.receiptscan.recognizer.recognition;

import dev.pekelund.receiptscan.errors.ErrorInfo;
import dev.pekelund.receiptscan.errors.ErrorKind;

/**
 * Raised when a receipt could not be recognised and no fallback result was produced. The message is
 * the user-facing text for the failure kind.
 */
public class ReceiptRecognitionException extends RuntimeException {

    private final transient ErrorInfo errorInfo;

    public ReceiptRecognitionException(ErrorInfo errorInfo, Throwable cause) {
        super(errorInfo.userMessage(), cause);
        this.errorInfo = errorInfo;
    }

    public ErrorInfo getErrorInfo() {
        return errorInfo;
    }

    public ErrorKind getKind() {
        return errorInfo.kind();
    }
}
