package dev.pekelund.receiptscan.errors;

/**
 * Raised when an operation gave up after classification, carrying the last {@link ErrorInfo}.
 */
public class ClassifiedFailureException extends RuntimeException {

    private final ErrorInfo errorInfo;
    private final int attempts;

    public ClassifiedFailureException(ErrorInfo errorInfo, int attempts, Throwable cause) {
        super(errorInfo.message(), cause);
        this.errorInfo = errorInfo;
        this.attempts = attempts;
    }

    public ClassifiedFailureException(ErrorInfo errorInfo) {
        this(errorInfo, 0, null);
    }

    public ErrorInfo getErrorInfo() {
        return errorInfo;
    }

    public ErrorKind getKind() {
        return errorInfo.kind();
    }

    /**
     * @return how many times the underlying call was actually invoked
     */
    public int getAttempts() {
        return attempts;
    }
}
