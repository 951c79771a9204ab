package com.vcarda.loyaltyqrbackend.exception;

/**
 * Base class for classified QR code failures.
 *
 * Every subclass carries:
 *  - an {@link QrErrorType} that decides retry and HTTP mapping,
 *  - a machine-readable error code (e.g. "QR_ERR_SECURITY"),
 *  - a message that is safe to return to the scanner (no stack traces, no internal ids).
 */
public abstract class QrCodeException extends RuntimeException {

    private final QrErrorType errorType;
    private final String errorCode;

    protected QrCodeException(String message, QrErrorType errorType, String errorCode) {
        super(message);
        this.errorType = errorType;
        this.errorCode = errorCode;
    }

    protected QrCodeException(String message, QrErrorType errorType, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.errorCode = errorCode;
    }

    public QrErrorType getErrorType() {
        return errorType;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /** Generic wording for the error class, for clients that do not show the specific message. */
    public String getUserMessage() {
        return errorType.getUserMessage();
    }
}
