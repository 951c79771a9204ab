package com.vcarda.loyaltyqrbackend.exception;

/**
 * The scanned or submitted data is malformed, incomplete, or does not reference a usable code.
 */
public class CodeValidationException extends QrCodeException {

    public static final String CODE = "QR_ERR_VALIDATION";

    public CodeValidationException(String message) {
        super(message, QrErrorType.VALIDATION, CODE);
    }

    public CodeValidationException(String message, Throwable cause) {
        super(message, QrErrorType.VALIDATION, CODE, cause);
    }
}
