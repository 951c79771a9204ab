package com.vcarda.loyaltyqrbackend.exception;

/**
 * The code, or an entity it references, is expired or no longer active.
 */
public class CodeExpiredException extends QrCodeException {

    public static final String CODE = "QR_ERR_EXPIRATION";

    public CodeExpiredException(String message) {
        super(message, QrErrorType.EXPIRATION, CODE);
    }

    protected CodeExpiredException(String message, String errorCode) {
        super(message, QrErrorType.EXPIRATION, errorCode);
    }
}
