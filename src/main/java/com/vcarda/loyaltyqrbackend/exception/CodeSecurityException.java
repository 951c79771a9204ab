package com.vcarda.loyaltyqrbackend.exception;

/**
 * Signature mismatch or other sign of tampering. Never retried; logged at ERROR.
 */
public class CodeSecurityException extends QrCodeException {

    public static final String CODE = "QR_ERR_SECURITY";

    public CodeSecurityException(String message) {
        super(message, QrErrorType.SECURITY, CODE);
    }
}
