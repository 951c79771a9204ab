package com.vcarda.loyaltyqrbackend.exception;

/**
 * The store kept failing with retryable errors until the retry budget was spent.
 * Surfaced to clients as a generic "retry later".
 */
public class TransientStoreException extends QrCodeException {

    public static final String CODE = "QR_ERR_STORE_UNAVAILABLE";

    public TransientStoreException(String message, Throwable cause) {
        super(message, QrErrorType.TRANSIENT_STORE, CODE, cause);
    }
}
