package com.vcarda.loyaltyqrbackend.exception;

/**
 * The code is otherwise valid but older than the rotation interval; the holder must fetch
 * its replacement before it is accepted again.
 */
public class CodeRefreshRequiredException extends CodeExpiredException {

    public static final String CODE = "QR_ERR_REFRESH_REQUIRED";

    public CodeRefreshRequiredException(String message) {
        super(message, CODE);
    }
}
