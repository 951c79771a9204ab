package com.vcarda.loyaltyqrbackend.exception;

import java.time.Instant;

/**
 * Scan attempts for a (scanner, source address) pair exceeded the configured threshold.
 */
public class RateLimitExceededException extends QrCodeException {

    public static final String CODE = "QR_ERR_RATE_LIMIT";

    /** When the current window closes and attempts are accepted again. */
    private final Instant resetAt;

    public RateLimitExceededException(String message, Instant resetAt) {
        super(message, QrErrorType.RATE_LIMIT, CODE);
        this.resetAt = resetAt;
    }

    public Instant getResetAt() {
        return resetAt;
    }
}
