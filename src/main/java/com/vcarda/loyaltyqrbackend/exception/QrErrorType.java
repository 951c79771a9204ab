package com.vcarda.loyaltyqrbackend.exception;

/**
 * Classification of QR code failures, each with a message that is safe to show an end user.
 */
public enum QrErrorType {
    VALIDATION("The QR code information provided is invalid or incomplete."),
    SECURITY("This QR code operation could not be completed due to security concerns."),
    EXPIRATION("This QR code has expired and is no longer valid."),
    BUSINESS_LOGIC("This QR code operation could not be completed due to business rules."),
    RATE_LIMIT("Too many QR code operations requested. Please try again later."),
    TRANSIENT_STORE("We encountered a temporary issue. Please try again later."),
    UNKNOWN("An unexpected error occurred while processing the QR code.");

    private final String userMessage;

    QrErrorType(String userMessage) {
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
