package com.vcarda.loyaltyqrbackend.exception;

/**
 * A valid code was presented but a business rule forbids the operation
 * (usage cap reached, promotion window closed, program inactive, wrong business).
 */
public class BusinessRuleException extends QrCodeException {

    public static final String CODE = "QR_ERR_BUSINESS_LOGIC";

    public BusinessRuleException(String message) {
        super(message, QrErrorType.BUSINESS_LOGIC, CODE);
    }
}
