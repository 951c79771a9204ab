package com.vcarda.loyaltyqrbackend.exception;

/**
 * Lookup of a code record by id or uniqueId found nothing.
 */
public class CodeNotFoundException extends CodeValidationException {

    public CodeNotFoundException() {
        super("code not found");
    }
}
