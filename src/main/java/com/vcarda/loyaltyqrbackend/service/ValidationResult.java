package com.vcarda.loyaltyqrbackend.service;

import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.exception.QrCodeException;
import com.vcarda.loyaltyqrbackend.payload.QrPayload;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of {@link CodeValidator#validate}.
 *
 * {@code record} is set whenever the lookup step resolved a record, also on failures that
 * happen after it (status, signature, expiry, ...).
 */
@Getter
@Builder
public class ValidationResult {

    private final boolean valid;
    private final String message;
    private final String errorCode;
    private final QrCodeException error;
    private final QrPayload verifiedPayload;
    private final CodeRecord record;

    static ValidationResult valid(VerifiedCode code) {
        return ValidationResult.builder()
                .valid(true)
                .message("QR code is valid")
                .verifiedPayload(code.getPayload())
                .record(code.getRecord())
                .build();
    }

    static ValidationResult invalid(QrCodeException error, CodeRecord record) {
        return ValidationResult.builder()
                .valid(false)
                .message(error.getMessage())
                .errorCode(error.getErrorCode())
                .error(error)
                .record(record)
                .build();
    }
}
