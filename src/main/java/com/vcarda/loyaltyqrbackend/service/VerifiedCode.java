package com.vcarda.loyaltyqrbackend.service;

import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.payload.QrPayload;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A code that passed every validation step, with the payload read back from the store.
 */
@Getter
@AllArgsConstructor
public class VerifiedCode {

    private final CodeRecord record;

    /** Persisted payload; scanned field values are never carried over. */
    private final QrPayload payload;
}
