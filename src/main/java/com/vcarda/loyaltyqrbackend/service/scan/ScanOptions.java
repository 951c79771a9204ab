package com.vcarda.loyaltyqrbackend.service.scan;

import lombok.Builder;
import lombok.Getter;

/**
 * Scan context supplied by the scanning device.
 *
 * The refs are hints only: when present they must agree with the verified code, otherwise the
 * scan is rejected.
 */
@Getter
@Builder
public class ScanOptions {

    private final String sourceAddress;

    private final Long customerRef;

    private final Long programRef;

    private final Long promoRef;

    public static ScanOptions none() {
        return ScanOptions.builder().build();
    }
}
