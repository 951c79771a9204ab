package com.vcarda.loyaltyqrbackend.service;

import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;

/**
 * Optional settings for {@link CodeIssuer#issue}.
 */
@Getter
@Builder
public class IssueOptions {

    private final String imageRef;

    /** Make this the owner's primary code of its type, demoting the current one. */
    private final boolean primary;

    /** Hard expiry; null for codes that only age out through rotation. */
    private final OffsetDateTime expiryDate;

    public static IssueOptions defaults() {
        return IssueOptions.builder().build();
    }
}
