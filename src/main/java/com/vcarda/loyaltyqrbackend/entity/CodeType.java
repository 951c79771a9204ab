package com.vcarda.loyaltyqrbackend.entity;

/**
 * Kinds of codes the platform issues.
 * MASTER_CARD codes can be issued and listed but are not accepted by the scanner.
 */
public enum CodeType {
    CUSTOMER_CARD,
    LOYALTY_CARD,
    PROMO_CODE,
    MASTER_CARD
}
