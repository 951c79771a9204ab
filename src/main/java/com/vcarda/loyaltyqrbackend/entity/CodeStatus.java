package com.vcarda.loyaltyqrbackend.entity;

import java.util.Locale;

/**
 * Lifecycle of a code record. ACTIVE is the only non-terminal state.
 */
public enum CodeStatus {
    ACTIVE,
    REVOKED,
    EXPIRED,
    REPLACED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    /** Lower-cased name used in user-facing messages ("code is revoked"). */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
