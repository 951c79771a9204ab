package com.vcarda.loyaltyqrbackend.entity;

/**
 * States of one scan attempt.
 * PENDING -> RATE_LIMITED | INVALID | PROCESSING -> SUCCESS | FAILED
 */
public enum ScanState {
    PENDING,
    RATE_LIMITED,
    INVALID,
    PROCESSING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING && this != PROCESSING;
    }
}
