package com.vcarda.loyaltyqrbackend.entity;

/** Audit classification of a scan attempt as stored in qr_code_scans. */
public enum ScanOutcomeStatus {
    VALID,
    INVALID,
    SUSPICIOUS
}
