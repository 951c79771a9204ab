package com.vcarda.loyaltyqrbackend.entity;

public enum CodeEventType {
    ISSUED,
    REVOKED,
    EXPIRED,
    REPLACED
}
