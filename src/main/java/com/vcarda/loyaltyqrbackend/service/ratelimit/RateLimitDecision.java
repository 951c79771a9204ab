package com.vcarda.loyaltyqrbackend.service.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Getter
@AllArgsConstructor
@ToString
public class RateLimitDecision {

    private final boolean allowed;

    /** Attempts counted in the current window, this one included. */
    private final long count;

    private final long limit;

    /** When the current window closes. */
    private final Instant resetAt;
}
