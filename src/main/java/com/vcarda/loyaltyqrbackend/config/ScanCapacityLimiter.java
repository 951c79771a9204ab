package com.vcarda.loyaltyqrbackend.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Global capacity guard for the scan endpoint, using Bucket4j.
 *
 * Current setup:
 * - Allows {@code loyalty.qr.capacity.scans-per-minute} requests per minute for this instance.
 * - Requests beyond that are answered with 429 instead of being queued.
 *
 * Notes:
 * - This bucket only protects the instance. Per scanner throttling is done by
 *   {@code ScanRateLimiter}, which also writes an audit row for every rejected attempt.
 */
@Service
public class ScanCapacityLimiter {

    private final Bucket bucket;

    public ScanCapacityLimiter(QrCodeProperties properties) {
        long perMinute = Math.max(1, properties.getCapacity().getScansPerMinute());
        Bandwidth limit = Bandwidth.classic(perMinute, Refill.greedy(perMinute, Duration.ofMinutes(1)));
        this.bucket = Bucket.builder().addLimit(limit).build();
    }

    /**
     * Try to consume one token from the bucket.
     * @return true if a request is allowed, false if the capacity has been reached.
     */
    public boolean tryConsume() {
        return bucket.tryConsume(1);
    }
}
