package com.vcarda.loyaltyqrbackend.service.ratelimit;

import com.vcarda.loyaltyqrbackend.config.QrCodeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Fixed-window limiter for scan attempts, keyed by (scanning business, source address).
 *
 * Windows are aligned to the epoch: with a 60s window every key resets on the minute. If the
 * counter store is unreachable the attempt is let through and a warning is logged; the global
 * capacity bucket still bounds the load.
 */
@Service
@Slf4j
public class ScanRateLimiter {

    private final RateLimitCounterStore store;
    private final Clock clock;
    private final long windowMillis;
    private final long threshold;

    public ScanRateLimiter(RateLimitCounterStore store, QrCodeProperties properties, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.windowMillis = Math.max(1, properties.getRateLimit().getWindow().toMillis());
        this.threshold = properties.getRateLimit().getThreshold();
    }

    public RateLimitDecision tryAcquire(Long scannerBusinessId, String sourceAddress) {
        String key = keyFor(scannerBusinessId, sourceAddress);
        long nowMillis = clock.millis();
        long windowIndex = Math.floorDiv(nowMillis, windowMillis);
        Instant resetAt = Instant.ofEpochMilli((windowIndex + 1) * windowMillis);

        long count;
        try {
            count = store.incrementAndGet(key, windowIndex, resetAt);
        } catch (DataAccessException | IllegalStateException e) {
            log.warn("[RATE-LIMIT] Counter store unavailable, allowing attempt. key={}, error={}", key, e.getMessage());
            return new RateLimitDecision(true, 0, threshold, resetAt);
        }

        boolean allowed = count <= threshold;
        if (!allowed) {
            log.warn("[RATE-LIMIT] Threshold exceeded. key={}, count={}, limit={}", key, count, threshold);
        }
        return new RateLimitDecision(allowed, count, threshold, resetAt);
    }

    /** Remove closed windows from the counter store. */
    public int sweepExpired() {
        return store.sweepExpired(clock.instant());
    }

    static String keyFor(Long scannerBusinessId, String sourceAddress) {
        String address = sourceAddress == null || sourceAddress.isBlank() ? "unknown" : sourceAddress.trim();
        return scannerBusinessId + ":" + address;
    }
}
