package com.vcarda.loyaltyqrbackend.service.ratelimit;

import java.time.Instant;

/**
 * Storage for fixed-window attempt counters.
 *
 * <p>Implementations:
 * <ul>
 *     <li>{@link InMemoryRateLimitCounterStore}: ConcurrentHashMap, JVM-local only</li>
 *     <li>{@link RedisRateLimitCounterStore}: shared across instances, expiry handled by Redis</li>
 * </ul>
 */
public interface RateLimitCounterStore {

    /**
     * Atomically increment the counter of {@code key} in the given window.
     *
     * @param key         limiter key, e.g. "7:10.0.0.1"
     * @param windowIndex index of the current window (epoch millis / window length)
     * @param windowEnd   instant the window closes; the counter may be dropped after that
     * @return the count including this attempt
     */
    long incrementAndGet(String key, long windowIndex, Instant windowEnd);

    /**
     * Drop counters whose window closed before {@code now}.
     *
     * @return number of counters removed
     */
    int sweepExpired(Instant now);
}
