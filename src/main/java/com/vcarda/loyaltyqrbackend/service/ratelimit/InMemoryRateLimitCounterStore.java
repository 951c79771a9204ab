package com.vcarda.loyaltyqrbackend.service.ratelimit;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory counter store.
 * - One entry per key, replaced when a new window starts (atomic {@code compute}).
 * - Not shared between instances: with N instances a scanner can get up to N times the threshold.
 * - Expired entries are removed by {@link #sweepExpired(Instant)}, run by the maintenance scheduler.
 */
@Service
@ConditionalOnProperty(prefix = "loyalty.qr.rate-limit", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryRateLimitCounterStore implements RateLimitCounterStore {

    private final ConcurrentHashMap<String, Window> store = new ConcurrentHashMap<>();

    @Override
    public long incrementAndGet(String key, long windowIndex, Instant windowEnd) {
        Window w = store.compute(key, (k, current) -> {
            if (current == null || current.index != windowIndex) {
                return new Window(windowIndex, windowEnd, 1);
            }
            return new Window(windowIndex, windowEnd, current.count + 1);
        });
        return w.count;
    }

    @Override
    public int sweepExpired(Instant now) {
        int before = store.size();
        store.entrySet().removeIf(e -> !e.getValue().end.isAfter(now));
        return Math.max(0, before - store.size());
    }

    int size() {
        return store.size();
    }

    private static final class Window {
        private final long index;
        private final Instant end;
        private final long count;

        private Window(long index, Instant end, long count) {
            this.index = index;
            this.end = end;
            this.count = count;
        }
    }
}
