package com.vcarda.loyaltyqrbackend.service.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;

/**
 * Redis-backed counter store: {@code INCR} on a key that embeds the window index, with an
 * {@code EXPIRE} set when the key is created. Counters disappear on their own, so
 * {@link #sweepExpired(Instant)} has nothing to do.
 *
 * Registered by {@code RedisConfig} when {@code loyalty.qr.rate-limit.store=redis}.
 */
@Slf4j
public class RedisRateLimitCounterStore implements RateLimitCounterStore {

    private final StringRedisTemplate redis;
    private final String keyPrefix;

    public RedisRateLimitCounterStore(StringRedisTemplate redis, String keyPrefix) {
        this.redis = redis;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public long incrementAndGet(String key, long windowIndex, Instant windowEnd) {
        String redisKey = keyPrefix + ":" + key + ":" + windowIndex;
        Long count = redis.opsForValue().increment(redisKey);
        if (count == null) {
            // pipelined/transactional connections return null
            throw new IllegalStateException("Redis INCR returned no value for " + redisKey);
        }
        if (count == 1L) {
            Duration ttl = Duration.between(Instant.now(), windowEnd).plusSeconds(1);
            redis.expire(redisKey, ttl.isNegative() ? Duration.ofSeconds(1) : ttl);
        }
        return count;
    }

    @Override
    public int sweepExpired(Instant now) {
        return 0;
    }
}
