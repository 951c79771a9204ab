package com.vcarda.loyaltyqrbackend.config;

import com.vcarda.loyaltyqrbackend.service.ratelimit.RateLimitCounterStore;
import com.vcarda.loyaltyqrbackend.service.ratelimit.RedisRateLimitCounterStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis configuration class.
 *
 * Only active with {@code loyalty.qr.rate-limit.store=redis}. Scan rate-limit counters then live
 * in Redis and are shared by every instance behind the load balancer. Without it the in-process
 * counter store is used and no Redis server is needed.
 */
@Configuration
@ConditionalOnProperty(prefix = "loyalty.qr.rate-limit", name = "store", havingValue = "redis")
public class RedisConfig {

    /**
     * Configure a Redis connection factory using Lettuce.
     */
    @Bean
    public RedisConnectionFactory redisConnectionFactory(
            @Value("${spring.redis.host:localhost}") String host,
            @Value("${spring.redis.port:6379}") int port) {
        return new LettuceConnectionFactory(new RedisStandaloneConfiguration(host, port));
    }

    /**
     * StringRedisTemplate bean for the counter operations (string keys, numeric string values).
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
        return new StringRedisTemplate(factory);
    }

    @Bean
    public RateLimitCounterStore redisRateLimitCounterStore(StringRedisTemplate redis, QrCodeProperties properties) {
        return new RedisRateLimitCounterStore(redis, properties.getRateLimit().getKeyPrefix());
    }
}
