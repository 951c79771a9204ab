package com.vcarda.loyaltyqrbackend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Clock;

/**
 * Store access plumbing: the clock every timestamp is taken from and the retry policy wrapped
 * around units of work.
 *
 * Only transient store failures are retried. Validation, security and business failures are
 * thrown straight through on the first attempt.
 */
@Configuration
public class StoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryTemplate storeRetryTemplate(QrCodeProperties properties) {
        QrCodeProperties.Store store = properties.getStore();
        long backoff = store.getBackoff().toMillis();
        long jitter = store.getJitter().toMillis();

        RetryTemplateBuilder builder = RetryTemplate.builder()
                .maxAttempts(Math.max(1, store.getMaxAttempts()))
                .retryOn(TransientDataAccessException.class)
                .retryOn(RecoverableDataAccessException.class)
                .retryOn(CannotCreateTransactionException.class)
                .traversingCauses();

        if (backoff > 0 && jitter > 0) {
            builder.uniformRandomBackoff(backoff, backoff + jitter);
        } else if (backoff > 0) {
            builder.fixedBackoff(backoff);
        } else {
            builder.noBackoff();
        }
        return builder.build();
    }
}
