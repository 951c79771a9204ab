package com.vcarda.loyaltyqrbackend.service;

import com.vcarda.loyaltyqrbackend.config.QrCodeProperties;
import com.vcarda.loyaltyqrbackend.config.StoreConfig;
import com.vcarda.loyaltyqrbackend.exception.BusinessRuleException;
import com.vcarda.loyaltyqrbackend.exception.TransientStoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for StoreRetryExecutor with the real retry policy and a mocked transaction manager.
 */
class StoreRetryExecutorTest {

    private PlatformTransactionManager txManager;
    private StoreRetryExecutor executor;

    @BeforeEach
    void setUp() {
        QrCodeProperties properties = new QrCodeProperties();
        properties.getStore().setMaxAttempts(3);
        properties.getStore().setBackoff(Duration.ofMillis(1));

        txManager = mock(PlatformTransactionManager.class);
        when(txManager.getTransaction(any(TransactionDefinition.class))).thenReturn(new SimpleTransactionStatus());

        executor = new StoreRetryExecutor(new StoreConfig().storeRetryTemplate(properties), txManager, properties);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void transientFailure_isRetriedUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("test", status -> {
            if (calls.incrementAndGet() < 3) {
                throw new CannotAcquireLockException("row locked");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        verify(txManager, times(2)).rollback(any());
        verify(txManager, times(1)).commit(any());
    }

    @Test
    void exhaustedRetries_surfaceTransientStoreException() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("test", status -> {
            calls.incrementAndGet();
            throw new CannotAcquireLockException("row locked");
        }))
                .isInstanceOf(TransientStoreException.class)
                .hasCauseInstanceOf(CannotAcquireLockException.class);

        assertThat(calls).hasValue(3);
        verify(txManager, never()).commit(any());
    }

    @Test
    void businessFailure_isNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("test", status -> {
            calls.incrementAndGet();
            throw new BusinessRuleException("promotion usage limit reached");
        })).isInstanceOf(BusinessRuleException.class);

        assertThat(calls).hasValue(1);
        verify(txManager).rollback(any());
    }

    @Test
    void interruptDuringWork_rollsBack() {
        assertThatThrownBy(() -> executor.execute("test", status -> {
            Thread.currentThread().interrupt();
            return "written";
        })).isInstanceOf(CancellationException.class);

        verify(txManager, never()).commit(any());
        verify(txManager).rollback(any());
    }
}
