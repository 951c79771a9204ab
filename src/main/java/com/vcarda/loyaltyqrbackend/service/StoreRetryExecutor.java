package com.vcarda.loyaltyqrbackend.service;

import com.vcarda.loyaltyqrbackend.config.QrCodeProperties;
import com.vcarda.loyaltyqrbackend.exception.TransientStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.CancellationException;

/**
 * Runs units of work in explicit transactions, retrying transient store failures.
 *
 * Each attempt gets a fresh transaction; the {@link org.springframework.transaction.TransactionStatus}
 * is handed to the callback. When the retry budget is spent the last failure is wrapped in a
 * {@link TransientStoreException}. Any other exception propagates unchanged after rollback.
 */
@Component
@Slf4j
public class StoreRetryExecutor {

    private final RetryTemplate retryTemplate;
    private final TransactionTemplate joined;
    private final TransactionTemplate isolated;

    public StoreRetryExecutor(RetryTemplate storeRetryTemplate,
                              PlatformTransactionManager transactionManager,
                              QrCodeProperties properties) {
        int timeoutSeconds = (int) Math.max(1, properties.getStore().getTransactionTimeout().getSeconds());

        this.retryTemplate = storeRetryTemplate;

        this.joined = new TransactionTemplate(transactionManager);
        this.joined.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.joined.setTimeout(timeoutSeconds);

        this.isolated = new TransactionTemplate(transactionManager);
        this.isolated.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.isolated.setTimeout(timeoutSeconds);
    }

    /**
     * Run {@code work} in a transaction (joining one already open on this thread).
     *
     * If the calling thread is interrupted while the work runs, the transaction is rolled back
     * and a {@link CancellationException} is thrown instead of committing.
     */
    public <T> T execute(String operation, TransactionCallback<T> work) {
        return withRetry(operation, joined, status -> {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException(operation + " cancelled");
            }
            T result = work.doInTransaction(status);
            if (Thread.currentThread().isInterrupted()) {
                status.setRollbackOnly();
                throw new CancellationException(operation + " cancelled");
            }
            return result;
        });
    }

    /**
     * Run {@code work} in its own transaction, independent of any caller transaction.
     * Used for audit rows and state flips that must persist even when the caller fails.
     */
    public <T> T executeIsolated(String operation, TransactionCallback<T> work) {
        return withRetry(operation, isolated, work);
    }

    private <T> T withRetry(String operation, TransactionTemplate template, TransactionCallback<T> work) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("[STORE] Retrying {} (attempt {}), last error: {}",
                            operation, context.getRetryCount() + 1,
                            context.getLastThrowable() == null ? "n/a" : context.getLastThrowable().getMessage());
                }
                return template.execute(work);
            });
        } catch (TransientDataAccessException | RecoverableDataAccessException | CannotCreateTransactionException e) {
            log.error("[STORE] {} failed after retries", operation, e);
            throw new TransientStoreException("store temporarily unavailable, retry later", e);
        }
    }
}
