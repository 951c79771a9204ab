package com.vcarda.loyaltyqrbackend.service;

import com.vcarda.loyaltyqrbackend.entity.CodeOwnerLock;
import com.vcarda.loyaltyqrbackend.entity.CodeType;
import com.vcarda.loyaltyqrbackend.repository.CodeOwnerLockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Per (owner, code type) row lock that serializes primary issuance.
 *
 * The lock row is created on first use in its own transaction; a concurrent creator losing the
 * unique-key race just reuses the winner's row.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OwnerCodeLocks {

    private final CodeOwnerLockRepository lockRepo;
    private final StoreRetryExecutor store;

    /**
     * Make sure the lock row exists. Call outside the transaction that will {@link #lock} it.
     */
    public void ensure(Long ownerId, CodeType codeType) {
        if (lockRepo.existsByOwnerIdAndCodeType(ownerId, codeType)) {
            return;
        }
        try {
            store.executeIsolated("owner-lock", status -> lockRepo.saveAndFlush(new CodeOwnerLock(ownerId, codeType)));
            log.debug("[QR-LOCK] Created owner lock. ownerId={}, type={}", ownerId, codeType);
        } catch (DataIntegrityViolationException e) {
            log.debug("[QR-LOCK] Owner lock created concurrently. ownerId={}, type={}", ownerId, codeType);
        }
    }

    /**
     * Take the row lock; held until the caller's transaction ends.
     *
     * @throws IllegalStateException if {@link #ensure} was not called first
     */
    public void lock(Long ownerId, CodeType codeType) {
        lockRepo.findForUpdate(ownerId, codeType)
                .orElseThrow(() -> new IllegalStateException(
                        "owner lock missing for ownerId=" + ownerId + ", type=" + codeType));
    }
}
