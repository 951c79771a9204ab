package com.vcarda.loyaltyqrbackend.service;

import com.vcarda.loyaltyqrbackend.entity.CodeEventType;
import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.entity.CodeStatus;
import com.vcarda.loyaltyqrbackend.entity.CodeType;
import com.vcarda.loyaltyqrbackend.exception.CodeNotFoundException;
import com.vcarda.loyaltyqrbackend.exception.CodeValidationException;
import com.vcarda.loyaltyqrbackend.exception.TransientStoreException;
import com.vcarda.loyaltyqrbackend.repository.CodeRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Lookups and status transitions of code records other than issuance and rotation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CodeRegistry {

    private final CodeRecordRepository codeRepo;
    private final CodeEventLog events;
    private final StoreRetryExecutor store;
    private final Clock clock;

    public Optional<CodeRecord> findByUniqueId(String uniqueId) {
        if (uniqueId == null || uniqueId.isBlank()) return Optional.empty();
        return codeRepo.findByUniqueId(uniqueId);
    }

    public Optional<CodeRecord> findById(Long codeId) {
        return codeRepo.findById(codeId);
    }

    /**
     * The owner's primary ACTIVE code of a type, falling back to the newest ACTIVE one.
     */
    public Optional<CodeRecord> findPrimary(Long ownerId, CodeType codeType) {
        Optional<CodeRecord> primary = codeRepo
                .findFirstByOwnerIdAndCodeTypeAndStatusAndPrimaryTrueOrderByCreatedAtDesc(
                        ownerId, codeType, CodeStatus.ACTIVE);
        if (primary.isPresent()) return primary;
        return codeRepo.findFirstByOwnerIdAndCodeTypeAndStatusOrderByCreatedAtDesc(
                ownerId, codeType, CodeStatus.ACTIVE);
    }

    /** All codes of an owner, newest first; {@code codeType} null means every type. */
    public List<CodeRecord> listForOwner(Long ownerId, CodeType codeType) {
        if (ownerId == null) return Collections.emptyList();
        if (codeType == null) {
            return codeRepo.findByOwnerIdOrderByCreatedAtDesc(ownerId);
        }
        return codeRepo.findByOwnerIdAndCodeTypeOrderByCreatedAtDesc(ownerId, codeType);
    }

    /**
     * ACTIVE -> REVOKED.
     *
     * @throws CodeNotFoundException   if the record does not exist
     * @throws CodeValidationException if the record is no longer ACTIVE
     */
    public CodeRecord revoke(Long codeId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new CodeValidationException("revocation reason is required");
        }
        CodeRecord revoked = store.execute("revoke", status -> {
            CodeRecord record = codeRepo.findByIdForUpdate(codeId).orElseThrow(CodeNotFoundException::new);
            if (!record.isActive()) {
                throw new CodeValidationException("code is " + record.getStatus().label());
            }
            OffsetDateTime now = OffsetDateTime.now(clock);
            record.setStatus(CodeStatus.REVOKED);
            record.setRevokedReason(reason);
            record.setRevokedAt(now);
            record.setUpdatedAt(now);
            events.append(record.getId(), CodeEventType.REVOKED, Collections.singletonMap("reason", reason));
            return record;
        });
        log.info("[QR-REVOKE] codeId={}, reason={}", codeId, reason);
        return revoked;
    }

    /**
     * Conditional ACTIVE -> EXPIRED flip in its own transaction, so it sticks even when the
     * caller's unit of work fails afterwards.
     *
     * @return true if this call performed the transition (and wrote the EXPIRED event)
     */
    public boolean expire(Long codeId) {
        boolean flipped = store.executeIsolated("expire", status -> {
            int updated = codeRepo.markExpired(codeId, OffsetDateTime.now(clock), CodeStatus.ACTIVE, CodeStatus.EXPIRED);
            if (updated == 1) {
                events.append(codeId, CodeEventType.EXPIRED, Collections.emptyMap());
                return true;
            }
            return false;
        });
        if (flipped) {
            log.info("[QR-EXPIRE] codeId={} marked EXPIRED", codeId);
        }
        return flipped;
    }

    /**
     * Expire every ACTIVE record whose expiry date has passed.
     *
     * @return number of records transitioned by this run
     */
    public int expireOverdue() {
        List<Long> ids = codeRepo.findIdsExpiringBefore(CodeStatus.ACTIVE, OffsetDateTime.now(clock));
        int expired = 0;
        for (Long id : ids) {
            try {
                if (expire(id)) expired++;
            } catch (TransientStoreException e) {
                log.warn("[QR-EXPIRE] Skipped codeId={} this run: {}", id, e.getMessage());
            }
        }
        return expired;
    }
}
