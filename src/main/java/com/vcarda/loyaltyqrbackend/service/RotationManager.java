package com.vcarda.loyaltyqrbackend.service;

import com.vcarda.loyaltyqrbackend.config.QrCodeProperties;
import com.vcarda.loyaltyqrbackend.entity.CodeEventType;
import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.entity.CodeStatus;
import com.vcarda.loyaltyqrbackend.exception.TransientStoreException;
import com.vcarda.loyaltyqrbackend.payload.QrPayload;
import com.vcarda.loyaltyqrbackend.repository.CodeRecordRepository;
import com.vcarda.loyaltyqrbackend.util.QrPayloadCodec;
import com.vcarda.loyaltyqrbackend.util.QrSignatureEngine;
import com.vcarda.loyaltyqrbackend.util.VerificationCodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Replaces an ACTIVE code with a freshly signed successor.
 *
 * The whole rotation is one transaction holding a row lock on the current record, so two
 * concurrent rotations of the same code cannot both produce a successor: the second one sees
 * REPLACED and returns empty. Lineage:
 *  - successor.previousRef = current.uniqueId (and payload.previousUniqueId),
 *  - current.replacedByRef = successor.id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RotationManager {

    private final CodeRecordRepository codeRepo;
    private final CodeEventLog events;
    private final QrSignatureEngine signer;
    private final QrPayloadCodec codec;
    private final StoreRetryExecutor store;
    private final QrCodeProperties properties;
    private final Clock clock;

    /**
     * @return the successor, or empty if the record does not exist or is no longer ACTIVE
     * @throws TransientStoreException if the store kept failing; the current record is left untouched
     */
    public Optional<CodeRecord> rotate(Long codeId) {
        Optional<CodeRecord> successor = store.execute("rotate", status -> {
            Optional<CodeRecord> locked = codeRepo.findByIdForUpdate(codeId);
            if (!locked.isPresent()) {
                return Optional.<CodeRecord>empty();
            }
            CodeRecord current = locked.get();
            if (!current.isActive()) {
                log.info("[QR-ROTATE] Skipped, codeId={} is {}", codeId, current.getStatus());
                return Optional.<CodeRecord>empty();
            }

            OffsetDateTime now = OffsetDateTime.now(clock);
            String newUniqueId = UUID.randomUUID().toString();

            QrPayload next = codec.parse(current.getPayload());
            next.setQrUniqueId(newUniqueId);
            next.setTimestamp(now.toInstant().toEpochMilli());
            next.setPreviousUniqueId(current.getUniqueId());
            next.setSignature(null);
            String json = codec.write(next);

            CodeRecord created = new CodeRecord();
            created.setUniqueId(newUniqueId);
            created.setOwnerId(current.getOwnerId());
            created.setRelatedBusinessId(current.getRelatedBusinessId());
            created.setCodeType(current.getCodeType());
            created.setPayload(json);
            created.setImageRef(current.getImageRef());
            created.setStatus(CodeStatus.ACTIVE);
            created.setVerificationCode(VerificationCodes.generate());
            created.setPrimary(current.isPrimary());
            created.setUsesCount(0);
            created.setExpiryDate(current.getExpiryDate());
            created.setPreviousRef(current.getUniqueId());
            created.setSignature(signer.sign(json, now.toInstant()));
            created.setCreatedAt(now);
            created.setUpdatedAt(now);
            created = codeRepo.saveAndFlush(created);

            current.setStatus(CodeStatus.REPLACED);
            current.setReplacedByRef(created.getId());
            current.setPrimary(false);
            current.setUpdatedAt(now);

            events.append(current.getId(), CodeEventType.REPLACED,
                    Collections.singletonMap("newCodeId", created.getId()));
            return Optional.of(created);
        });

        successor.ifPresent(s -> log.info("[QR-ROTATE] codeId={} replaced by codeId={}", codeId, s.getId()));
        return successor;
    }

    /**
     * Rotate ACTIVE codes older than the rotation interval, oldest first, up to the configured
     * batch size. No-op when rotation is disabled.
     *
     * @return number of codes rotated
     */
    public int rotateDue() {
        int days = properties.getRotationIntervalDays();
        if (days <= 0) {
            return 0;
        }
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minusDays(days);
        List<Long> due = codeRepo.findIdsCreatedBefore(CodeStatus.ACTIVE, cutoff,
                PageRequest.of(0, Math.max(1, properties.getMaintenance().getRotationBatchSize())));

        int rotated = 0;
        for (Long id : due) {
            try {
                if (rotate(id).isPresent()) rotated++;
            } catch (TransientStoreException e) {
                log.warn("[QR-ROTATE] Batch rotation skipped codeId={}: {}", id, e.getMessage());
            }
        }
        if (rotated > 0) {
            log.info("[QR-ROTATE] Batch rotated {} of {} due codes", rotated, due.size());
        }
        return rotated;
    }
}
