package com.vcarda.loyaltyqrbackend.service;

import com.vcarda.loyaltyqrbackend.entity.CodeEventType;
import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.entity.CodeStatus;
import com.vcarda.loyaltyqrbackend.entity.CodeType;
import com.vcarda.loyaltyqrbackend.exception.CodeValidationException;
import com.vcarda.loyaltyqrbackend.payload.QrPayload;
import com.vcarda.loyaltyqrbackend.repository.CodeRecordRepository;
import com.vcarda.loyaltyqrbackend.util.QrPayloadCodec;
import com.vcarda.loyaltyqrbackend.util.QrSignatureEngine;
import com.vcarda.loyaltyqrbackend.util.VerificationCodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Creates signed code records.
 *
 * Responsibilities:
 *  - Validates owner, business, type and payload before touching the store.
 *  - Stamps the payload with the new uniqueId and issuance time, then signs the serialized form.
 *  - Persists the record (ACTIVE) and its ISSUED event in one transaction.
 *  - Keeps at most one primary ACTIVE code per (owner, type): primary issuance takes the
 *    {@link OwnerCodeLocks} row for the pair, then demotes the current primaries in the same
 *    transaction.
 *
 * Notes:
 *  - The persisted payload never contains the signature; the printed text is produced by
 *    {@link #scannableContent(CodeRecord)}.
 *  - Transient store failures are retried by {@link StoreRetryExecutor}; anything else rolls
 *    the whole issuance back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CodeIssuer {

    private final CodeRecordRepository codeRepo;
    private final CodeEventLog events;
    private final QrSignatureEngine signer;
    private final QrPayloadCodec codec;
    private final StoreRetryExecutor store;
    private final OwnerCodeLocks ownerLocks;
    private final Clock clock;

    public CodeRecord issue(Long ownerId, Long businessId, CodeType codeType, QrPayload payload) {
        return issue(ownerId, businessId, codeType, payload, IssueOptions.defaults());
    }

    public CodeRecord issue(Long ownerId, Long businessId, CodeType codeType, QrPayload payload,
                            IssueOptions options) {
        IssueOptions opts = options == null ? IssueOptions.defaults() : options;
        log.info("[QR-ISSUE] Start. ownerId={}, businessId={}, type={}, primary={}",
                ownerId, businessId, codeType, opts.isPrimary());

        // ---------- (1) Request validation, no store access ----------
        if (ownerId == null || ownerId <= 0) {
            throw new CodeValidationException("ownerId must be a positive id");
        }
        if (businessId != null && businessId <= 0) {
            throw new CodeValidationException("businessId must be a positive id");
        }
        if (codeType == null) {
            throw new CodeValidationException("codeType is required");
        }
        if (payload == null) {
            throw new CodeValidationException("payload is required");
        }
        if (payload.codeType() != codeType) {
            throw new CodeValidationException("payload kind does not match code type " + codeType);
        }
        List<String> missing = payload.missingRequiredFields();
        if (!missing.isEmpty()) {
            throw new CodeValidationException("payload is missing required fields: " + String.join(", ", missing));
        }

        // ---------- (2) Stamp and sign ----------
        OffsetDateTime now = OffsetDateTime.now(clock);
        String uniqueId = UUID.randomUUID().toString();
        payload.setQrUniqueId(uniqueId);
        payload.setTimestamp(now.toInstant().toEpochMilli());
        payload.setPreviousUniqueId(null);
        payload.setSignature(null);

        String json = codec.write(payload);
        String signature = signer.sign(json, now.toInstant());
        String verificationCode = VerificationCodes.generate();

        // ---------- (3) Persist record + event (+ primary demotion) ----------
        if (opts.isPrimary()) {
            ownerLocks.ensure(ownerId, codeType);
        }
        CodeRecord saved = store.execute("issue", status -> {
            if (opts.isPrimary()) {
                ownerLocks.lock(ownerId, codeType);
                for (CodeRecord other : codeRepo.findForUpdate(ownerId, codeType, CodeStatus.ACTIVE)) {
                    if (other.isPrimary()) {
                        other.setPrimary(false);
                        other.setUpdatedAt(now);
                        log.debug("[QR-ISSUE] Demoted primary codeId={}", other.getId());
                    }
                }
            }

            CodeRecord record = new CodeRecord();
            record.setUniqueId(uniqueId);
            record.setOwnerId(ownerId);
            record.setRelatedBusinessId(businessId);
            record.setCodeType(codeType);
            record.setPayload(json);
            record.setImageRef(opts.getImageRef());
            record.setStatus(CodeStatus.ACTIVE);
            record.setVerificationCode(verificationCode);
            record.setPrimary(opts.isPrimary());
            record.setUsesCount(0);
            record.setExpiryDate(opts.getExpiryDate());
            record.setSignature(signature);
            record.setCreatedAt(now);
            record.setUpdatedAt(now);
            CodeRecord persisted = codeRepo.saveAndFlush(record);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("codeType", codeType.name());
            data.put("primary", opts.isPrimary());
            events.append(persisted.getId(), CodeEventType.ISSUED, data);
            return persisted;
        });

        log.info("[QR-ISSUE] Completed. codeId={}, uniqueId={}", saved.getId(), saved.getUniqueId());
        return saved;
    }

    /**
     * Text to encode into the printed code.
     */
    public String scannableContent(CodeRecord record) {
        return codec.scannableContent(record);
    }
}
