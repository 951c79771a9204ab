package com.vcarda.loyaltyqrbackend.service.scan;

import com.vcarda.loyaltyqrbackend.entity.ScanRecord;
import com.vcarda.loyaltyqrbackend.repository.ScanRecordRepository;
import com.vcarda.loyaltyqrbackend.service.StoreRetryExecutor;
import com.vcarda.loyaltyqrbackend.util.QrPayloadCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the {@link ScanRecord} of a finished attempt in its own transaction.
 *
 * A failed write is logged and reported as a null id; it never changes the scan outcome.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScanAuditRecorder {

    private final ScanRecordRepository scanRepo;
    private final StoreRetryExecutor store;
    private final QrPayloadCodec codec;

    public Long record(ScanOutcome outcome, Long scannerBusinessId, String sourceAddress,
                       String payloadHash, OffsetDateTime at) {
        try {
            ScanRecord row = new ScanRecord();
            row.setCodeRef(outcome.getCodeId());
            row.setCodeType(outcome.getCodeType());
            row.setScannedByBusinessId(scannerBusinessId);
            row.setSourceAddress(truncate(sourceAddress, 64));
            row.setState(outcome.getState());
            row.setOutcome(outcome.getStatus());
            row.setPointsAwarded(outcome.getPointsAwarded());
            row.setErrorCode(outcome.getErrorCode());
            row.setResultDetail(codec.toJson(detail(outcome)));
            row.setPayloadHash(payloadHash);
            row.setCreatedAt(at);

            return store.executeIsolated("scan-audit", status -> scanRepo.save(row).getId());
        } catch (RuntimeException e) {
            log.error("[SCAN] Audit write failed. state={}, codeId={}", outcome.getState(), outcome.getCodeId(), e);
            return null;
        }
    }

    private static Map<String, Object> detail(ScanOutcome outcome) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("message", outcome.getMessage());
        if (outcome.getResult() != null) {
            detail.put("result", outcome.getResult());
        }
        return detail;
    }

    private static String truncate(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max);
    }
}
