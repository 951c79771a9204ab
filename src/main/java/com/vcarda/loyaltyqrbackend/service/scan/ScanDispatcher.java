package com.vcarda.loyaltyqrbackend.service.scan;

import com.vcarda.loyaltyqrbackend.directory.CustomerNotifier;
import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.entity.CodeType;
import com.vcarda.loyaltyqrbackend.entity.ScanOutcomeStatus;
import com.vcarda.loyaltyqrbackend.entity.ScanState;
import com.vcarda.loyaltyqrbackend.exception.CodeNotFoundException;
import com.vcarda.loyaltyqrbackend.exception.CodeValidationException;
import com.vcarda.loyaltyqrbackend.exception.QrCodeException;
import com.vcarda.loyaltyqrbackend.exception.QrErrorType;
import com.vcarda.loyaltyqrbackend.exception.RateLimitExceededException;
import com.vcarda.loyaltyqrbackend.payload.CustomerCardPayload;
import com.vcarda.loyaltyqrbackend.payload.LoyaltyCardPayload;
import com.vcarda.loyaltyqrbackend.payload.PromoCodePayload;
import com.vcarda.loyaltyqrbackend.payload.QrPayload;
import com.vcarda.loyaltyqrbackend.payload.UnknownPayload;
import com.vcarda.loyaltyqrbackend.repository.CodeRecordRepository;
import com.vcarda.loyaltyqrbackend.service.CodeValidator;
import com.vcarda.loyaltyqrbackend.service.StoreRetryExecutor;
import com.vcarda.loyaltyqrbackend.service.ValidationResult;
import com.vcarda.loyaltyqrbackend.service.ratelimit.RateLimitDecision;
import com.vcarda.loyaltyqrbackend.service.ratelimit.ScanRateLimiter;
import com.vcarda.loyaltyqrbackend.util.PayloadHashUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Drives one scan attempt to a terminal state.
 *
 * <pre>
 * PENDING -> RATE_LIMITED
 *         -> INVALID
 *         -> PROCESSING -> SUCCESS | FAILED
 * </pre>
 *
 * Order of steps:
 *   1) rate limit per (scanner, source address),
 *   2) validation of the scanned text (no state changes except an expiry flip),
 *   3) scan hints must agree with the verified code,
 *   4) processing in one retried transaction: lock the code, run the type handler, bump usage,
 *   5) audit row in its own transaction, then analytics and the owner notification (best-effort).
 *
 * Every attempt that reaches step 1 produces exactly one audit row, whatever happens later.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScanDispatcher {

    static final String UNKNOWN_ERROR_CODE = "QR_ERR_UNKNOWN";

    private final ScanRateLimiter rateLimiter;
    private final CodeValidator validator;
    private final CodeRecordRepository codeRepo;
    private final StoreRetryExecutor store;
    private final CustomerCardScanHandler customerCardHandler;
    private final LoyaltyCardScanHandler loyaltyCardHandler;
    private final PromoCodeScanHandler promoCodeHandler;
    private final ScanAuditRecorder audit;
    private final ScanAnalyticsRecorder analytics;
    private final CustomerNotifier notifier;
    private final Clock clock;

    /**
     * Run one scan and return its outcome; failures are reported in the outcome, not thrown.
     *
     * @param scannerBusinessId business operating the scanner. Must be a positive id: every audit row is
     *                          attributed to a scanner, so a missing one is a caller error and is
     *                          rejected before any attempt (and its audit row) exists
     * @throws CodeValidationException if {@code scannerBusinessId} is null or not positive
     */
    public ScanOutcome dispatch(CodeType codeType, Long scannerBusinessId, String rawPayload, ScanOptions options) {
        if (scannerBusinessId == null || scannerBusinessId <= 0) {
            throw new CodeValidationException("scanner business id must be a positive id");
        }
        ScanOptions opts = options == null ? ScanOptions.none() : options;
        log.info("[SCAN] Start. type={}, scanner={}, source={}", codeType, scannerBusinessId, opts.getSourceAddress());

        ScanOutcome outcome;
        try {
            outcome = run(codeType, scannerBusinessId, rawPayload, opts);
        } catch (RuntimeException e) {
            log.error("[SCAN] Unexpected error. type={}, scanner={}", codeType, scannerBusinessId, e);
            outcome = unknownFailure(codeType, null);
        }

        OffsetDateTime finishedAt = OffsetDateTime.now(clock);
        Long scanId = audit.record(outcome, scannerBusinessId, opts.getSourceAddress(),
                PayloadHashUtils.sha256Hex(rawPayload), finishedAt);
        outcome = outcome.toBuilder().scanId(scanId).build();

        if (outcome.getState() != ScanState.RATE_LIMITED) {
            analytics.record(scannerBusinessId, outcome.getCodeType(), outcome.isSuccess(),
                    finishedAt.withOffsetSameInstant(ZoneOffset.UTC).toLocalDate());
        }
        if (outcome.isSuccess()) {
            notifyOwner(outcome, scannerBusinessId);
        }

        log.info("[SCAN] Done. state={}, status={}, codeId={}, errorCode={}",
                outcome.getState(), outcome.getStatus(), outcome.getCodeId(), outcome.getErrorCode());
        return outcome;
    }

    private ScanOutcome run(CodeType codeType, Long scannerBusinessId, String rawPayload, ScanOptions opts) {
        // ---------- (1) Rate limit ----------
        RateLimitDecision decision = rateLimiter.tryAcquire(scannerBusinessId, opts.getSourceAddress());
        if (!decision.isAllowed()) {
            RateLimitExceededException e = new RateLimitExceededException(
                    "too many scan attempts, retry after " + decision.getResetAt(), decision.getResetAt());
            return failure(ScanState.RATE_LIMITED, e, codeType, null);
        }

        // ---------- (2) Validation ----------
        ValidationResult validation = validator.validate(codeType, rawPayload);
        Long codeId = validation.getRecord() == null ? null : validation.getRecord().getId();
        Long ownerId = validation.getRecord() == null ? null : validation.getRecord().getOwnerId();
        if (!validation.isValid()) {
            return failure(ScanState.INVALID, validation.getError(), codeType, codeId);
        }
        QrPayload payload = validation.getVerifiedPayload();
        CodeRecord record = validation.getRecord();

        // ---------- (3) Scan hints ----------
        if (!hintsMatch(opts, record, payload)) {
            log.warn("[SCAN] Hints do not match code. codeId={}, customerRef={}, programRef={}, promoRef={}",
                    codeId, opts.getCustomerRef(), opts.getProgramRef(), opts.getPromoRef());
            return failure(ScanState.INVALID,
                    new CodeValidationException("scan context does not match code"), codeType, codeId);
        }

        // ---------- (4) Processing ----------
        try {
            Map<String, Object> result = store.execute("scan", status -> {
                OffsetDateTime now = OffsetDateTime.now(clock);
                CodeRecord locked = codeRepo.findByIdForUpdate(record.getId())
                        .orElseThrow(CodeNotFoundException::new);
                if (!locked.isActive()) {
                    throw new CodeValidationException("code is " + locked.getStatus().label());
                }
                Map<String, Object> handled = payload.accept(new Processing(locked, scannerBusinessId, now));
                locked.setUsesCount(locked.getUsesCount() + 1);
                locked.setLastUsedAt(now);
                locked.setUpdatedAt(now);
                return handled;
            });

            return ScanOutcome.builder()
                    .state(ScanState.SUCCESS)
                    .status(ScanOutcomeStatus.VALID)
                    .codeId(codeId)
                    .codeType(codeType)
                    .ownerId(ownerId)
                    .message("scan processed")
                    .result(result)
                    .build();
        } catch (QrCodeException e) {
            log.warn("[SCAN] Processing failed. codeId={}, code={}, reason={}", codeId, e.getErrorCode(), e.getMessage());
            return failure(ScanState.FAILED, e, codeType, codeId);
        } catch (CancellationException e) {
            log.warn("[SCAN] Processing cancelled. codeId={}", codeId);
            return ScanOutcome.builder()
                    .state(ScanState.FAILED)
                    .status(ScanOutcomeStatus.INVALID)
                    .codeId(codeId)
                    .codeType(codeType)
                    .message("scan cancelled")
                    .errorType(QrErrorType.UNKNOWN)
                    .errorCode("QR_ERR_CANCELLED")
                    .build();
        } catch (RuntimeException e) {
            log.error("[SCAN] Unexpected processing error. codeId={}", codeId, e);
            return unknownFailure(codeType, codeId);
        }
    }

    private static ScanOutcome unknownFailure(CodeType codeType, Long codeId) {
        return ScanOutcome.builder()
                .state(ScanState.FAILED)
                .status(ScanOutcomeStatus.INVALID)
                .codeId(codeId)
                .codeType(codeType)
                .message(QrErrorType.UNKNOWN.getUserMessage())
                .errorType(QrErrorType.UNKNOWN)
                .errorCode(UNKNOWN_ERROR_CODE)
                .build();
    }

    private static ScanOutcome failure(ScanState state, QrCodeException e, CodeType codeType, Long codeId) {
        return ScanOutcome.builder()
                .state(state)
                .status(statusFor(state, e.getErrorType()))
                .codeId(codeId)
                .codeType(codeType)
                .message(e.getMessage())
                .errorType(e.getErrorType())
                .errorCode(e.getErrorCode())
                .build();
    }

    static ScanOutcomeStatus statusFor(ScanState state, QrErrorType errorType) {
        if (state == ScanState.SUCCESS) return ScanOutcomeStatus.VALID;
        if (state == ScanState.RATE_LIMITED) return ScanOutcomeStatus.SUSPICIOUS;
        if (errorType == QrErrorType.SECURITY) return ScanOutcomeStatus.SUSPICIOUS;
        return ScanOutcomeStatus.INVALID;
    }

    private static boolean hintsMatch(ScanOptions opts, CodeRecord record, QrPayload payload) {
        if (opts.getCustomerRef() != null && !opts.getCustomerRef().equals(record.getOwnerId())) {
            return false;
        }
        if (opts.getProgramRef() != null && !opts.getProgramRef().equals(payload.accept(ProgramRef.INSTANCE))) {
            return false;
        }
        return opts.getPromoRef() == null || opts.getPromoRef().equals(payload.accept(PromoRef.INSTANCE));
    }

    private void notifyOwner(ScanOutcome outcome, Long scannerBusinessId) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("codeId", outcome.getCodeId());
            data.put("codeType", Objects.toString(outcome.getCodeType(), null));
            data.put("businessId", scannerBusinessId);
            notifier.notify(outcome.getOwnerId(), CustomerNotifier.QR_SCANNED, data);
        } catch (RuntimeException e) {
            log.warn("[SCAN] Owner notification failed. codeId={}, error={}", outcome.getCodeId(), e.getMessage());
        }
    }

    /**
     * Routes the verified payload to its type handler inside the processing transaction.
     */
    private final class Processing implements QrPayload.Visitor<Map<String, Object>> {

        private final CodeRecord code;
        private final Long businessId;
        private final OffsetDateTime now;

        private Processing(CodeRecord code, Long businessId, OffsetDateTime now) {
            this.code = code;
            this.businessId = businessId;
            this.now = now;
        }

        @Override
        public Map<String, Object> visitCustomerCard(CustomerCardPayload payload) {
            return customerCardHandler.handle(code, payload, businessId, now);
        }

        @Override
        public Map<String, Object> visitLoyaltyCard(LoyaltyCardPayload payload) {
            return loyaltyCardHandler.handle(code, payload, businessId);
        }

        @Override
        public Map<String, Object> visitPromoCode(PromoCodePayload payload) {
            return promoCodeHandler.handle(code, payload, businessId, now);
        }

        @Override
        public Map<String, Object> visitUnknown(UnknownPayload payload) {
            throw new CodeValidationException("unrecognised QR code type");
        }
    }

    private enum ProgramRef implements QrPayload.Visitor<Long> {
        INSTANCE;

        @Override
        public Long visitCustomerCard(CustomerCardPayload payload) {
            return null;
        }

        @Override
        public Long visitLoyaltyCard(LoyaltyCardPayload payload) {
            return payload.getProgramId();
        }

        @Override
        public Long visitPromoCode(PromoCodePayload payload) {
            return null;
        }

        @Override
        public Long visitUnknown(UnknownPayload payload) {
            return null;
        }
    }

    private enum PromoRef implements QrPayload.Visitor<Long> {
        INSTANCE;

        @Override
        public Long visitCustomerCard(CustomerCardPayload payload) {
            return null;
        }

        @Override
        public Long visitLoyaltyCard(LoyaltyCardPayload payload) {
            return null;
        }

        @Override
        public Long visitPromoCode(PromoCodePayload payload) {
            return payload.getPromoId();
        }

        @Override
        public Long visitUnknown(UnknownPayload payload) {
            return null;
        }
    }
}
