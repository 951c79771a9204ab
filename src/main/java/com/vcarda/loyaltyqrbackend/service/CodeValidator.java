package com.vcarda.loyaltyqrbackend.service;

import com.vcarda.loyaltyqrbackend.config.QrCodeProperties;
import com.vcarda.loyaltyqrbackend.directory.LoyaltyDirectory;
import com.vcarda.loyaltyqrbackend.directory.LoyaltyDirectory.CardView;
import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.entity.CodeStatus;
import com.vcarda.loyaltyqrbackend.entity.CodeType;
import com.vcarda.loyaltyqrbackend.exception.CodeExpiredException;
import com.vcarda.loyaltyqrbackend.exception.CodeNotFoundException;
import com.vcarda.loyaltyqrbackend.exception.CodeRefreshRequiredException;
import com.vcarda.loyaltyqrbackend.exception.CodeSecurityException;
import com.vcarda.loyaltyqrbackend.exception.CodeValidationException;
import com.vcarda.loyaltyqrbackend.exception.QrCodeException;
import com.vcarda.loyaltyqrbackend.payload.CustomerCardPayload;
import com.vcarda.loyaltyqrbackend.payload.LoyaltyCardPayload;
import com.vcarda.loyaltyqrbackend.payload.PromoCodePayload;
import com.vcarda.loyaltyqrbackend.payload.QrPayload;
import com.vcarda.loyaltyqrbackend.payload.UnknownPayload;
import com.vcarda.loyaltyqrbackend.repository.CodeRecordRepository;
import com.vcarda.loyaltyqrbackend.util.QrPayloadCodec;
import com.vcarda.loyaltyqrbackend.util.QrSignatureEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether scanned text refers to a live, untampered code.
 *
 * Steps, stopping at the first failure:
 *  1) shape: parses as a payload of the expected type with all required fields,
 *  2) lookup by qrUniqueId (missing or other type: "code not found"),
 *  3) status must be ACTIVE,
 *  4) signature: stored signature valid over the stored payload and equal to the scanned one,
 *  5) hard expiry (flips the record to EXPIRED),
 *  6) rotation interval,
 *  7) liveness of the customer and, for loyalty cards, the card and program.
 *
 * On success the persisted payload is returned; nothing read from the scanned text other than
 * the lookup key and the signature is used downstream.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CodeValidator {

    private final CodeRecordRepository codeRepo;
    private final CodeRegistry registry;
    private final QrSignatureEngine signer;
    private final QrPayloadCodec codec;
    private final LoyaltyDirectory directory;
    private final QrCodeProperties properties;
    private final Clock clock;

    /**
     * Non-throwing variant of {@link #verify}.
     */
    public ValidationResult validate(CodeType codeType, String rawPayload) {
        Resolution resolution = new Resolution();
        try {
            return ValidationResult.valid(verify(codeType, rawPayload, resolution));
        } catch (QrCodeException e) {
            return ValidationResult.invalid(e, resolution.record);
        }
    }

    /**
     * @throws CodeValidationException  malformed text, wrong type, unknown code, inactive status
     * @throws CodeSecurityException    signature mismatch
     * @throws CodeExpiredException     expired code or inactive customer/card/program
     * @throws CodeRefreshRequiredException code older than the rotation interval
     */
    public VerifiedCode verify(CodeType codeType, String rawPayload) {
        return verify(codeType, rawPayload, new Resolution());
    }

    private VerifiedCode verify(CodeType codeType, String rawPayload, Resolution resolution) {
        // ---------- (1) Shape ----------
        QrPayload scanned = checkShape(codeType, rawPayload);

        // ---------- (2) Lookup ----------
        CodeRecord record = codeRepo.findByUniqueId(scanned.getQrUniqueId())
                .filter(r -> r.getCodeType() == codeType)
                .orElseThrow(CodeNotFoundException::new);
        resolution.record = record;

        // ---------- (3) Status ----------
        if (record.getStatus() != CodeStatus.ACTIVE) {
            String message = "code is " + record.getStatus().label();
            if (record.getStatus() == CodeStatus.EXPIRED) {
                throw new CodeExpiredException(message);
            }
            throw new CodeValidationException(message);
        }

        // ---------- (4) Signature ----------
        boolean storedValid = signer.verify(record.getPayload(), record.getSignature());
        boolean scannedMatches = constantTimeEquals(scanned.getSignature(), record.getSignature());
        if (!storedValid || !scannedMatches) {
            log.error("[QR-VALIDATE] Signature check failed. codeId={}, storedValid={}, scannedMatches={}",
                    record.getId(), storedValid, scannedMatches);
            throw new CodeSecurityException("invalid QR code signature");
        }

        // ---------- (5) Hard expiry ----------
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (record.getExpiryDate() != null && !record.getExpiryDate().isAfter(now)) {
            registry.expire(record.getId());
            throw new CodeExpiredException("code has expired");
        }

        // ---------- (6) Rotation due ----------
        int rotationDays = properties.getRotationIntervalDays();
        if (rotationDays > 0 && record.getCreatedAt().plusDays(rotationDays).isBefore(now)) {
            log.info("[QR-VALIDATE] Code past rotation interval. codeId={}, createdAt={}",
                    record.getId(), record.getCreatedAt());
            throw new CodeRefreshRequiredException("code needs refresh");
        }

        // ---------- (7) Liveness ----------
        QrPayload persisted = codec.parse(record.getPayload());
        boolean customerActive = directory.lookupCustomer(record.getOwnerId())
                .map(LoyaltyDirectory.CustomerView::isActive)
                .orElse(false);
        if (!customerActive) {
            throw new CodeExpiredException("customer account is no longer active");
        }
        persisted.accept(new LivenessCheck(record));

        log.debug("[QR-VALIDATE] Valid. codeId={}, type={}", record.getId(), codeType);
        return new VerifiedCode(record, persisted);
    }

    private QrPayload checkShape(CodeType codeType, String rawPayload) {
        if (codeType == null) {
            throw new CodeValidationException("code type is required");
        }
        if (codeType == CodeType.MASTER_CARD) {
            throw new CodeValidationException("master cards cannot be scanned");
        }
        QrPayload scanned = codec.parse(rawPayload);
        if (scanned.codeType() == null) {
            throw new CodeValidationException("unrecognised QR code type");
        }
        if (scanned.codeType() != codeType) {
            throw new CodeValidationException("QR code type does not match expected type " + codeType);
        }

        List<String> missing = new ArrayList<>();
        if (isBlank(scanned.getQrUniqueId())) missing.add("qrUniqueId");
        if (isBlank(scanned.getSignature())) missing.add("signature");
        missing.addAll(scanned.missingRequiredFields());
        if (!missing.isEmpty()) {
            throw new CodeValidationException("missing required fields: " + String.join(", ", missing));
        }
        return scanned;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) return false;
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    private static final class Resolution {
        private CodeRecord record;
    }

    /**
     * Per-variant checks that the entities referenced by the persisted payload are still live.
     */
    private final class LivenessCheck implements QrPayload.Visitor<Void> {

        private final CodeRecord record;

        private LivenessCheck(CodeRecord record) {
            this.record = record;
        }

        @Override
        public Void visitCustomerCard(CustomerCardPayload payload) {
            return null;
        }

        @Override
        public Void visitLoyaltyCard(LoyaltyCardPayload payload) {
            CardView card = directory.lookupCard(payload.getCardId())
                    .filter(CardView::isActive)
                    .orElseThrow(() -> new CodeExpiredException("loyalty card is no longer active"));
            if (!Objects.equals(card.getCustomerId(), record.getOwnerId())
                    || !Objects.equals(card.getProgramId(), payload.getProgramId())) {
                throw new CodeExpiredException("loyalty card is no longer active");
            }
            boolean programActive = directory.lookupProgram(payload.getProgramId())
                    .map(LoyaltyDirectory.ProgramView::isActive)
                    .orElse(false);
            if (!programActive) {
                throw new CodeExpiredException("loyalty program is no longer active");
            }
            return null;
        }

        @Override
        public Void visitPromoCode(PromoCodePayload payload) {
            return null;
        }

        @Override
        public Void visitUnknown(UnknownPayload payload) {
            throw new CodeValidationException("unrecognised QR code type");
        }
    }
}
