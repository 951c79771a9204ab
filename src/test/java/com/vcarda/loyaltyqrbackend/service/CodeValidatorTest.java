package com.vcarda.loyaltyqrbackend.service;

import com.vcarda.loyaltyqrbackend.config.QrCodeProperties;
import com.vcarda.loyaltyqrbackend.directory.LoyaltyDirectory;
import com.vcarda.loyaltyqrbackend.directory.LoyaltyDirectory.CardView;
import com.vcarda.loyaltyqrbackend.directory.LoyaltyDirectory.CustomerView;
import com.vcarda.loyaltyqrbackend.directory.LoyaltyDirectory.ProgramView;
import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.entity.CodeStatus;
import com.vcarda.loyaltyqrbackend.entity.CodeType;
import com.vcarda.loyaltyqrbackend.exception.CodeExpiredException;
import com.vcarda.loyaltyqrbackend.exception.CodeNotFoundException;
import com.vcarda.loyaltyqrbackend.exception.CodeRefreshRequiredException;
import com.vcarda.loyaltyqrbackend.exception.CodeSecurityException;
import com.vcarda.loyaltyqrbackend.exception.CodeValidationException;
import com.vcarda.loyaltyqrbackend.payload.CustomerCardPayload;
import com.vcarda.loyaltyqrbackend.payload.LoyaltyCardPayload;
import com.vcarda.loyaltyqrbackend.payload.QrPayload;
import com.vcarda.loyaltyqrbackend.repository.CodeRecordRepository;
import com.vcarda.loyaltyqrbackend.support.MutableClock;
import com.vcarda.loyaltyqrbackend.support.TestFixtures;
import com.vcarda.loyaltyqrbackend.util.QrPayloadCodec;
import com.vcarda.loyaltyqrbackend.util.QrSignatureEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CodeValidator.
 * Records are signed with the real engine; store and directory are mocked.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CodeValidatorTest {

    @Mock private CodeRecordRepository codeRepo;
    @Mock private CodeRegistry registry;
    @Mock private LoyaltyDirectory directory;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final QrPayloadCodec codec = new QrPayloadCodec();
    private QrSignatureEngine signer;
    private QrCodeProperties properties;
    private CodeValidator validator;

    private CodeRecord record;

    @BeforeEach
    void setUp() {
        signer = TestFixtures.signer(clock);
        properties = new QrCodeProperties();
        validator = new CodeValidator(codeRepo, registry, signer, codec, directory, properties, clock);

        CustomerCardPayload payload = new CustomerCardPayload(42L);
        payload.setName("Ada");
        record = TestFixtures.signedRecord(10L, 42L, CodeType.CUSTOMER_CARD, payload,
                now().minusDays(1), signer, codec);
        when(codeRepo.findByUniqueId(record.getUniqueId())).thenReturn(Optional.of(record));
        when(directory.lookupCustomer(42L)).thenReturn(Optional.of(new CustomerView(42L, "Ada", true)));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private String scanned(CodeRecord r) {
        return codec.scannableContent(r);
    }

    // ============ Happy Path ============

    @Test
    void verify_returnsPersistedPayload() {
        VerifiedCode verified = validator.verify(CodeType.CUSTOMER_CARD, scanned(record));

        assertThat(verified.getRecord()).isSameAs(record);
        assertThat(verified.getPayload()).isInstanceOf(CustomerCardPayload.class);
        assertThat(((CustomerCardPayload) verified.getPayload()).getCustomerId()).isEqualTo(42L);
    }

    /**
     * Scanned fields other than the lookup key and signature are ignored.
     */
    @Test
    void verify_ignoresScannedFieldValues() {
        CustomerCardPayload forged = (CustomerCardPayload) codec.parse(scanned(record));
        forged.setCustomerId(99L);
        forged.setName("Mallory");

        VerifiedCode verified = validator.verify(CodeType.CUSTOMER_CARD, codec.write(forged));

        CustomerCardPayload trusted = (CustomerCardPayload) verified.getPayload();
        assertThat(trusted.getCustomerId()).isEqualTo(42L);
        assertThat(trusted.getName()).isEqualTo("Ada");
    }

    @Test
    void validate_success_hasNoError() {
        ValidationResult result = validator.validate(CodeType.CUSTOMER_CARD, scanned(record));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrorCode()).isNull();
        assertThat(result.getVerifiedPayload()).isNotNull();
        assertThat(result.getRecord()).isSameAs(record);
    }

    // ============ Shape ============

    @Test
    void verify_rejectsTypeMismatch() {
        assertThatThrownBy(() -> validator.verify(CodeType.LOYALTY_CARD, scanned(record)))
                .isInstanceOf(CodeValidationException.class)
                .hasMessageContaining("does not match");
        verifyNoInteractions(codeRepo);
    }

    @Test
    void verify_rejectsMasterCardAndUnknownTags() {
        assertThatThrownBy(() -> validator.verify(CodeType.MASTER_CARD, scanned(record)))
                .isInstanceOf(CodeValidationException.class);
        assertThatThrownBy(() -> validator.verify(CodeType.CUSTOMER_CARD, "{\"type\":\"giftCard\",\"qrUniqueId\":\"x\"}"))
                .isInstanceOf(CodeValidationException.class)
                .hasMessageContaining("unrecognised");
    }

    @Test
    void verify_rejectsMissingSignatureAndKey() {
        String noSignature = codec.write(codec.parse(record.getPayload()));

        assertThatThrownBy(() -> validator.verify(CodeType.CUSTOMER_CARD, noSignature))
                .isInstanceOf(CodeValidationException.class)
                .hasMessageContaining("signature");
        assertThatThrownBy(() -> validator.verify(CodeType.CUSTOMER_CARD, "{\"type\":\"customer\",\"customerId\":42}"))
                .isInstanceOf(CodeValidationException.class)
                .hasMessageContaining("qrUniqueId");
    }

    @Test
    void verify_rejectsGarbage() {
        assertThatThrownBy(() -> validator.verify(CodeType.CUSTOMER_CARD, "%%%"))
                .isInstanceOf(CodeValidationException.class);
    }

    // ============ Lookup & status ============

    @Test
    void verify_unknownReference_isNotFound() {
        QrPayload p = codec.parse(scanned(record));
        p.setQrUniqueId("00000000-0000-0000-0000-000000000000");

        assertThatThrownBy(() -> validator.verify(CodeType.CUSTOMER_CARD, codec.write(p)))
                .isInstanceOf(CodeNotFoundException.class)
                .hasMessage("code not found");
    }

    @Test
    void verify_recordOfOtherType_isNotFound() {
        record.setCodeType(CodeType.PROMO_CODE);

        assertThatThrownBy(() -> validator.verify(CodeType.CUSTOMER_CARD, scanned(record)))
                .isInstanceOf(CodeNotFoundException.class)
                .hasMessage("code not found");
    }

    @Test
    void verify_nonActiveStatus_reportsLowerCasedStatus() {
        record.setStatus(CodeStatus.REVOKED);
        assertThatThrownBy(() -> validator.verify(CodeType.CUSTOMER_CARD, scanned(record)))
                .isInstanceOf(CodeValidationException.class)
                .hasMessageContaining("revoked");

        record.setStatus(CodeStatus.REPLACED);
        assertThatThrownBy(() -> validator.verify(CodeType.CUSTOMER_CARD, scanned(record)))
                .hasMessageContaining("replaced");

        record.setStatus(CodeStatus.EXPIRED);
        assertThatThrownBy(() -> validator.verify(CodeType.CUSTOMER_CARD, scanned(record)))
                .isInstanceOf(CodeExpiredException.class)
                .hasMessageContaining("expired");
    }

    @Test
    void validate_failureAfterLookup_keepsRecord() {
        record.setStatus(CodeStatus.REVOKED);

        ValidationResult result = validator.validate(CodeType.CUSTOMER_CARD, scanned(record));

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo(CodeValidationException.CODE);
        assertThat(result.getRecord()).isSameAs(record);
        assertThat(result.getVerifiedPayload()).isNull();
    }

    // ============ Signature ============

    @Test
    void verify_flippedSignatureBit_isSecurityError_withoutStateChange() {
        QrPayload p = codec.parse(scanned(record));
        p.setSignature(TestFixtures.flipSignatureBit(p.getSignature()));

        assertThatThrownBy(() -> validator.verify(CodeType.CUSTOMER_CARD, codec.write(p)))
                .isInstanceOf(CodeSecurityException.class);

        assertThat(record.getStatus()).isEqualTo(CodeStatus.ACTIVE);
        verifyNoInteractions(registry);
    }

    @Test
    void verify_tamperedStoredPayload_isSecurityError() {
        String content = scanned(record);
        record.setPayload(record.getPayload().replace("Ada", "Eve"));

        assertThatThrownBy(() -> validator.verify(CodeType.CUSTOMER_CARD, content))
                .isInstanceOf(CodeSecurityException.class);
    }

    // ============ Expiry & rotation ============

    @Test
    void verify_pastExpiry_flipsToExpired() {
        record.setExpiryDate(now().minusMinutes(1));
        when(registry.expire(10L)).thenReturn(true);

        assertThatThrownBy(() -> validator.verify(CodeType.CUSTOMER_CARD, scanned(record)))
                .isInstanceOf(CodeExpiredException.class);

        verify(registry).expire(10L);
    }

    @Test
    void verify_futureExpiry_passes() {
        record.setExpiryDate(now().plusDays(1));

        assertThat(validator.verify(CodeType.CUSTOMER_CARD, scanned(record))).isNotNull();
        verify(registry, never()).expire(any());
    }

    @Test
    void verify_olderThanRotationInterval_needsRefresh() {
        properties.setRotationIntervalDays(30);
        CodeRecord old = TestFixtures.signedRecord(11L, 42L, CodeType.CUSTOMER_CARD, new CustomerCardPayload(42L),
                now().minusDays(31), signer, codec);
        when(codeRepo.findByUniqueId(old.getUniqueId())).thenReturn(Optional.of(old));

        assertThatThrownBy(() -> validator.verify(CodeType.CUSTOMER_CARD, scanned(old)))
                .isInstanceOf(CodeRefreshRequiredException.class)
                .isInstanceOf(CodeExpiredException.class)
                .hasMessageContaining("refresh");
    }

    @Test
    void verify_rotationDisabled_acceptsOldCode() {
        CodeRecord old = TestFixtures.signedRecord(11L, 42L, CodeType.CUSTOMER_CARD, new CustomerCardPayload(42L),
                now().minusDays(100), signer, codec);
        when(codeRepo.findByUniqueId(old.getUniqueId())).thenReturn(Optional.of(old));

        assertThat(validator.verify(CodeType.CUSTOMER_CARD, scanned(old))).isNotNull();
    }

    // ============ Liveness ============

    @Test
    void verify_inactiveCustomer_isExpired() {
        when(directory.lookupCustomer(42L)).thenReturn(Optional.of(new CustomerView(42L, "Ada", false)));

        assertThatThrownBy(() -> validator.verify(CodeType.CUSTOMER_CARD, scanned(record)))
                .isInstanceOf(CodeExpiredException.class)
                .hasMessageContaining("customer");
    }

    @Test
    void verify_loyaltyCard_checksCardAndProgram() {
        CodeRecord card = TestFixtures.signedRecord(12L, 42L, CodeType.LOYALTY_CARD,
                new LoyaltyCardPayload(5L, 42L, 3L, 7L), now().minusDays(1), signer, codec);
        when(codeRepo.findByUniqueId(card.getUniqueId())).thenReturn(Optional.of(card));
        when(directory.lookupCard(5L)).thenReturn(Optional.of(new CardView(5L, 42L, 3L, 7L, "LC-5", 120, true)));
        when(directory.lookupProgram(3L)).thenReturn(Optional.of(new ProgramView(3L, 7L, "Coffee", true)));

        assertThat(validator.verify(CodeType.LOYALTY_CARD, scanned(card)).getPayload())
                .isInstanceOf(LoyaltyCardPayload.class);

        when(directory.lookupProgram(3L)).thenReturn(Optional.of(new ProgramView(3L, 7L, "Coffee", false)));
        assertThatThrownBy(() -> validator.verify(CodeType.LOYALTY_CARD, scanned(card)))
                .isInstanceOf(CodeExpiredException.class)
                .hasMessageContaining("program");

        when(directory.lookupCard(5L)).thenReturn(Optional.of(new CardView(5L, 77L, 3L, 7L, "LC-5", 120, true)));
        assertThatThrownBy(() -> validator.verify(CodeType.LOYALTY_CARD, scanned(card)))
                .isInstanceOf(CodeExpiredException.class)
                .hasMessageContaining("card");
    }

    @Test
    void signatureWindow_isEnforcedOnStoredSignature() {
        clock.advance(Duration.ofDays(200));

        assertThatThrownBy(() -> validator.verify(CodeType.CUSTOMER_CARD, scanned(record)))
                .isInstanceOf(CodeSecurityException.class);
    }
}
