package com.vcarda.loyaltyqrbackend.service.scan;

import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.entity.PromoCode;
import com.vcarda.loyaltyqrbackend.entity.PromoRedemption;
import com.vcarda.loyaltyqrbackend.exception.BusinessRuleException;
import com.vcarda.loyaltyqrbackend.payload.PromoCodePayload;
import com.vcarda.loyaltyqrbackend.repository.PromoCodeRepository;
import com.vcarda.loyaltyqrbackend.repository.PromoRedemptionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PromoCodeScanHandlerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-01T10:00:00Z");

    @Mock private PromoCodeRepository promoRepo;
    @Mock private PromoRedemptionRepository redemptionRepo;

    private PromoCodeScanHandler handler;
    private PromoCode promo;
    private CodeRecord code;
    private PromoCodePayload payload;

    @BeforeEach
    void setUp() {
        handler = new PromoCodeScanHandler(promoRepo, redemptionRepo);

        promo = new PromoCode();
        promo.setId(9L);
        promo.setBusinessId(7L);
        promo.setCode("SPRING10");
        promo.setMaxUses(2);
        promo.setCurrentUses(1);

        code = new CodeRecord();
        code.setId(10L);
        code.setOwnerId(42L);
        payload = new PromoCodePayload(9L, "SPRING10", 7L, 42L);

        lenient().when(promoRepo.findByIdForUpdate(9L)).thenReturn(Optional.of(promo));
        lenient().when(redemptionRepo.save(any(PromoRedemption.class))).thenAnswer(inv -> {
            PromoRedemption r = inv.getArgument(0);
            r.setId(300L);
            return r;
        });
    }

    @Test
    void redeemsOneUse() {
        Map<String, Object> result = handler.handle(code, payload, 7L, NOW);

        assertThat(result).containsEntry("action", "promo_redeemed")
                .containsEntry("promoId", 9L)
                .containsEntry("redemptionId", 300L)
                .containsEntry("remainingUses", 0);
        assertThat(promo.getCurrentUses()).isEqualTo(2);

        ArgumentCaptor<PromoRedemption> saved = ArgumentCaptor.forClass(PromoRedemption.class);
        verify(redemptionRepo).save(saved.capture());
        assertThat(saved.getValue().getCustomerId()).isEqualTo(42L);
        assertThat(saved.getValue().getCodeId()).isEqualTo(10L);
        assertThat(saved.getValue().getRedeemedAt()).isEqualTo(NOW);
    }

    @Test
    void usageCapReached_isRejected() {
        promo.setCurrentUses(2);

        assertThatThrownBy(() -> handler.handle(code, payload, 7L, NOW))
                .isInstanceOf(BusinessRuleException.class)
                .hasMessageContaining("usage limit");
        verifyNoInteractions(redemptionRepo);
        assertThat(promo.getCurrentUses()).isEqualTo(2);
    }

    @Test
    void unlimitedPromo_hasNoRemainingUses() {
        promo.setMaxUses(null);

        assertThat(handler.handle(code, payload, 7L, NOW)).doesNotContainKey("remainingUses");
    }

    @Test
    void otherBusiness_isRejected() {
        assertThatThrownBy(() -> handler.handle(code, payload, 8L, NOW))
                .isInstanceOf(BusinessRuleException.class)
                .hasMessageContaining("different business");
    }

    @Test
    void inactiveOrOutsideWindow_isRejected() {
        promo.setActive(false);
        assertThatThrownBy(() -> handler.handle(code, payload, 7L, NOW)).hasMessageContaining("not active");

        promo.setActive(true);
        promo.setStartsAt(NOW.plusDays(1));
        assertThatThrownBy(() -> handler.handle(code, payload, 7L, NOW)).hasMessageContaining("not started");

        promo.setStartsAt(null);
        promo.setExpiresAt(NOW);
        assertThatThrownBy(() -> handler.handle(code, payload, 7L, NOW)).hasMessageContaining("expired");
    }

    @Test
    void codeMismatchOrMissingPromo_isRejected() {
        payload.setCode("OTHER");
        assertThatThrownBy(() -> handler.handle(code, payload, 7L, NOW)).hasMessageContaining("does not match");

        when(promoRepo.findByIdForUpdate(9L)).thenReturn(Optional.empty());
        assertThatThrownBy(() -> handler.handle(code, payload, 7L, NOW))
                .isInstanceOf(BusinessRuleException.class)
                .hasMessageContaining("not found");
    }
}
