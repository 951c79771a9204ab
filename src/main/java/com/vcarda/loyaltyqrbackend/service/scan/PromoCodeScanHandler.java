package com.vcarda.loyaltyqrbackend.service.scan;

import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.entity.PromoCode;
import com.vcarda.loyaltyqrbackend.entity.PromoRedemption;
import com.vcarda.loyaltyqrbackend.exception.BusinessRuleException;
import com.vcarda.loyaltyqrbackend.payload.PromoCodePayload;
import com.vcarda.loyaltyqrbackend.repository.PromoCodeRepository;
import com.vcarda.loyaltyqrbackend.repository.PromoRedemptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Promo code scanned at a business: redeems one use.
 *
 * The promo row is locked for the rest of the transaction, so concurrent redemptions of the
 * same promotion are serialized and the usage cap holds.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PromoCodeScanHandler {

    private final PromoCodeRepository promoRepo;
    private final PromoRedemptionRepository redemptionRepo;

    public Map<String, Object> handle(CodeRecord code, PromoCodePayload payload,
                                      Long businessId, OffsetDateTime now) {
        PromoCode promo = promoRepo.findByIdForUpdate(payload.getPromoId())
                .orElseThrow(() -> new BusinessRuleException("promotion not found"));

        if (!businessId.equals(promo.getBusinessId())) {
            throw new BusinessRuleException("promotion belongs to a different business");
        }
        if (!promo.isActive()) {
            throw new BusinessRuleException("promotion is not active");
        }
        if (promo.getCode() != null && !promo.getCode().equals(payload.getCode())) {
            throw new BusinessRuleException("promotion code does not match");
        }
        if (promo.getStartsAt() != null && now.isBefore(promo.getStartsAt())) {
            throw new BusinessRuleException("promotion has not started yet");
        }
        if (promo.getExpiresAt() != null && !now.isBefore(promo.getExpiresAt())) {
            throw new BusinessRuleException("promotion has expired");
        }
        if (promo.getMaxUses() != null && promo.getCurrentUses() >= promo.getMaxUses()) {
            throw new BusinessRuleException("promotion usage limit reached");
        }

        PromoRedemption redemption = new PromoRedemption();
        redemption.setPromoId(promo.getId());
        redemption.setCustomerId(code.getOwnerId());
        redemption.setBusinessId(businessId);
        redemption.setCodeId(code.getId());
        redemption.setRedeemedAt(now);
        redemption = redemptionRepo.save(redemption);

        promo.setCurrentUses(promo.getCurrentUses() + 1);
        promo.setUpdatedAt(now);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("action", "promo_redeemed");
        result.put("promoId", promo.getId());
        result.put("code", promo.getCode());
        result.put("redemptionId", redemption.getId());
        if (promo.getMaxUses() != null) {
            result.put("remainingUses", promo.getMaxUses() - promo.getCurrentUses());
        }

        log.info("[SCAN] Promo redeemed. promoId={}, customerId={}, uses={}",
                promo.getId(), code.getOwnerId(), promo.getCurrentUses());
        return result;
    }
}
