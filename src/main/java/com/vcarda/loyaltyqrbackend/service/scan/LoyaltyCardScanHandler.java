package com.vcarda.loyaltyqrbackend.service.scan;

import com.vcarda.loyaltyqrbackend.directory.LoyaltyDirectory;
import com.vcarda.loyaltyqrbackend.directory.LoyaltyDirectory.CardView;
import com.vcarda.loyaltyqrbackend.directory.LoyaltyDirectory.ProgramView;
import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.exception.BusinessRuleException;
import com.vcarda.loyaltyqrbackend.payload.LoyaltyCardPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loyalty card scanned at a business: reports the card state. Points are awarded separately.
 */
@Component
@RequiredArgsConstructor
public class LoyaltyCardScanHandler {

    private final LoyaltyDirectory directory;

    public Map<String, Object> handle(CodeRecord code, LoyaltyCardPayload payload, Long businessId) {
        CardView card = directory.lookupCard(payload.getCardId())
                .orElseThrow(() -> new BusinessRuleException("loyalty card not found"));
        if (!businessId.equals(card.getBusinessId())) {
            throw new BusinessRuleException("loyalty card belongs to a different business");
        }
        ProgramView program = directory.lookupProgram(card.getProgramId())
                .filter(ProgramView::isActive)
                .orElseThrow(() -> new BusinessRuleException("loyalty program is not active"));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("action", "card_identified");
        result.put("cardId", card.getId());
        result.put("customerId", code.getOwnerId());
        result.put("programId", program.getId());
        result.put("programName", program.getName());
        result.put("cardNumber", card.getCardNumber());
        result.put("points", card.getPoints());
        return result;
    }
}
