package com.vcarda.loyaltyqrbackend.service.scan;

import com.vcarda.loyaltyqrbackend.directory.LoyaltyDirectory;
import com.vcarda.loyaltyqrbackend.directory.LoyaltyDirectory.CardView;
import com.vcarda.loyaltyqrbackend.directory.LoyaltyDirectory.ProgramView;
import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.entity.CustomerBusinessRelationship;
import com.vcarda.loyaltyqrbackend.exception.BusinessRuleException;
import com.vcarda.loyaltyqrbackend.payload.CustomerCardPayload;
import com.vcarda.loyaltyqrbackend.repository.CustomerBusinessRelationshipRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Customer card scanned at a business: records the interaction and reports what the customer
 * has (or could join) there. Never awards points.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CustomerCardScanHandler {

    private final CustomerBusinessRelationshipRepository relationshipRepo;
    private final LoyaltyDirectory directory;

    public Map<String, Object> handle(CodeRecord code, CustomerCardPayload payload,
                                      Long businessId, OffsetDateTime now) {
        Long customerId = code.getOwnerId();
        boolean businessActive = directory.lookupBusiness(businessId)
                .map(LoyaltyDirectory.BusinessView::isActive)
                .orElse(false);
        if (!businessActive) {
            throw new BusinessRuleException("scanning business is not active");
        }

        CustomerBusinessRelationship rel = relationshipRepo.findForUpdate(customerId, businessId).orElse(null);
        boolean firstVisit = rel == null;
        if (firstVisit) {
            rel = new CustomerBusinessRelationship();
            rel.setCustomerId(customerId);
            rel.setBusinessId(businessId);
            rel.setInteractionCount(1);
            rel.setFirstInteractionAt(now);
        } else {
            rel.setInteractionCount(rel.getInteractionCount() + 1);
        }
        rel.setLastInteractionAt(now);
        relationshipRepo.save(rel);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("action", "customer_identified");
        result.put("customerId", customerId);
        result.put("businessId", businessId);
        result.put("firstVisit", firstVisit);
        result.put("interactionCount", rel.getInteractionCount());

        List<CardView> cards = directory.findCards(customerId, businessId);
        if (!cards.isEmpty()) {
            List<Map<String, Object>> cardList = new ArrayList<>();
            long total = 0;
            for (CardView card : cards) {
                Map<String, Object> c = new LinkedHashMap<>();
                c.put("cardId", card.getId());
                c.put("programId", card.getProgramId());
                c.put("cardNumber", card.getCardNumber());
                c.put("points", card.getPoints());
                cardList.add(c);
                total += card.getPoints();
            }
            result.put("cards", cardList);
            result.put("totalPoints", total);
        } else {
            List<Map<String, Object>> programs = new ArrayList<>();
            for (ProgramView program : directory.findActivePrograms(businessId)) {
                Map<String, Object> p = new LinkedHashMap<>();
                p.put("programId", program.getId());
                p.put("name", program.getName());
                programs.add(p);
            }
            result.put("availablePrograms", programs);
        }

        log.info("[SCAN] Customer card. customerId={}, businessId={}, interactions={}",
                customerId, businessId, rel.getInteractionCount());
        return result;
    }
}
