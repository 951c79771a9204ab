package com.vcarda.loyaltyqrbackend.directory;

import com.vcarda.loyaltyqrbackend.entity.LoyaltyCard;
import com.vcarda.loyaltyqrbackend.exception.BusinessRuleException;
import com.vcarda.loyaltyqrbackend.exception.CodeValidationException;
import com.vcarda.loyaltyqrbackend.repository.LoyaltyCardRepository;
import com.vcarda.loyaltyqrbackend.service.StoreRetryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaPointsAwarder implements PointsAwarder {

    private final LoyaltyCardRepository cardRepo;
    private final StoreRetryExecutor store;
    private final Clock clock;

    @Override
    public long awardPoints(Long cardId, int amount, String source) {
        if (amount <= 0) {
            throw new CodeValidationException("points amount must be positive");
        }

        long balance = store.execute("award-points", status -> {
            LoyaltyCard card = cardRepo.findByIdForUpdate(cardId)
                    .orElseThrow(() -> new BusinessRuleException("loyalty card not found"));
            if (!card.isActive()) {
                throw new BusinessRuleException("loyalty card is not active");
            }
            card.setPoints(card.getPoints() + amount);
            card.setUpdatedAt(OffsetDateTime.now(clock));
            return card.getPoints();
        });

        log.info("[POINTS] Awarded. cardId={}, amount={}, source={}, balance={}", cardId, amount, source, balance);
        return balance;
    }
}
