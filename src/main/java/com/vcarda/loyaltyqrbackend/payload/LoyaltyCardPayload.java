package com.vcarda.loyaltyqrbackend.payload;

import com.vcarda.loyaltyqrbackend.entity.CodeType;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
public class LoyaltyCardPayload extends QrPayload {

    public static final String TYPE = "loyaltyCard";

    private Long cardId;

    private Long customerId;

    private Long programId;

    private Long businessId;

    private String cardNumber;

    public LoyaltyCardPayload(Long cardId, Long customerId, Long programId, Long businessId) {
        this.cardId = cardId;
        this.customerId = customerId;
        this.programId = programId;
        this.businessId = businessId;
    }

    @Override
    public CodeType codeType() {
        return CodeType.LOYALTY_CARD;
    }

    @Override
    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>();
        if (cardId == null) missing.add("cardId");
        if (programId == null) missing.add("programId");
        if (customerId == null) missing.add("customerId");
        return missing;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLoyaltyCard(this);
    }
}
