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
public class PromoCodePayload extends QrPayload {

    public static final String TYPE = "promoCode";

    private Long promoId;

    private String code;

    private Long businessId;

    /** Customer the promotion was handed to. */
    private Long customerId;

    public PromoCodePayload(Long promoId, String code, Long businessId, Long customerId) {
        this.promoId = promoId;
        this.code = code;
        this.businessId = businessId;
        this.customerId = customerId;
    }

    @Override
    public CodeType codeType() {
        return CodeType.PROMO_CODE;
    }

    @Override
    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>();
        if (promoId == null) missing.add("promoId");
        if (code == null || code.isBlank()) missing.add("code");
        return missing;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPromoCode(this);
    }
}
