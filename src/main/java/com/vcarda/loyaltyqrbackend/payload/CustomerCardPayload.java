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
public class CustomerCardPayload extends QrPayload {

    public static final String TYPE = "customer";

    private Long customerId;

    /** Display name printed next to the code; informational only. */
    private String name;

    private Long businessId;

    public CustomerCardPayload(Long customerId) {
        this.customerId = customerId;
    }

    @Override
    public CodeType codeType() {
        return CodeType.CUSTOMER_CARD;
    }

    @Override
    public List<String> missingRequiredFields() {
        List<String> missing = new ArrayList<>();
        if (customerId == null) missing.add("customerId");
        return missing;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCustomerCard(this);
    }
}
