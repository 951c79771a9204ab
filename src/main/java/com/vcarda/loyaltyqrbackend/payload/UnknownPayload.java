package com.vcarda.loyaltyqrbackend.payload;

import com.vcarda.loyaltyqrbackend.entity.CodeType;
import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.List;

/**
 * Anything the scanner read that does not carry a recognised tag.
 */
@Getter
@Setter
public class UnknownPayload extends QrPayload {

    public static final String TYPE = "unknown";

    private String rawData;

    @Override
    public CodeType codeType() {
        return null;
    }

    @Override
    public List<String> missingRequiredFields() {
        return Collections.emptyList();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUnknown(this);
    }
}
