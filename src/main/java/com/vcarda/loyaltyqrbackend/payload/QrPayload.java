package com.vcarda.loyaltyqrbackend.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.vcarda.loyaltyqrbackend.entity.CodeType;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * Data carried by a QR code, as a tagged union on the "type" property.
 *
 * <p>The same shape is used for the persisted payload (without {@code signature}) and for the
 * text encoded into the printed image (with {@code signature}). Unrecognised or missing tags
 * deserialize to {@link UnknownPayload}. Callers branch on the variant through {@link Visitor},
 * so adding a variant breaks every dispatch site at compile time instead of falling through.
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.PROPERTY,
        property = "type",
        defaultImpl = UnknownPayload.class
)
@JsonSubTypes({
        @JsonSubTypes.Type(value = CustomerCardPayload.class, name = CustomerCardPayload.TYPE),
        @JsonSubTypes.Type(value = LoyaltyCardPayload.class, name = LoyaltyCardPayload.TYPE),
        @JsonSubTypes.Type(value = PromoCodePayload.class, name = PromoCodePayload.TYPE),
        @JsonSubTypes.Type(value = UnknownPayload.class, name = UnknownPayload.TYPE)
})
public abstract class QrPayload {

    /** uniqueId of the code record this payload belongs to. */
    private String qrUniqueId;

    /** Issuance time, epoch millis. */
    private Long timestamp;

    /** uniqueId of the record this one replaced (set on rotation). */
    private String previousUniqueId;

    /** Record signature; only present in scanned text, never in the persisted payload. */
    private String signature;

    /** Code type this variant is issued as; null for {@link UnknownPayload}. */
    public abstract CodeType codeType();

    /** Names of variant-specific fields that are required but absent. */
    public abstract List<String> missingRequiredFields();

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {

        R visitCustomerCard(CustomerCardPayload payload);

        R visitLoyaltyCard(LoyaltyCardPayload payload);

        R visitPromoCode(PromoCodePayload payload);

        R visitUnknown(UnknownPayload payload);
    }
}
