package com.vcarda.loyaltyqrbackend.dto;

import com.vcarda.loyaltyqrbackend.entity.CodeType;
import com.vcarda.loyaltyqrbackend.payload.QrPayload;
import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import javax.validation.constraints.Size;
import java.time.OffsetDateTime;

/**
 * DTO for issuing a new code. {@code payload} is the tagged payload document, e.g.
 * {@code {"type":"customer","customerId":42}}.
 */
@Getter
@Setter
public class IssueCodeRequest {

    @NotNull(message = "ownerId is required")
    @Positive(message = "ownerId must be positive")
    private Long ownerId;

    @Positive(message = "businessId must be positive")
    private Long businessId;

    @NotNull(message = "codeType is required")
    private CodeType codeType;

    @NotNull(message = "payload is required")
    private QrPayload payload;

    @Size(max = 512, message = "imageRef is too long")
    private String imageRef;

    private boolean primary;

    private OffsetDateTime expiryDate;
}
