package com.vcarda.loyaltyqrbackend.dto;

import com.vcarda.loyaltyqrbackend.entity.CodeType;
import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import javax.validation.constraints.Size;

/**
 * DTO for a scan submitted by a merchant device.
 */
@Getter
@Setter
public class ScanRequest {

    @NotNull(message = "codeType is required")
    private CodeType codeType;

    @NotNull(message = "scannerBusinessId is required")
    @Positive(message = "scannerBusinessId must be positive")
    private Long scannerBusinessId;

    /** Raw text decoded from the image. */
    @NotBlank(message = "payload is required")
    @Size(max = 4096, message = "payload is too large")
    private String payload;

    // Optional hints; must match the code when present
    private Long customerRef;
    private Long programRef;
    private Long promoRef;
}
