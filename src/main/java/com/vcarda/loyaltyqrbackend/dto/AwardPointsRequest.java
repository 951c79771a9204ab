package com.vcarda.loyaltyqrbackend.dto;

import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;

@Getter
@Setter
public class AwardPointsRequest {

    @NotNull(message = "amount is required")
    @Positive(message = "amount must be positive")
    private Integer amount;

    @NotBlank(message = "source is required")
    private String source;
}
