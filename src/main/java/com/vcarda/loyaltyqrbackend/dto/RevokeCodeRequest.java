package com.vcarda.loyaltyqrbackend.dto;

import lombok.Getter;
import lombok.Setter;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;

@Getter
@Setter
public class RevokeCodeRequest {

    @NotBlank(message = "reason is required")
    @Size(max = 255, message = "reason is too long")
    private String reason;
}
