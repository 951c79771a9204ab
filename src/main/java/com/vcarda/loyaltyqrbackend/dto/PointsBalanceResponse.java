package com.vcarda.loyaltyqrbackend.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PointsBalanceResponse {

    private final Long cardId;
    private final long points;
}
