package com.vcarda.loyaltyqrbackend.controller;

import com.vcarda.loyaltyqrbackend.directory.PointsAwarder;
import com.vcarda.loyaltyqrbackend.dto.AwardPointsRequest;
import com.vcarda.loyaltyqrbackend.dto.PointsBalanceResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;

/**
 * Explicit operator point awards. Scans never credit points; merchants do it here.
 */
@RestController
@RequestMapping("/api/v1/cards")
@Validated
@RequiredArgsConstructor
public class CardPointsController {

    private final PointsAwarder pointsAwarder;

    @PostMapping(
            value = "/{cardId}/points",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public PointsBalanceResponse award(@PathVariable Long cardId, @Valid @RequestBody AwardPointsRequest request) {
        long balance = pointsAwarder.awardPoints(cardId, request.getAmount(), request.getSource());
        return new PointsBalanceResponse(cardId, balance);
    }
}
