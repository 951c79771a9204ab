package com.vcarda.loyaltyqrbackend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vcarda.loyaltyqrbackend.entity.CodeType;
import com.vcarda.loyaltyqrbackend.entity.ScanOutcomeStatus;
import com.vcarda.loyaltyqrbackend.entity.ScanState;
import com.vcarda.loyaltyqrbackend.service.scan.ScanOutcome;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanResponse {

    private final Long scanId;
    private final ScanState state;
    private final ScanOutcomeStatus status;
    private final Long codeId;
    private final CodeType codeType;
    private final String message;
    private final String errorCode;
    private final Integer pointsAwarded;
    private final Map<String, Object> result;

    public static ScanResponse from(ScanOutcome outcome) {
        return ScanResponse.builder()
                .scanId(outcome.getScanId())
                .state(outcome.getState())
                .status(outcome.getStatus())
                .codeId(outcome.getCodeId())
                .codeType(outcome.getCodeType())
                .message(outcome.getMessage())
                .errorCode(outcome.getErrorCode())
                .pointsAwarded(outcome.getPointsAwarded())
                .result(outcome.getResult())
                .build();
    }
}
