package com.vcarda.loyaltyqrbackend.service.scan;

import com.vcarda.loyaltyqrbackend.entity.CodeType;
import com.vcarda.loyaltyqrbackend.entity.ScanOutcomeStatus;
import com.vcarda.loyaltyqrbackend.entity.ScanState;
import com.vcarda.loyaltyqrbackend.exception.QrErrorType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Terminal result of one scan attempt.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ScanOutcome {

    /** Id of the audit row; null if the audit write failed. */
    private final Long scanId;

    private final ScanState state;

    private final ScanOutcomeStatus status;

    /** Resolved code record, null when the attempt failed before lookup. */
    private final Long codeId;

    private final CodeType codeType;

    /** Owner of the resolved code record. */
    private final Long ownerId;

    private final String message;

    /** Set on every non-SUCCESS state. */
    private final QrErrorType errorType;

    private final String errorCode;

    /** Always null: scans never award points on their own. */
    private final Integer pointsAwarded;

    /** Handler-specific detail (relationship, card balance, redemption, ...). */
    private final Map<String, Object> result;

    public boolean isSuccess() {
        return state == ScanState.SUCCESS;
    }
}
