package com.vcarda.loyaltyqrbackend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.entity.CodeStatus;
import com.vcarda.loyaltyqrbackend.entity.CodeType;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;

/**
 * Client-safe view of a code record. The signature itself is only exposed inside
 * {@code content}, the text to print.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CodeResponse {

    private final Long id;
    private final String uniqueId;
    private final Long ownerId;
    private final Long businessId;
    private final CodeType codeType;
    private final CodeStatus status;
    private final boolean primary;
    private final String verificationCode;
    private final long usesCount;
    private final OffsetDateTime lastUsedAt;
    private final OffsetDateTime expiryDate;
    private final String imageRef;
    private final String previousRef;
    private final Long replacedByRef;
    private final String revokedReason;
    private final OffsetDateTime createdAt;

    /** Scannable text; only set for ACTIVE codes. */
    private final String content;

    public static CodeResponse from(CodeRecord r, String content) {
        return CodeResponse.builder()
                .id(r.getId())
                .uniqueId(r.getUniqueId())
                .ownerId(r.getOwnerId())
                .businessId(r.getRelatedBusinessId())
                .codeType(r.getCodeType())
                .status(r.getStatus())
                .primary(r.isPrimary())
                .verificationCode(r.getVerificationCode())
                .usesCount(r.getUsesCount())
                .lastUsedAt(r.getLastUsedAt())
                .expiryDate(r.getExpiryDate())
                .imageRef(r.getImageRef())
                .previousRef(r.getPreviousRef())
                .replacedByRef(r.getReplacedByRef())
                .revokedReason(r.getRevokedReason())
                .createdAt(r.getCreatedAt())
                .content(content)
                .build();
    }
}
