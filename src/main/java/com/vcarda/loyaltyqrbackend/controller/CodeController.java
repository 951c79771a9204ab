package com.vcarda.loyaltyqrbackend.controller;

import com.vcarda.loyaltyqrbackend.dto.CodeResponse;
import com.vcarda.loyaltyqrbackend.dto.IssueCodeRequest;
import com.vcarda.loyaltyqrbackend.dto.RevokeCodeRequest;
import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.exception.BusinessRuleException;
import com.vcarda.loyaltyqrbackend.exception.CodeNotFoundException;
import com.vcarda.loyaltyqrbackend.service.CodeIssuer;
import com.vcarda.loyaltyqrbackend.service.CodeRegistry;
import com.vcarda.loyaltyqrbackend.service.IssueOptions;
import com.vcarda.loyaltyqrbackend.service.RotationManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;

/**
 * Code lifecycle endpoints.
 *
 *  - POST /api/v1/codes                 issue
 *  - GET  /api/v1/codes/{uniqueId}      metadata + scannable content
 *  - POST /api/v1/codes/{id}/rotate     rotate
 *  - POST /api/v1/codes/{id}/revoke     revoke
 */
@RestController
@RequestMapping("/api/v1/codes")
@Validated
@RequiredArgsConstructor
public class CodeController {

    private final CodeIssuer issuer;
    private final CodeRegistry registry;
    private final RotationManager rotationManager;

    @PostMapping(
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<CodeResponse> issue(@Valid @RequestBody IssueCodeRequest request) {
        IssueOptions options = IssueOptions.builder()
                .imageRef(request.getImageRef())
                .primary(request.isPrimary())
                .expiryDate(request.getExpiryDate())
                .build();

        CodeRecord record = issuer.issue(request.getOwnerId(), request.getBusinessId(),
                request.getCodeType(), request.getPayload(), options);
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(record));
    }

    @GetMapping(value = "/{uniqueId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public CodeResponse get(@PathVariable String uniqueId) {
        CodeRecord record = registry.findByUniqueId(uniqueId).orElseThrow(CodeNotFoundException::new);
        return toResponse(record);
    }

    @PostMapping(value = "/{id}/rotate", produces = MediaType.APPLICATION_JSON_VALUE)
    public CodeResponse rotate(@PathVariable Long id) {
        CodeRecord successor = rotationManager.rotate(id)
                .orElseThrow(() -> new BusinessRuleException("code " + id + " is not active and cannot be rotated"));
        return toResponse(successor);
    }

    @PostMapping(
            value = "/{id}/revoke",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public CodeResponse revoke(@PathVariable Long id, @Valid @RequestBody RevokeCodeRequest request) {
        return toResponse(registry.revoke(id, request.getReason()));
    }

    private CodeResponse toResponse(CodeRecord record) {
        String content = record.isActive() ? issuer.scannableContent(record) : null;
        return CodeResponse.from(record, content);
    }
}
