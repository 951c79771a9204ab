package com.vcarda.loyaltyqrbackend.controller;

import com.vcarda.loyaltyqrbackend.dto.CodeResponse;
import com.vcarda.loyaltyqrbackend.entity.CodeRecord;
import com.vcarda.loyaltyqrbackend.entity.CodeType;
import com.vcarda.loyaltyqrbackend.exception.CodeNotFoundException;
import com.vcarda.loyaltyqrbackend.service.CodeIssuer;
import com.vcarda.loyaltyqrbackend.service.CodeRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Codes owned by a customer.
 */
@RestController
@RequestMapping("/api/v1/customers/{ownerId}/codes")
@Validated
@RequiredArgsConstructor
public class CustomerCodeController {

    private final CodeRegistry registry;
    private final CodeIssuer issuer;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<CodeResponse> list(@PathVariable Long ownerId,
                                   @RequestParam(name = "type", required = false) CodeType type) {
        return registry.listForOwner(ownerId, type).stream()
                .map(r -> CodeResponse.from(r, null))
                .collect(Collectors.toList());
    }

    @GetMapping(value = "/primary", produces = MediaType.APPLICATION_JSON_VALUE)
    public CodeResponse primary(@PathVariable Long ownerId, @RequestParam("type") CodeType type) {
        CodeRecord record = registry.findPrimary(ownerId, type).orElseThrow(CodeNotFoundException::new);
        return CodeResponse.from(record, issuer.scannableContent(record));
    }
}
