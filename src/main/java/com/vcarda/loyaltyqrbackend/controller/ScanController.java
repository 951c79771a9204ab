package com.vcarda.loyaltyqrbackend.controller;

import com.vcarda.loyaltyqrbackend.config.ScanCapacityLimiter;
import com.vcarda.loyaltyqrbackend.dto.ErrorResponse;
import com.vcarda.loyaltyqrbackend.dto.ScanRequest;
import com.vcarda.loyaltyqrbackend.dto.ScanResponse;
import com.vcarda.loyaltyqrbackend.entity.ScanState;
import com.vcarda.loyaltyqrbackend.exception.GlobalExceptionHandler;
import com.vcarda.loyaltyqrbackend.exception.RateLimitExceededException;
import com.vcarda.loyaltyqrbackend.service.scan.ScanDispatcher;
import com.vcarda.loyaltyqrbackend.service.scan.ScanOptions;
import com.vcarda.loyaltyqrbackend.service.scan.ScanOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import javax.servlet.http.HttpServletRequest;
import javax.validation.Valid;

/**
 * REST controller for scan submissions.
 *
 * Endpoints:
 *  - POST /api/v1/scans
 *
 * Features:
 *  - Global capacity guard (Bucket4j); over capacity the request is answered 429 without
 *    reaching the dispatcher.
 *  - The response body is always a {@link ScanResponse}; the HTTP status follows the error
 *    class of a failed attempt (see {@link GlobalExceptionHandler#statusFor}).
 */
@RestController
@RequestMapping("/api/v1/scans")
@Validated
@RequiredArgsConstructor
public class ScanController {

    private final ScanDispatcher dispatcher;
    private final ScanCapacityLimiter capacityLimiter;

    @PostMapping(
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<?> scan(@Valid @RequestBody ScanRequest request, HttpServletRequest httpReq) {
        if (!capacityLimiter.tryConsume()) {
            ErrorResponse error = ErrorResponse.builder()
                    .status(HttpStatus.TOO_MANY_REQUESTS.value())
                    .error("Too Many Requests")
                    .code(RateLimitExceededException.CODE)
                    .message("Too many requests - please try again later.")
                    .path(httpReq.getRequestURI())
                    .build();
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(error);
        }

        ScanOptions options = ScanOptions.builder()
                .sourceAddress(httpReq.getRemoteAddr())
                .customerRef(request.getCustomerRef())
                .programRef(request.getProgramRef())
                .promoRef(request.getPromoRef())
                .build();

        ScanOutcome outcome = dispatcher.dispatch(
                request.getCodeType(), request.getScannerBusinessId(), request.getPayload(), options);

        HttpStatus status = outcome.getState() == ScanState.SUCCESS
                ? HttpStatus.OK
                : GlobalExceptionHandler.statusFor(outcome.getErrorType());
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ScanResponse.from(outcome));
    }
}
