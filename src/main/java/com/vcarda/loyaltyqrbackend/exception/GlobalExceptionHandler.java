package com.vcarda.loyaltyqrbackend.exception;

import com.vcarda.loyaltyqrbackend.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import javax.servlet.http.HttpServletRequest;
import javax.validation.ConstraintViolationException;
import java.time.Duration;
import java.time.Instant;

/**
 * Global exception handler for all controllers.
 * Ensures that API errors are consistently returned as {@link ErrorResponse}.
 *
 * QR code failures map by error class:
 *  - validation 422 (code not found 404), security 422, expiration 410,
 *  - business rule 409, rate limit 429, transient store 503, anything else 500.
 * Request shape problems (bean validation, unreadable JSON, bad parameters) are 400.
 */
@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    public static HttpStatus statusFor(QrErrorType type) {
        if (type == null) return HttpStatus.INTERNAL_SERVER_ERROR;
        switch (type) {
            case VALIDATION:
            case SECURITY:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case EXPIRATION:
                return HttpStatus.GONE;
            case BUSINESS_LOGIC:
                return HttpStatus.CONFLICT;
            case RATE_LIMIT:
                return HttpStatus.TOO_MANY_REQUESTS;
            case TRANSIENT_STORE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    @ExceptionHandler(CodeNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(CodeNotFoundException ex, HttpServletRequest req) {
        return build(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), req);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitExceededException ex, HttpServletRequest req) {
        ErrorResponse body = body(HttpStatus.TOO_MANY_REQUESTS, ex.getErrorCode(), ex.getMessage(), req);
        HttpHeaders headers = new HttpHeaders();
        if (ex.getResetAt() != null) {
            long seconds = Math.max(1, Duration.between(Instant.now(), ex.getResetAt()).getSeconds());
            headers.set(HttpHeaders.RETRY_AFTER, Long.toString(seconds));
        }
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).headers(headers).body(body);
    }

    /**
     * Any other classified QR code failure.
     */
    @ExceptionHandler(QrCodeException.class)
    public ResponseEntity<ErrorResponse> handleQrCode(QrCodeException ex, HttpServletRequest req) {
        HttpStatus status = statusFor(ex.getErrorType());
        if (ex.getErrorType() == QrErrorType.SECURITY) {
            log.error("[API] {} {} -> {}", req.getMethod(), req.getRequestURI(), ex.getErrorCode());
        } else if (status.is5xxServerError()) {
            log.error("[API] {} {} -> {}: {}", req.getMethod(), req.getRequestURI(), ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.info("[API] {} {} -> {}: {}", req.getMethod(), req.getRequestURI(), ex.getErrorCode(), ex.getMessage());
        }
        // transient failures get the generic wording, the rest are already client-safe
        String message = ex.getErrorType() == QrErrorType.TRANSIENT_STORE ? ex.getUserMessage() : ex.getMessage();
        return build(status, ex.getErrorCode(), message, req);
    }

    /**
     * Handle validation errors from @Valid request body.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBodyValidation(
            MethodArgumentNotValidException ex, HttpServletRequest req) {

        String msg = ex.getBindingResult()
                .getAllErrors()
                .get(0)
                .getDefaultMessage();
        return build(HttpStatus.BAD_REQUEST, null, msg, req);
    }

    /**
     * Handle validation errors from @Validated method parameters.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest req) {
        return build(HttpStatus.BAD_REQUEST, null, ex.getMessage(), req);
    }

    /**
     * Malformed JSON, unknown enum values, wrong payload "type".
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest req) {
        return build(HttpStatus.BAD_REQUEST, null, "Malformed request body", req);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception ex, HttpServletRequest req) {
        return build(HttpStatus.BAD_REQUEST, null, ex.getMessage(), req);
    }

    /**
     * Handle explicit ResponseStatusException thrown inside services or controllers.
     */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(
            ResponseStatusException ex, HttpServletRequest req) {
        return build(ex.getStatus(), null, ex.getReason(), req);
    }

    /**
     * Catch-all handler for unexpected exceptions.
     * Prevents leaking stack traces to clients.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("[API] Unexpected error on {} {}", req.getMethod(), req.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "QR_ERR_UNKNOWN", QrErrorType.UNKNOWN.getUserMessage(), req);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message,
                                                       HttpServletRequest req) {
        return ResponseEntity.status(status).body(body(status, code, message, req));
    }

    private static ErrorResponse body(HttpStatus status, String code, String message, HttpServletRequest req) {
        return ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .code(code)
                .message(message)
                .path(req.getRequestURI())
                .build();
    }
}
