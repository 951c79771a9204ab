package com.vcarda.loyaltyqrbackend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

/**
 * Unified error response returned by API endpoints.
 */
@Getter
@Setter
@Builder
@AllArgsConstructor
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private final int status;      // HTTP status code
    private final String error;    // Short title (e.g., "Bad Request", "Conflict")
    private final String code;     // Machine-readable code (e.g., "QR_ERR_SECURITY"), optional
    private final String message;  // Detailed error description
    private final String path;     // Request path
}
