package com.vcarda.loyaltyqrbackend.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcarda.loyaltyqrbackend.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Requires {@code Authorization: ApiKey <key>} on every {@code /api/**} call.
 *
 * Scanner devices and the merchant back office share one key per deployment; per device
 * credentials are out of scope for this service.
 */
@Component
@Slf4j
public class ApiKeyFilter extends OncePerRequestFilter {

    static final String SCHEME = "ApiKey ";

    private final byte[] expected;
    private final ObjectMapper objectMapper;

    public ApiKeyFilter(@Value("${app.api-key}") String apiKey, ObjectMapper objectMapper) {
        this.expected = (SCHEME + apiKey).getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        String method = request.getMethod();

        if ("OPTIONS".equalsIgnoreCase(method)) return true; // CORS preflight
        if (path.equals("/h2-console") || path.startsWith("/h2-console/")) return true;
        return !path.startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws IOException, ServletException {
        String header = request.getHeader("Authorization");
        if (header == null || !MessageDigest.isEqual(expected, header.getBytes(StandardCharsets.UTF_8))) {
            log.warn("[AUTH] Rejected request without a valid API key. path={}, remote={}",
                    request.getRequestURI(), request.getRemoteAddr());

            ErrorResponse body = ErrorResponse.builder()
                    .status(HttpStatus.UNAUTHORIZED.value())
                    .error(HttpStatus.UNAUTHORIZED.getReasonPhrase())
                    .code("AUTH_INVALID_API_KEY")
                    .message("Unauthorized: missing or invalid API key")
                    .path(request.getRequestURI())
                    .build();
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            objectMapper.writeValue(response.getWriter(), body);
            return;
        }
        filterChain.doFilter(request, response);
    }
}
