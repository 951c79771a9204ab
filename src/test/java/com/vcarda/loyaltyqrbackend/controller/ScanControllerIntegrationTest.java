package com.vcarda.loyaltyqrbackend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcarda.loyaltyqrbackend.config.ScanCapacityLimiter;
import com.vcarda.loyaltyqrbackend.dto.ScanRequest;
import com.vcarda.loyaltyqrbackend.entity.CodeType;
import com.vcarda.loyaltyqrbackend.entity.ScanOutcomeStatus;
import com.vcarda.loyaltyqrbackend.entity.ScanState;
import com.vcarda.loyaltyqrbackend.exception.QrErrorType;
import com.vcarda.loyaltyqrbackend.service.scan.ScanDispatcher;
import com.vcarda.loyaltyqrbackend.service.scan.ScanOptions;
import com.vcarda.loyaltyqrbackend.service.scan.ScanOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for {@link ScanController}.
 *
 * The dispatcher and the capacity guard are mocked; the API key filter and exception
 * handling are real.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ScanControllerIntegrationTest {

    private static final String AUTH = "ApiKey test-api-key";

    @Autowired private MockMvc mvc;
    @Autowired private ObjectMapper om;

    @MockBean private ScanDispatcher dispatcher;
    @MockBean private ScanCapacityLimiter capacityLimiter;

    @BeforeEach
    void setUp() {
        Mockito.when(capacityLimiter.tryConsume()).thenReturn(true);
    }

    private ScanRequest validReq() {
        ScanRequest r = new ScanRequest();
        r.setCodeType(CodeType.CUSTOMER_CARD);
        r.setScannerBusinessId(7L);
        r.setPayload("{\"type\":\"customer\",\"qrUniqueId\":\"u-1\",\"signature\":\"abc.1\"}");
        r.setCustomerRef(42L);
        return r;
    }

    @Test
    void postScan_success_should200() throws Exception {
        Mockito.when(dispatcher.dispatch(Mockito.any(), Mockito.any(), Mockito.any(), Mockito.any()))
                .thenReturn(ScanOutcome.builder()
                        .scanId(500L)
                        .state(ScanState.SUCCESS)
                        .status(ScanOutcomeStatus.VALID)
                        .codeId(10L)
                        .codeType(CodeType.CUSTOMER_CARD)
                        .message("scan processed")
                        .result(Collections.<String, Object>singletonMap("action", "customer_identified"))
                        .build());

        mvc.perform(post("/api/v1/scans")
                        .header("Authorization", AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(om.writeValueAsString(validReq())))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.state").value("SUCCESS"))
                .andExpect(jsonPath("$.scanId").value(500))
                .andExpect(jsonPath("$.result.action").value("customer_identified"))
                .andExpect(jsonPath("$.errorCode").doesNotExist());

        ArgumentCaptor<ScanOptions> options = ArgumentCaptor.forClass(ScanOptions.class);
        Mockito.verify(dispatcher).dispatch(Mockito.eq(CodeType.CUSTOMER_CARD), Mockito.eq(7L),
                Mockito.anyString(), options.capture());
        assertThat(options.getValue().getCustomerRef()).isEqualTo(42L);
        assertThat(options.getValue().getSourceAddress()).isEqualTo("127.0.0.1");
    }

    @Test
    void postScan_securityFailure_should422() throws Exception {
        Mockito.when(dispatcher.dispatch(Mockito.any(), Mockito.any(), Mockito.any(), Mockito.any()))
                .thenReturn(ScanOutcome.builder()
                        .scanId(501L)
                        .state(ScanState.INVALID)
                        .status(ScanOutcomeStatus.SUSPICIOUS)
                        .codeType(CodeType.CUSTOMER_CARD)
                        .message("invalid QR code signature")
                        .errorType(QrErrorType.SECURITY)
                        .errorCode("QR_ERR_SECURITY")
                        .build());

        mvc.perform(post("/api/v1/scans")
                        .header("Authorization", AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(om.writeValueAsString(validReq())))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value("SUSPICIOUS"))
                .andExpect(jsonPath("$.errorCode").value("QR_ERR_SECURITY"));
    }

    @Test
    void postScan_expired_should410_andBusinessRule_should409() throws Exception {
        Mockito.when(dispatcher.dispatch(Mockito.any(), Mockito.any(), Mockito.any(), Mockito.any()))
                .thenReturn(ScanOutcome.builder()
                        .state(ScanState.INVALID)
                        .status(ScanOutcomeStatus.INVALID)
                        .errorType(QrErrorType.EXPIRATION)
                        .errorCode("QR_ERR_EXPIRATION")
                        .build())
                .thenReturn(ScanOutcome.builder()
                        .state(ScanState.FAILED)
                        .status(ScanOutcomeStatus.INVALID)
                        .errorType(QrErrorType.BUSINESS_LOGIC)
                        .errorCode("QR_ERR_BUSINESS_LOGIC")
                        .build());

        String body = om.writeValueAsString(validReq());
        mvc.perform(post("/api/v1/scans").header("Authorization", AUTH)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isGone());
        mvc.perform(post("/api/v1/scans").header("Authorization", AUTH)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isConflict());
    }

    @Test
    void postScan_rateLimitedOutcome_should429() throws Exception {
        Mockito.when(dispatcher.dispatch(Mockito.any(), Mockito.any(), Mockito.any(), Mockito.any()))
                .thenReturn(ScanOutcome.builder()
                        .state(ScanState.RATE_LIMITED)
                        .status(ScanOutcomeStatus.SUSPICIOUS)
                        .errorType(QrErrorType.RATE_LIMIT)
                        .errorCode("QR_ERR_RATE_LIMIT")
                        .build());

        mvc.perform(post("/api/v1/scans")
                        .header("Authorization", AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(om.writeValueAsString(validReq())))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.state").value("RATE_LIMITED"));
    }

    @Test
    void postScan_overCapacity_should429_withoutDispatch() throws Exception {
        Mockito.when(capacityLimiter.tryConsume()).thenReturn(false);

        mvc.perform(post("/api/v1/scans")
                        .header("Authorization", AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(om.writeValueAsString(validReq())))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("Too Many Requests"));

        Mockito.verifyNoInteractions(dispatcher);
    }

    @Test
    void postScan_missingPayload_should400() throws Exception {
        ScanRequest r = validReq();
        r.setPayload(" ");

        mvc.perform(post("/api/v1/scans")
                        .header("Authorization", AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(om.writeValueAsString(r)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("payload is required"));
    }

    @Test
    void postScan_malformedBody_should400() throws Exception {
        mvc.perform(post("/api/v1/scans")
                        .header("Authorization", AUTH)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"codeType\":\"NOT_A_TYPE\""))
                .andExpect(status().isBadRequest());
    }

    @Test
    void postScan_withoutApiKey_should401() throws Exception {
        mvc.perform(post("/api/v1/scans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(om.writeValueAsString(validReq())))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH_INVALID_API_KEY"));

        mvc.perform(post("/api/v1/scans")
                        .header("Authorization", "ApiKey wrong-key")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(om.writeValueAsString(validReq())))
                .andExpect(status().isUnauthorized());

        Mockito.verifyNoInteractions(dispatcher);
    }

    @Test
    void optionsPreflight_shouldReturnCorsHeaders() throws Exception {
        mvc.perform(options("/api/v1/scans")
                        .header("Origin", "http://localhost:5173")
                        .header("Access-Control-Request-Method", "POST"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "http://localhost:5173"));
    }
}
