package io.github.samzhu.billing.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import io.github.samzhu.billing.document.UsageStatus;
import io.github.samzhu.billing.dto.ChargeResult;
import io.github.samzhu.billing.dto.UsageCharge;
import io.github.samzhu.billing.service.UsageMeterService;
import io.github.samzhu.billing.service.UsageQueryService;

class UsageApiControllerTest {

    private UsageMeterService usageMeter;
    private UsageQueryService queryService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        usageMeter = mock(UsageMeterService.class);
        queryService = mock(UsageQueryService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new UsageApiController(usageMeter, queryService))
            .setControllerAdvice(new BillingExceptionHandler())
            .build();
    }

    @Test
    void shouldChargeReportedUsage() throws Exception {
        // Given
        when(usageMeter.recordAndCharge(any(UsageCharge.class))).thenReturn(
            new ChargeResult(new BigDecimal("0.007500"), "usage-1", "tx-1", UsageStatus.COMPLETED, false));

        // When
        mockMvc.perform(post("/api/v1/usage/reports")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"userId": "user-1", "model": "openai:gpt-4o", "promptTokens": 1000,
                     "completionTokens": 500, "totalTokens": 1500, "requestId": "req-1"}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cost").value(0.0075))
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.replayed").value(false));

        // Then
        ArgumentCaptor<UsageCharge> charge = ArgumentCaptor.forClass(UsageCharge.class);
        verify(usageMeter).recordAndCharge(charge.capture());
        assertThat(charge.getValue().providerId()).isEqualTo("openai");
        assertThat(charge.getValue().modelId()).isEqualTo("gpt-4o");
        assertThat(charge.getValue().requestId()).isEqualTo("req-1");
    }

    @Test
    void shouldRequireRequestId() throws Exception {
        // When / Then
        mockMvc.perform(post("/api/v1/usage/reports")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"userId": "user-1", "model": "openai:gpt-4o", "promptTokens": 10}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errors.requestId").value("requestId is required"));

        verify(usageMeter, never()).recordAndCharge(any());
    }

    @Test
    void shouldRejectMalformedModelReference() throws Exception {
        // When / Then
        mockMvc.perform(post("/api/v1/usage/reports")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"userId": "user-1", "model": "gpt-4o", "requestId": "req-2"}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.title").value("Invalid Request"));
    }

    @Test
    void shouldRejectInvertedDateRange() throws Exception {
        // When / Then
        mockMvc.perform(get("/api/v1/usage/users/user-1/summary")
                .param("startDate", "2026-03-10")
                .param("endDate", "2026-03-01"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail").value("endDate must not be before startDate"));
    }
}
