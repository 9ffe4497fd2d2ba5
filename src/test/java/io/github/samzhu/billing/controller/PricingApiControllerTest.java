package io.github.samzhu.billing.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import io.github.samzhu.billing.document.ChangeType;
import io.github.samzhu.billing.document.ModelPricing;
import io.github.samzhu.billing.document.PricingChange;
import io.github.samzhu.billing.dto.ChangeSet;
import io.github.samzhu.billing.dto.DetectedChange;
import io.github.samzhu.billing.dto.SyncOptions;
import io.github.samzhu.billing.dto.SyncResult;
import io.github.samzhu.billing.dto.SyncResult.ChangeSummary;
import io.github.samzhu.billing.dto.SyncResult.ProviderSummary;
import io.github.samzhu.billing.dto.SyncState;
import io.github.samzhu.billing.exception.NoPricingException;
import io.github.samzhu.billing.exception.PricingChangeNotFoundException;
import io.github.samzhu.billing.exception.SyncInProgressException;
import io.github.samzhu.billing.service.PricingCacheService;
import io.github.samzhu.billing.service.PricingHealthService;
import io.github.samzhu.billing.service.SyncOrchestratorService;
import io.github.samzhu.billing.service.provider.ProviderRegistry;

class PricingApiControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private PricingCacheService pricingCache;
    private SyncOrchestratorService orchestrator;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        pricingCache = mock(PricingCacheService.class);
        orchestrator = mock(SyncOrchestratorService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new PricingApiController(pricingCache, orchestrator,
                mock(PricingHealthService.class), mock(ProviderRegistry.class)))
            .setControllerAdvice(new BillingExceptionHandler())
            .build();
    }

    @Test
    void shouldReturnActivePrice() throws Exception {
        // Given
        when(pricingCache.getPrice("gpt-4o", "openai")).thenReturn(ModelPricing.create("gpt-4o", "openai",
            new BigDecimal("0.0025"), new BigDecimal("0.01"), PricingChange.SOURCE_SEED, NOW));

        // When / Then
        mockMvc.perform(get("/api/v1/pricing/models/openai/gpt-4o"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.modelId").value("gpt-4o"))
            .andExpect(jsonPath("$.inputPricePer1kTokens").value(0.0025))
            .andExpect(jsonPath("$.active").value(true));
    }

    @Test
    void shouldReturnUnprocessableWhenModelHasNoPricing() throws Exception {
        // Given
        when(pricingCache.getPrice("unknown", "openai")).thenThrow(new NoPricingException("openai", "unknown"));

        // When / Then
        mockMvc.perform(get("/api/v1/pricing/models/openai/unknown"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.providerId").value("openai"))
            .andExpect(jsonPath("$.modelId").value("unknown"));
    }

    @Test
    void shouldDefaultToDryRunWithoutBody() throws Exception {
        // Given
        when(orchestrator.sync(any())).thenReturn(syncResult(true));

        // When
        mockMvc.perform(post("/api/v1/pricing/sync").header("X-Admin-User", "alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.dryRun").value(true))
            .andExpect(jsonPath("$.state").value("DRY_RUN_DONE"));

        // Then
        ArgumentCaptor<SyncOptions> options = ArgumentCaptor.forClass(SyncOptions.class);
        verify(orchestrator).sync(options.capture());
        assertThat(options.getValue().dryRun()).isTrue();
        assertThat(options.getValue().triggeredBy()).isEqualTo("alice");
        assertThat(options.getValue().syncType()).isEqualTo(SyncOptions.TYPE_MANUAL);
    }

    @Test
    void shouldPassApplyOptionsThrough() throws Exception {
        // Given
        when(orchestrator.sync(any())).thenReturn(syncResult(false));

        // When
        mockMvc.perform(post("/api/v1/pricing/sync")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"dryRun": false, "force": true, "autoApplyThreshold": 5, "providers": ["openai"]}
                    """))
            .andExpect(status().isOk());

        // Then
        ArgumentCaptor<SyncOptions> options = ArgumentCaptor.forClass(SyncOptions.class);
        verify(orchestrator).sync(options.capture());
        assertThat(options.getValue().dryRun()).isFalse();
        assertThat(options.getValue().force()).isTrue();
        assertThat(options.getValue().autoApplyThreshold()).isEqualByComparingTo("5");
        assertThat(options.getValue().providers()).isEqualTo(Set.of("openai"));
        assertThat(options.getValue().triggeredBy()).isEqualTo("system");
    }

    @Test
    void shouldReturnConflictWhileAnotherSyncApplies() throws Exception {
        // Given
        when(orchestrator.sync(any())).thenThrow(new SyncInProgressException("A pricing sync is already applying changes"));

        // When / Then
        mockMvc.perform(post("/api/v1/pricing/sync")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"dryRun": false}
                    """))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.title").value("Sync In Progress"));
    }

    @Test
    void shouldApproveAndRejectReviewItems() throws Exception {
        // Given
        DetectedChange change = new DetectedChange(ChangeType.NEW, "gpt-5", "openai", null, null,
            new BigDecimal("0.01"), new BigDecimal("0.04"), null, null, false, true, null, List.of());
        when(orchestrator.applyChange("item-1", "alice")).thenReturn(
            PricingChange.fromDetected(change, "alice", PricingChange.SOURCE_MANUAL, "Approved", "sync-1", NOW));
        when(orchestrator.rejectChange("item-2", "bob", "not launched"))
            .thenThrow(new PricingChangeNotFoundException("item-2", "already REJECTED"));

        // When / Then
        mockMvc.perform(post("/api/v1/pricing/reviews/item-1/approve").header("X-Admin-User", "alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.changeType").value("NEW"))
            .andExpect(jsonPath("$.changedBy").value("alice"));

        mockMvc.perform(post("/api/v1/pricing/reviews/item-2/reject")
                .header("X-Admin-User", "bob")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"reason": "not launched"}
                    """))
            .andExpect(status().isNotFound());
    }

    private static SyncResult syncResult(boolean dryRun) {
        return new SyncResult("sync-1", true, dryRun, dryRun ? SyncState.DRY_RUN_DONE : SyncState.APPLIED,
            List.of(SyncState.IDLE, SyncState.FETCHING, SyncState.DETECTING), ProviderSummary.empty(),
            ChangeSummary.empty(), ChangeSet.empty(), List.of(), List.of(), List.of(), null, Map.of(), NOW, NOW, 5);
    }
}
