package io.github.samzhu.billing.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.billing.document.ModelPricing;
import io.github.samzhu.billing.document.PendingPricingChange;
import io.github.samzhu.billing.document.PricingChange;
import io.github.samzhu.billing.document.SyncLog;
import io.github.samzhu.billing.dto.HealthReport;
import io.github.samzhu.billing.dto.ProviderStatus;
import io.github.samzhu.billing.dto.SyncResult;
import io.github.samzhu.billing.dto.SyncStatus;
import io.github.samzhu.billing.dto.api.ReviewDecisionRequest;
import io.github.samzhu.billing.dto.api.SyncRequest;
import io.github.samzhu.billing.service.PricingCacheService;
import io.github.samzhu.billing.service.PricingHealthService;
import io.github.samzhu.billing.service.SyncOrchestratorService;
import io.github.samzhu.billing.service.provider.ProviderRegistry;

/**
 * 定價管理 REST API 控制器。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code GET /api/v1/pricing/models} - 生效中的定價</li>
 *   <li>{@code GET /api/v1/pricing/models/{providerId}/{modelId}} - 單一模型目前價格（經過快取）</li>
 *   <li>{@code POST /api/v1/pricing/sync} - 手動同步，預設 dry run</li>
 *   <li>{@code GET /api/v1/pricing/status} - 同步狀態與健康度</li>
 *   <li>{@code GET /api/v1/pricing/health} - 定價健康度</li>
 *   <li>{@code GET /api/v1/pricing/sync/history} - 同步紀錄</li>
 *   <li>{@code GET /api/v1/pricing/changes} - 定價變更稽核</li>
 *   <li>{@code GET /api/v1/pricing/reviews} - 待審變更</li>
 *   <li>{@code POST /api/v1/pricing/reviews/{changeId}/approve|reject} - 核准或駁回</li>
 *   <li>{@code GET /api/v1/pricing/providers} - 供應商狀態</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/pricing")
public class PricingApiController {

    private static final Logger log = LoggerFactory.getLogger(PricingApiController.class);

    private final PricingCacheService pricingCache;
    private final SyncOrchestratorService orchestrator;
    private final PricingHealthService healthService;
    private final ProviderRegistry providerRegistry;

    public PricingApiController(
            PricingCacheService pricingCache,
            SyncOrchestratorService orchestrator,
            PricingHealthService healthService,
            ProviderRegistry providerRegistry) {
        this.pricingCache = pricingCache;
        this.orchestrator = orchestrator;
        this.healthService = healthService;
        this.providerRegistry = providerRegistry;
    }

    // ========== 價格查詢 ==========

    @GetMapping("/models")
    public ResponseEntity<List<ModelPricing>> listActive() {
        return ResponseEntity.ok(pricingCache.listActive());
    }

    @GetMapping("/models/{providerId}/{modelId}")
    public ResponseEntity<ModelPricing> getPrice(@PathVariable String providerId, @PathVariable String modelId) {
        return ResponseEntity.ok(pricingCache.getPrice(modelId, providerId));
    }

    // ========== 同步 ==========

    /**
     * 手動觸發同步。
     *
     * @param request 同步選項，未提供時為 dry run
     * @param triggeredBy 管理員（從 header 取得）
     */
    @PostMapping("/sync")
    public ResponseEntity<SyncResult> sync(
            @RequestBody(required = false) @Validated SyncRequest request,
            @RequestHeader(value = "X-Admin-User", defaultValue = "system") String triggeredBy) {

        SyncRequest body = request != null ? request : new SyncRequest(true, false, null, null, null);
        log.info("API request: pricing sync dryRun={}, force={}, providers={}, triggeredBy={}",
            body.dryRun(), body.force(), body.providers(), triggeredBy);

        return ResponseEntity.ok(orchestrator.sync(body.toOptions(triggeredBy)));
    }

    @GetMapping("/status")
    public ResponseEntity<SyncStatus> getStatus() {
        return ResponseEntity.ok(orchestrator.getStatus());
    }

    @GetMapping("/health")
    public ResponseEntity<HealthReport> getHealth() {
        return ResponseEntity.ok(healthService.evaluate());
    }

    @GetMapping("/sync/history")
    public ResponseEntity<Page<SyncLog>> getSyncHistory(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(orchestrator.getSyncHistory(PageRequest.of(page, size)));
    }

    @GetMapping("/changes")
    public ResponseEntity<Page<PricingChange>> getChangeHistory(
            @RequestParam(required = false) String providerId,
            @RequestParam(required = false) String modelId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(orchestrator.getChangeHistory(providerId, modelId, PageRequest.of(page, size)));
    }

    // ========== 人工審核 ==========

    @GetMapping("/reviews")
    public ResponseEntity<List<PendingPricingChange>> getPendingReviews() {
        return ResponseEntity.ok(orchestrator.getPendingReviews());
    }

    @PostMapping("/reviews/{changeId}/approve")
    public ResponseEntity<PricingChange> approve(
            @PathVariable String changeId,
            @RequestHeader(value = "X-Admin-User", defaultValue = "system") String approvedBy) {
        log.info("API request: approve pricing change id={}, approvedBy={}", changeId, approvedBy);
        return ResponseEntity.ok(orchestrator.applyChange(changeId, approvedBy));
    }

    @PostMapping("/reviews/{changeId}/reject")
    public ResponseEntity<PendingPricingChange> reject(
            @PathVariable String changeId,
            @RequestBody(required = false) ReviewDecisionRequest request,
            @RequestHeader(value = "X-Admin-User", defaultValue = "system") String rejectedBy) {
        String reason = request != null ? request.reason() : null;
        log.info("API request: reject pricing change id={}, rejectedBy={}, reason={}", changeId, rejectedBy, reason);
        return ResponseEntity.ok(orchestrator.rejectChange(changeId, rejectedBy, reason));
    }

    // ========== 供應商 ==========

    @GetMapping("/providers")
    public ResponseEntity<List<ProviderStatus>> getProviders() {
        return ResponseEntity.ok(providerRegistry.getStats());
    }
}
