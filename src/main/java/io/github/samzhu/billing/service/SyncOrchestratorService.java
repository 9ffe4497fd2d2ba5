package io.github.samzhu.billing.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.document.ChangeType;
import io.github.samzhu.billing.document.ModelPricing;
import io.github.samzhu.billing.document.PendingPricingChange;
import io.github.samzhu.billing.document.PricingChange;
import io.github.samzhu.billing.document.ReviewStatus;
import io.github.samzhu.billing.document.SyncLog;
import io.github.samzhu.billing.dto.AggregatedPricing;
import io.github.samzhu.billing.dto.ChangeSet;
import io.github.samzhu.billing.dto.DetectedChange;
import io.github.samzhu.billing.dto.HealthReport;
import io.github.samzhu.billing.dto.PriceQuote;
import io.github.samzhu.billing.dto.ProviderFetchResult;
import io.github.samzhu.billing.dto.SyncOptions;
import io.github.samzhu.billing.dto.SyncResult;
import io.github.samzhu.billing.dto.SyncResult.ChangeSummary;
import io.github.samzhu.billing.dto.SyncResult.ProviderSummary;
import io.github.samzhu.billing.dto.SyncState;
import io.github.samzhu.billing.dto.SyncStatus;
import io.github.samzhu.billing.exception.SyncInProgressException;
import io.github.samzhu.billing.repository.ModelPricingRepository;
import io.github.samzhu.billing.repository.PricingChangeRepository;
import io.github.samzhu.billing.repository.SyncLogRepository;
import io.github.samzhu.billing.service.alert.AlertService;
import io.github.samzhu.billing.service.provider.PricingProvider;
import io.github.samzhu.billing.service.provider.ProviderRegistry;

/**
 * 定價同步協調服務。
 *
 * <p>狀態機：
 * <pre>
 * IDLE → FETCHING → DETECTING → DRY_RUN_DONE → IDLE
 *                            └→ APPLYING → APPLIED → IDLE
 * 任何執行中狀態 → FAILED → IDLE
 * </pre>
 *
 * <p>執行規則：
 * <ul>
 *   <li>dry run 只抓取與比對，不寫入任何資料、不使快取失效，可同時執行多個</li>
 *   <li>非 dry run 同時只允許一個，另一個會收到 {@link SyncInProgressException}</li>
 *   <li>每筆變更在同一個 Mongo 交易內更新 {@code model_pricing} 並寫入 {@code pricing_changes}</li>
 *   <li>下架偵測只比對本次成功抓取的供應商，抓取失敗的供應商不會被判定為下架</li>
 *   <li>沒有任何供應商成功時同步失敗；套用失敗時中止，已套用的變更保留</li>
 * </ul>
 */
@Service
public class SyncOrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestratorService.class);

    static final String DRY_RUN_WARNING = "Dry run mode - no changes were applied";

    private final ProviderRegistry providerRegistry;
    private final ProviderAggregatorService aggregator;
    private final ChangeDetectorService changeDetector;
    private final PricingCacheService pricingCache;
    private final PricingReviewQueueService reviewQueue;
    private final PricingHealthService healthService;
    private final AlertService alertService;
    private final ModelPricingRepository modelPricingRepository;
    private final PricingChangeRepository pricingChangeRepository;
    private final SyncLogRepository syncLogRepository;
    private final TransactionTemplate transactionTemplate;
    private final BigDecimal defaultThreshold;
    private final Clock clock;

    private final ReentrantLock applyLock = new ReentrantLock();
    private volatile SyncState applyState = SyncState.IDLE;

    public SyncOrchestratorService(
            ProviderRegistry providerRegistry,
            ProviderAggregatorService aggregator,
            ChangeDetectorService changeDetector,
            PricingCacheService pricingCache,
            PricingReviewQueueService reviewQueue,
            PricingHealthService healthService,
            AlertService alertService,
            ModelPricingRepository modelPricingRepository,
            PricingChangeRepository pricingChangeRepository,
            SyncLogRepository syncLogRepository,
            TransactionTemplate transactionTemplate,
            BillingProperties properties,
            Clock clock) {
        this.providerRegistry = providerRegistry;
        this.aggregator = aggregator;
        this.changeDetector = changeDetector;
        this.pricingCache = pricingCache;
        this.reviewQueue = reviewQueue;
        this.healthService = healthService;
        this.alertService = alertService;
        this.modelPricingRepository = modelPricingRepository;
        this.pricingChangeRepository = pricingChangeRepository;
        this.syncLogRepository = syncLogRepository;
        this.transactionTemplate = transactionTemplate;
        this.defaultThreshold = properties.sync().autoApplyThreshold();
        this.clock = clock;
    }

    // ========== 同步 ==========

    /**
     * 執行一次定價同步。
     *
     * @param options 同步選項
     * @return 同步結果（失敗也以結果回傳）
     * @throws SyncInProgressException 若非 dry run 且已有另一個套用流程執行中
     */
    public SyncResult sync(SyncOptions options) {
        if (options.dryRun()) {
            return execute(options);
        }
        if (!applyLock.tryLock()) {
            throw new SyncInProgressException("A pricing sync is already applying changes");
        }
        try {
            return execute(options);
        } finally {
            applyLock.unlock();
        }
    }

    private SyncResult execute(SyncOptions options) {
        Run run = new Run(options, clock.instant());
        log.info("Pricing sync started: syncId={}, type={}, dryRun={}, force={}, triggeredBy={}",
            run.syncId, options.syncType(), options.dryRun(), options.force(), options.triggeredBy());

        try {
            return runPipeline(run);
        } catch (DataAccessException e) {
            if (!run.state.canTransitionTo(SyncState.FAILED)) {
                throw e;
            }
            log.error("Pricing sync aborted by storage error: syncId={}, error={}", run.syncId, e.getMessage());
            run.errors.add("Storage error: " + e.getMessage());
            run.transition(SyncState.FAILED);
            return finish(run);
        }
    }

    private SyncResult runPipeline(Run run) {
        SyncOptions options = run.options;
        BigDecimal threshold = options.autoApplyThreshold() != null ? options.autoApplyThreshold() : defaultThreshold;

        // 1. 抓取
        run.transition(SyncState.FETCHING);
        List<PricingProvider> providers = selectProviders(options, run.warnings);
        if (providers.isEmpty()) {
            run.errors.add("No pricing providers available");
            run.transition(SyncState.FAILED);
            return finish(run);
        }

        AggregatedPricing aggregated = aggregator.fetchAll(providers);
        run.providerResults = aggregated.perProviderResult();
        for (ProviderFetchResult result : aggregated.perProviderResult().values()) {
            if (!result.success()) {
                run.errors.add("Provider " + result.providerId() + ": " + String.join("; ", result.errors()));
            } else if (!result.errors().isEmpty()) {
                run.warnings.add("Provider " + result.providerId() + " dropped " + result.errors().size() + " quotes");
            }
        }
        Set<String> succeeded = aggregated.successfulProviders();
        if (succeeded.isEmpty()) {
            run.errors.add("All pricing providers failed");
            run.transition(SyncState.FAILED);
            return finish(run);
        }

        // 2. 比對
        run.transition(SyncState.DETECTING);
        List<ModelPricing> current = modelPricingRepository.findByActiveTrue().stream()
            .filter(p -> succeeded.contains(p.providerId()))
            .toList();
        run.changeSet = changeDetector.detectChanges(aggregated.quotes(), current, threshold);
        log.info("Pricing changes detected: syncId={}, {}", run.syncId, run.changeSet.summary());

        if (options.dryRun()) {
            run.warnings.add(DRY_RUN_WARNING);
            run.transition(SyncState.DRY_RUN_DONE);
            return finish(run);
        }

        // 3. 套用
        run.transition(SyncState.APPLYING);
        Map<String, String> quoteSources = aggregated.quotes().stream()
            .collect(Collectors.toMap(PriceQuote::key, PriceQuote::source, (a, b) -> a));

        for (DetectedChange change : changesToApply(run.changeSet, options.force())) {
            boolean forced = !change.autoApplicable();
            String changedBy = forced ? options.triggeredBy() : PricingChange.SOURCE_AUTO_SYNC;
            String source = forced ? PricingChange.SOURCE_FORCE_SYNC : PricingChange.SOURCE_AUTO_SYNC;
            String reason = forced
                ? "Force-applied by " + options.triggeredBy() + ": " + String.join("; ", change.reviewReasons())
                : "Auto-applied within threshold " + threshold.toPlainString() + "%";
            try {
                run.applied.add(applyDetected(change, changedBy, source, reason, run.syncId,
                    quoteSources.getOrDefault(change.key(), source), null));
            } catch (DataAccessException | TransactionException e) {
                run.failedChanges++;
                run.errors.add("Failed to apply " + change.key() + ": " + e.getMessage());
                log.error("Pricing apply failed, aborting sync: syncId={}, key={}, error={}",
                    run.syncId, change.key(), e.getMessage());
                run.transition(SyncState.FAILED);
                return finish(run);
            }
        }

        markVerified(run.changeSet.unchanged());

        Set<String> appliedKeys = new HashSet<>();
        run.applied.forEach(c -> appliedKeys.add(ModelPricing.key(c.providerId(), c.modelId())));
        List<DetectedChange> reviewItems = run.changeSet.requiresReview().stream()
            .filter(c -> !appliedKeys.contains(c.key()))
            .toList();
        run.queued = reviewQueue.enqueue(reviewItems, succeeded, run.syncId);

        run.transition(SyncState.APPLIED);
        return finish(run);
    }

    /**
     * 非 dry run 只會套用可自動套用的變更；{@code force} 時另外套用通過驗證的新增與變價，下架永遠需要人工核准。
     */
    private static List<DetectedChange> changesToApply(ChangeSet changeSet, boolean force) {
        List<DetectedChange> toApply = new ArrayList<>(changeSet.autoApplicable());
        if (force) {
            for (DetectedChange change : changeSet.requiresReview()) {
                if (change.changeType() != ChangeType.REMOVED && change.isValid()) {
                    toApply.add(change);
                }
            }
        }
        return toApply;
    }

    private List<PricingProvider> selectProviders(SyncOptions options, List<String> warnings) {
        Set<String> requested = options.providers();
        for (String id : requested) {
            if (providerRegistry.get(id).isEmpty()) {
                warnings.add("Unknown provider: " + id);
            }
        }

        List<PricingProvider> selected = new ArrayList<>();
        for (PricingProvider provider : providerRegistry.getAll()) {
            if (!requested.isEmpty() && !requested.contains(provider.id())) {
                continue;
            }
            if (!provider.isAvailable()) {
                warnings.add("Provider " + provider.id() + " skipped: unavailable or backing off");
                continue;
            }
            selected.add(provider);
        }
        return selected;
    }

    private void markVerified(List<DetectedChange> unchanged) {
        if (unchanged.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        Map<String, List<String>> byProvider = new HashMap<>();
        for (DetectedChange change : unchanged) {
            byProvider.computeIfAbsent(change.providerId(), k -> new ArrayList<>()).add(change.modelId());
        }
        byProvider.forEach((providerId, modelIds) -> {
            long updated = modelPricingRepository.markVerified(providerId, modelIds, now);
            log.debug("Pricing verified: provider={}, models={}", providerId, updated);
        });
    }

    private SyncResult finish(Run run) {
        Instant completedAt = clock.instant();
        long durationMs = Duration.between(run.startedAt, completedAt).toMillis();
        SyncState finalState = run.state;
        boolean success = finalState != SyncState.FAILED;

        ChangeSet changeSet = run.changeSet != null ? run.changeSet : ChangeSet.empty();
        int total = changeSet.totalChanges();
        int applied = run.applied.size();
        ChangeSummary changes = new ChangeSummary(total, applied, Math.max(0, total - applied - run.failedChanges),
            run.failedChanges, changeSet.newModels(), changeSet.updatedModels(), changeSet.removedModels(),
            changeSet.unchangedModels());

        int succeeded = (int) run.providerResults.values().stream().filter(ProviderFetchResult::success).count();
        ProviderSummary providers = new ProviderSummary(run.providerResults.size(), succeeded,
            run.providerResults.size() - succeeded, run.providerResults);

        HealthReport health = healthService.evaluate();

        SyncResult result = new SyncResult(run.syncId, success, run.options.dryRun(), finalState,
            List.copyOf(run.history), providers, changes, changeSet, List.copyOf(run.applied),
            List.copyOf(run.errors), List.copyOf(run.warnings), health, run.options.metadata(),
            run.startedAt, completedAt, durationMs);

        if (!run.options.dryRun()) {
            syncLogRepository.save(new SyncLog(null, run.syncId, run.options.syncType(), run.options.triggeredBy(),
                success, providers.total(), providers.successful(), total, applied, run.queued, run.failedChanges,
                durationMs, run.errors.isEmpty() ? null : String.join("; ", run.errors),
                run.options.metadata(), run.startedAt, completedAt));
            alertService.notify(result);
        }

        run.transition(SyncState.IDLE);
        log.info("Pricing sync finished: syncId={}, state={}, success={}, applied={}, queued={}, errors={}, durationMs={}",
            run.syncId, finalState, success, applied, run.queued, run.errors.size(), durationMs);
        return result;
    }

    // ========== 人工審核 ==========

    /**
     * 核准並套用一筆待審變更。
     *
     * <p>NEW/UPDATED 寫入新價格，REMOVED 將定價下架；稽核紀錄的來源為 {@code manual}。
     *
     * @param changeId 待審項目 ID
     * @param approvedBy 核准者
     * @return 稽核紀錄
     * @throws io.github.samzhu.billing.exception.PricingChangeNotFoundException 若項目不存在或已處理
     * @throws SyncInProgressException 若同步正在套用變更
     */
    public PricingChange applyChange(String changeId, String approvedBy) {
        if (!applyLock.tryLock()) {
            throw new SyncInProgressException("A pricing sync is applying changes, retry later");
        }
        try {
            PendingPricingChange item = reviewQueue.getPendingItem(changeId);
            PricingChange applied = applyDetected(item.toDetectedChange(), approvedBy, PricingChange.SOURCE_MANUAL,
                "Approved pending change " + changeId, item.syncId(), PricingChange.SOURCE_MANUAL, item);
            log.info("Pending pricing change approved: id={}, key={}, type={}, approvedBy={}",
                changeId, item.key(), item.changeType(), approvedBy);
            return applied;
        } finally {
            applyLock.unlock();
        }
    }

    /**
     * 駁回一筆待審變更，不修改定價。
     */
    public PendingPricingChange rejectChange(String changeId, String rejectedBy, String reason) {
        PendingPricingChange item = reviewQueue.getPendingItem(changeId);
        return reviewQueue.resolve(item, ReviewStatus.REJECTED, rejectedBy, reason);
    }

    /**
     * 在單一交易內寫入定價與稽核紀錄，成功後使快取失效。
     *
     * @param approvedItem 一併標記為已核准的待審項目，可為 null
     */
    private PricingChange applyDetected(DetectedChange change, String changedBy, String changeSource,
            String reason, String syncId, String pricingSource, PendingPricingChange approvedItem) {
        PricingChange audit = transactionTemplate.execute(status -> {
            Instant now = clock.instant();
            var existing = modelPricingRepository.findByProviderIdAndModelId(change.providerId(), change.modelId());
            switch (change.changeType()) {
                case NEW, UPDATED -> modelPricingRepository.save(existing
                    .map(row -> row.withPrices(change.newInputPrice(), change.newOutputPrice(), pricingSource, now))
                    .orElseGet(() -> ModelPricing.create(change.modelId(), change.providerId(),
                        change.newInputPrice(), change.newOutputPrice(), pricingSource, now)));
                case REMOVED -> existing
                    .filter(ModelPricing::active)
                    .ifPresent(row -> modelPricingRepository.save(row.deactivate(now)));
                case UNCHANGED -> throw new IllegalArgumentException("Unchanged pricing cannot be applied: " + change.key());
            }
            if (approvedItem != null) {
                reviewQueue.resolve(approvedItem, ReviewStatus.APPROVED, changedBy, null);
            }
            return pricingChangeRepository.save(
                PricingChange.fromDetected(change, changedBy, changeSource, reason, syncId, now));
        });
        pricingCache.invalidate(change.modelId(), change.providerId());
        log.info("Pricing {} applied: key={}, input {} -> {}, output {} -> {}, source={}",
            change.changeType(), change.key(), change.oldInputPrice(), change.newInputPrice(),
            change.oldOutputPrice(), change.newOutputPrice(), changeSource);
        return audit;
    }

    // ========== 查詢 ==========

    public SyncState currentState() {
        return applyState;
    }

    public SyncStatus getStatus() {
        return new SyncStatus(
            applyState,
            applyLock.isLocked(),
            syncLogRepository.findFirstByOrderByCompletedAtDesc().orElse(null),
            syncLogRepository.findFirstBySuccessTrueOrderByCompletedAtDesc().orElse(null),
            modelPricingRepository.findByActiveTrue().size(),
            reviewQueue.countPending(),
            providerRegistry.getStats(),
            healthService.evaluate()
        );
    }

    /**
     * 查詢定價變更歷史，可依供應商與模型篩選。
     */
    public Page<PricingChange> getChangeHistory(String providerId, String modelId, Pageable pageable) {
        if (providerId != null && modelId != null) {
            return pricingChangeRepository.findByProviderIdAndModelIdOrderByCreatedAtDesc(providerId, modelId, pageable);
        }
        if (providerId != null) {
            return pricingChangeRepository.findByProviderIdOrderByCreatedAtDesc(providerId, pageable);
        }
        if (modelId != null) {
            return pricingChangeRepository.findByModelIdOrderByCreatedAtDesc(modelId, pageable);
        }
        return pricingChangeRepository.findAllByOrderByCreatedAtDesc(pageable);
    }

    public Page<SyncLog> getSyncHistory(Pageable pageable) {
        return syncLogRepository.findAllByOrderByCompletedAtDesc(pageable);
    }

    public List<PendingPricingChange> getPendingReviews() {
        return reviewQueue.getPending();
    }

    // ========== 單次執行的狀態 ==========

    private final class Run {
        final String syncId = UUID.randomUUID().toString();
        final SyncOptions options;
        final Instant startedAt;
        final List<SyncState> history = new ArrayList<>();
        final List<String> errors = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();
        final List<PricingChange> applied = new ArrayList<>();
        Map<String, ProviderFetchResult> providerResults = new LinkedHashMap<>();
        ChangeSet changeSet;
        int failedChanges;
        int queued;
        SyncState state = SyncState.IDLE;

        Run(SyncOptions options, Instant startedAt) {
            this.options = options;
            this.startedAt = startedAt;
            history.add(state);
        }

        void transition(SyncState next) {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("Invalid sync state transition: " + state + " -> " + next);
            }
            state = next;
            if (next != SyncState.IDLE) {
                history.add(next);
            }
            if (!options.dryRun()) {
                applyState = next;
            }
        }
    }
}
