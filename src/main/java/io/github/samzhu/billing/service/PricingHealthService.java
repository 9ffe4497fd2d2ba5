package io.github.samzhu.billing.service;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.config.BillingProperties.SyncConfig;
import io.github.samzhu.billing.document.ModelPricing;
import io.github.samzhu.billing.dto.HealthReport;
import io.github.samzhu.billing.dto.HealthStatus;
import io.github.samzhu.billing.dto.ProviderStatus;
import io.github.samzhu.billing.repository.ModelPricingRepository;
import io.github.samzhu.billing.service.alert.AlertService;
import io.github.samzhu.billing.service.provider.ProviderRegistry;

/**
 * 定價系統健康度計算。
 *
 * <p>從 100 分開始扣分：
 * <pre>
 * 沒有任何生效定價                 -50
 * 過期模型超過 20%                 -20
 * 有供應商最近一次抓取失敗         -15（全部失敗 -30）
 * 有待審變更超過審核期限           -15
 * 沒有設定外部告警通道             -10
 * </pre>
 * 分數限制在 0 到 100，80 以上為 HEALTHY，50 以上為 DEGRADED，其餘為 CRITICAL。
 */
@Service
public class PricingHealthService {

    private static final Logger log = LoggerFactory.getLogger(PricingHealthService.class);

    private final ModelPricingRepository modelPricingRepository;
    private final ProviderRegistry providerRegistry;
    private final PricingReviewQueueService reviewQueue;
    private final PricingValidator validator;
    private final AlertService alertService;
    private final SyncConfig config;

    public PricingHealthService(
            ModelPricingRepository modelPricingRepository,
            ProviderRegistry providerRegistry,
            PricingReviewQueueService reviewQueue,
            PricingValidator validator,
            AlertService alertService,
            BillingProperties properties) {
        this.modelPricingRepository = modelPricingRepository;
        this.providerRegistry = providerRegistry;
        this.reviewQueue = reviewQueue;
        this.validator = validator;
        this.alertService = alertService;
        this.config = properties.sync();
    }

    public HealthReport evaluate() {
        List<ModelPricing> active = modelPricingRepository.findByActiveTrue();
        int staleModels = (int) active.stream()
            .filter(p -> validator.isStale(p.lastVerifiedAt(), config.staleAfter()))
            .count();
        List<ProviderStatus> providers = providerRegistry.getStats();
        int failingProviders = (int) providers.stream().filter(ProviderStatus::isFailing).count();
        int pendingReviews = (int) reviewQueue.countPending();
        int overdueReviews = (int) reviewQueue.countOverdue(config.reviewStaleAfter());

        int score = 100;
        List<String> issues = new ArrayList<>();

        if (active.isEmpty()) {
            score -= 50;
            issues.add("No active model pricing");
        } else if (staleModels * 100 > active.size() * 20) {
            score -= 20;
            issues.add(String.format("%d of %d models not verified for more than %d days",
                staleModels, active.size(), config.staleAfter().toDays()));
        }

        if (!providers.isEmpty() && failingProviders == providers.size()) {
            score -= 30;
            issues.add("All pricing providers are failing");
        } else if (failingProviders > 0) {
            score -= 15;
            issues.add(String.format("%d of %d pricing providers are failing", failingProviders, providers.size()));
        }

        if (overdueReviews > 0) {
            score -= 15;
            issues.add(String.format("%d pricing changes awaiting review for more than %d hours",
                overdueReviews, config.reviewStaleAfter().toHours()));
        }

        if (!alertService.hasExternalChannel()) {
            score -= 10;
            issues.add("No external alert channel configured");
        }

        score = Math.max(0, Math.min(100, score));
        HealthStatus status = HealthStatus.fromScore(score);
        log.debug("Pricing health evaluated: score={}, status={}, issues={}", score, status, issues.size());

        return new HealthReport(score, status, issues, active.size(), staleModels,
            failingProviders, pendingReviews, overdueReviews);
    }
}
