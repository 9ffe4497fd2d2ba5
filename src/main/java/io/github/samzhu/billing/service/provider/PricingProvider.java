package io.github.samzhu.billing.service.provider;

import java.time.Instant;
import java.util.List;

import io.github.samzhu.billing.dto.DataFreshness;
import io.github.samzhu.billing.dto.ProviderFetchResult;

/**
 * 單一上游廠商的定價來源。
 *
 * <p>每個實作各自維護抓取失敗的狀態與退避策略，並在回傳前自行過濾不合理的報價
 * （每千 tokens 價格必須在 {@code (0, 100]} 之間）。
 *
 * <p>{@link #fetchPricing()} 不拋出例外，失敗以 {@code success = false} 的結果回傳。
 */
public interface PricingProvider {

    /**
     * 供應商 ID，與 {@code ModelPricing.providerId} 對應。
     */
    String id();

    String displayName();

    /**
     * 目前是否可以抓取（已啟用且不在退避期間）。
     */
    boolean isAvailable();

    /**
     * 抓取最新報價。
     */
    ProviderFetchResult fetchPricing();

    List<String> getSupportedModels();

    DataFreshness getDataFreshness();

    // ========== 抓取狀態 ==========

    Instant lastSuccess();

    Instant lastAttempt();

    int failureCount();

    String lastError();
}
