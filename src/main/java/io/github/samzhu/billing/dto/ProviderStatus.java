package io.github.samzhu.billing.dto;

import java.time.Instant;

import io.github.samzhu.billing.service.FetchLatencyService.LatencyStats;

/**
 * 供應商狀態快照，供管理介面與健康度計算使用。
 */
public record ProviderStatus(
    String providerId,
    String displayName,
    boolean available,
    DataFreshness freshness,
    int supportedModels,
    Instant lastSuccess,
    Instant lastAttempt,
    int failureCount,
    String lastError,
    LatencyStats fetchLatency
) {
    /**
     * 最近一次抓取是否失敗。
     */
    public boolean isFailing() {
        return failureCount > 0;
    }
}
