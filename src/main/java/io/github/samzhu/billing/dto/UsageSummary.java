package io.github.samzhu.billing.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * 用戶用量摘要。
 *
 * @param userId 用戶 ID
 * @param from 查詢起始時間（含）
 * @param to 查詢結束時間（不含）
 * @param requestCount 請求數
 * @param inputTokens 輸入 tokens
 * @param outputTokens 輸出 tokens
 * @param totalTokens 總 tokens
 * @param totalCost 總成本
 * @param byModel 依模型細分，依成本由高到低
 */
public record UsageSummary(
    String userId,
    Instant from,
    Instant to,
    long requestCount,
    long inputTokens,
    long outputTokens,
    long totalTokens,
    BigDecimal totalCost,
    List<ModelUsage> byModel
) {

    /**
     * 單一模型的用量。
     */
    public record ModelUsage(
        String providerId,
        String modelId,
        long requestCount,
        long totalTokens,
        BigDecimal totalCost
    ) {}
}
