package io.github.samzhu.billing.dto;

import java.util.List;

/**
 * 定價系統健康報告。
 *
 * @param healthScore 0-100 的健康分數
 * @param status 健康狀態
 * @param issues 扣分原因
 * @param totalModels 生效中的模型數
 * @param staleModels 超過驗證期限的模型數
 * @param failingProviders 最近一次抓取失敗的供應商數
 * @param pendingReviews 待審變更數
 * @param overdueReviews 超過審核期限的待審變更數
 */
public record HealthReport(
    int healthScore,
    HealthStatus status,
    List<String> issues,
    int totalModels,
    int staleModels,
    int failingProviders,
    int pendingReviews,
    int overdueReviews
) {
    public HealthReport {
        issues = List.copyOf(issues);
    }
}
