package io.github.samzhu.billing.dto;

import java.util.List;

import io.github.samzhu.billing.document.SyncLog;

/**
 * 定價同步狀態（管理介面的狀態頁）。
 *
 * @param currentState 套用流程目前的狀態
 * @param applying 是否有套用流程正在執行
 * @param lastSync 最近一次同步紀錄，可為 null
 * @param lastSuccessfulSync 最近一次成功的同步紀錄，可為 null
 * @param activeModels 生效中的模型數
 * @param pendingReviews 待審變更數
 * @param providers 各供應商狀態
 * @param health 健康報告
 */
public record SyncStatus(
    SyncState currentState,
    boolean applying,
    SyncLog lastSync,
    SyncLog lastSuccessfulSync,
    int activeModels,
    long pendingReviews,
    List<ProviderStatus> providers,
    HealthReport health
) {
}
