package io.github.samzhu.billing.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import io.github.samzhu.billing.document.PricingChange;

/**
 * 同步執行結果。
 *
 * @param syncId 同步 ID
 * @param success 是否成功（至少一個供應商成功且套用過程沒有中止）
 * @param dryRun 是否為預覽
 * @param state 最終狀態
 * @param stateHistory 經過的狀態
 * @param providers 供應商統計
 * @param changes 變更統計
 * @param changeSet 變更偵測結果（預覽內容）
 * @param appliedChanges 實際寫入的稽核紀錄
 * @param errors 錯誤訊息
 * @param warnings 警告訊息
 * @param health 同步完成時的健康報告
 * @param metadata 附加資訊
 * @param startedAt 開始時間
 * @param completedAt 結束時間
 * @param durationMs 耗時（毫秒）
 */
public record SyncResult(
    String syncId,
    boolean success,
    boolean dryRun,
    SyncState state,
    List<SyncState> stateHistory,
    ProviderSummary providers,
    ChangeSummary changes,
    ChangeSet changeSet,
    List<PricingChange> appliedChanges,
    List<String> errors,
    List<String> warnings,
    HealthReport health,
    Map<String, Object> metadata,
    Instant startedAt,
    Instant completedAt,
    long durationMs
) {

    /**
     * 供應商統計。
     *
     * @param total 參與同步的供應商數
     * @param successful 成功數
     * @param failed 失敗數
     * @param results 每個供應商的抓取結果
     */
    public record ProviderSummary(
        int total,
        int successful,
        int failed,
        Map<String, ProviderFetchResult> results
    ) {
        public static ProviderSummary empty() {
            return new ProviderSummary(0, 0, 0, Map.of());
        }
    }

    /**
     * 變更統計。
     *
     * @param total 偵測到的變更數（不含 unchanged）
     * @param applied 已套用
     * @param skipped 未套用（待審或 dry run）
     * @param failed 套用失敗
     * @param newModels 新模型數
     * @param updatedModels 價格變動數
     * @param removedModels 下架數
     * @param unchangedModels 不變數
     */
    public record ChangeSummary(
        int total,
        int applied,
        int skipped,
        int failed,
        int newModels,
        int updatedModels,
        int removedModels,
        int unchangedModels
    ) {
        public static ChangeSummary empty() {
            return new ChangeSummary(0, 0, 0, 0, 0, 0, 0, 0);
        }
    }
}
