package io.github.samzhu.billing.dto;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

/**
 * 同步選項。
 *
 * @param dryRun 只預覽，不寫入任何定價
 * @param force 一併套用通過驗證但超過門檻的新增/變更（下架永遠不會自動套用），並略過排程最小間隔
 * @param autoApplyThreshold 自動套用門檻（百分比），null 時使用組態預設值
 * @param providers 只同步指定的供應商，null 或空集合表示全部
 * @param metadata 附加資訊，會寫入同步紀錄
 * @param triggeredBy 觸發者
 * @param syncType {@code manual} 或 {@code scheduled}
 */
public record SyncOptions(
    boolean dryRun,
    boolean force,
    BigDecimal autoApplyThreshold,
    Set<String> providers,
    Map<String, Object> metadata,
    String triggeredBy,
    String syncType
) {
    public static final String TYPE_MANUAL = "manual";
    public static final String TYPE_SCHEDULED = "scheduled";

    public SyncOptions {
        providers = providers != null ? Set.copyOf(providers) : Set.of();
        metadata = metadata != null ? metadata : Map.of();
        if (triggeredBy == null || triggeredBy.isBlank()) {
            triggeredBy = "system";
        }
        if (syncType == null || syncType.isBlank()) {
            syncType = TYPE_MANUAL;
        }
    }

    public static SyncOptions preview() {
        return new SyncOptions(true, false, null, null, null, "system", TYPE_MANUAL);
    }

    public static SyncOptions apply() {
        return new SyncOptions(false, false, null, null, null, "system", TYPE_MANUAL);
    }

    public static SyncOptions scheduled() {
        return new SyncOptions(false, false, null, null, null, "scheduler", TYPE_SCHEDULED);
    }
}
