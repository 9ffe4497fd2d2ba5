package io.github.samzhu.billing.dto.api;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

import jakarta.validation.constraints.PositiveOrZero;

import io.github.samzhu.billing.dto.SyncOptions;

/**
 * 手動同步請求。
 *
 * <p>用於 POST /api/v1/pricing/sync 端點；未提供 body 時為 dry run。
 */
public record SyncRequest(
    Boolean dryRun,

    boolean force,

    @PositiveOrZero(message = "autoApplyThreshold must be positive or zero")
    BigDecimal autoApplyThreshold,

    Set<String> providers,

    Map<String, Object> metadata
) {

    /**
     * 轉換為同步選項，{@code dryRun} 未指定時預設為 true。
     */
    public SyncOptions toOptions(String triggeredBy) {
        return new SyncOptions(dryRun == null || dryRun, force, autoApplyThreshold, providers, metadata,
            triggeredBy, SyncOptions.TYPE_MANUAL);
    }
}
