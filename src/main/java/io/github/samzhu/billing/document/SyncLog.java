package io.github.samzhu.billing.document;

import java.time.Instant;
import java.util.Map;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 定價同步執行紀錄文件。
 *
 * <p>每次非 dry run 的同步結束時寫入一筆，供狀態查詢與排程判斷最小間隔使用。
 */
@Document(collection = "sync_logs")
public record SyncLog(
    @Id String id,

    // ========== 基本識別 ==========
    @Indexed(unique = true) String syncId,
    /** {@code scheduled} 或 {@code manual} */
    String syncType,
    String triggeredBy,
    boolean success,

    // ========== 統計 ==========
    int providersTotal,
    int providersSucceeded,
    int changesDetected,
    int changesApplied,
    int changesQueued,
    int changesFailed,
    long durationMs,

    // ========== 錯誤與附加資訊 ==========
    String errorMessage,
    Map<String, Object> metadata,

    // ========== 時間戳記 ==========
    Instant startedAt,
    @Indexed Instant completedAt
) {
}
