package io.github.samzhu.billing.document;

/**
 * 用量紀錄狀態。
 */
public enum UsageStatus {
    /** 已扣款且紀錄完整 */
    COMPLETED,
    /** 已扣款但原始紀錄寫入失敗，需要人工對帳 */
    RECONCILIATION_PENDING
}
