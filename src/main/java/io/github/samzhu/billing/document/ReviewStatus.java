package io.github.samzhu.billing.document;

/**
 * 待審定價變更的處理狀態。
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED,
    /** 後續同步偵測到不同的價格，或已不再需要審核 */
    SUPERSEDED
}
