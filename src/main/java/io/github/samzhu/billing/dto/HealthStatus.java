package io.github.samzhu.billing.dto;

/**
 * 定價系統整體健康狀態。
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    CRITICAL;

    /**
     * 依健康分數判斷狀態：80 以上為 HEALTHY，50 以上為 DEGRADED，其餘為 CRITICAL。
     */
    public static HealthStatus fromScore(int score) {
        if (score >= 80) {
            return HEALTHY;
        }
        if (score >= 50) {
            return DEGRADED;
        }
        return CRITICAL;
    }
}
