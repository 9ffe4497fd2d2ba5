package io.github.samzhu.billing.dto;

/**
 * 供應商價格資料的更新頻率。
 */
public enum DataFreshness {
    REALTIME,
    DAILY,
    WEEKLY,
    STATIC
}
