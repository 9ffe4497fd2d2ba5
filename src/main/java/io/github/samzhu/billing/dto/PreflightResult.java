package io.github.samzhu.billing.dto;

import java.math.BigDecimal;

/**
 * 對話開始前的餘額預檢結果。
 *
 * @param allowed 餘額是否達到最低下限
 * @param balance 目前餘額
 * @param minimumBalance 最低下限
 * @param currency 幣別
 */
public record PreflightResult(
    boolean allowed,
    BigDecimal balance,
    BigDecimal minimumBalance,
    String currency
) {
}
