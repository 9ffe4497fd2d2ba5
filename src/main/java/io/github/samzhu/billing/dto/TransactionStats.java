package io.github.samzhu.billing.dto;

import java.math.BigDecimal;

/**
 * 用戶交易統計（依類型加總）。
 */
public record TransactionStats(
    String userId,
    String currency,
    BigDecimal totalDeposits,
    BigDecimal totalUsage,
    BigDecimal totalRefunds,
    BigDecimal totalAdjustmentCredits,
    BigDecimal totalAdjustmentDebits,
    long transactionCount
) {
    /**
     * 淨額 = 入帳 + 退款 + 調整入帳 - 用量 - 調整扣款。
     */
    public BigDecimal net() {
        return totalDeposits.add(totalRefunds).add(totalAdjustmentCredits)
            .subtract(totalUsage).subtract(totalAdjustmentDebits);
    }
}
