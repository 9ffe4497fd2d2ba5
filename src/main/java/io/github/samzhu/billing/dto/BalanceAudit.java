package io.github.samzhu.billing.dto;

import java.math.BigDecimal;

/**
 * 帳本重播稽核結果。
 *
 * @param userId 用戶 ID
 * @param storedBalance 目前儲存的餘額
 * @param replayedBalance 依交易歷史重算的餘額
 * @param transactionCount 交易筆數
 * @param consistent 兩者一致且交易鏈沒有斷點
 * @param firstBrokenSequence 第一筆 balanceBefore 與前一筆 balanceAfter 不符的 sequence，沒有則為 null
 */
public record BalanceAudit(
    String userId,
    BigDecimal storedBalance,
    BigDecimal replayedBalance,
    long transactionCount,
    boolean consistent,
    Long firstBrokenSequence
) {
}
