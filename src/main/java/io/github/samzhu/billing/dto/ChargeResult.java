package io.github.samzhu.billing.dto;

import java.math.BigDecimal;

import io.github.samzhu.billing.document.UsageRecord;
import io.github.samzhu.billing.document.UsageStatus;

/**
 * 計費結果。
 *
 * <p>{@code status = RECONCILIATION_PENDING} 仍代表扣款成功，只是用量紀錄需要人工對帳，
 * 不應回報給終端用戶為錯誤。
 *
 * @param cost 本次成本 (USD)
 * @param usageRecordId 用量紀錄 ID，紀錄完全無法寫入時為 null
 * @param transactionId 扣款交易 ID
 * @param status 用量紀錄狀態
 * @param replayed 是否為同一 requestId 的重複呼叫
 */
public record ChargeResult(
    BigDecimal cost,
    String usageRecordId,
    String transactionId,
    UsageStatus status,
    boolean replayed
) {
    public static ChargeResult of(UsageRecord record, boolean replayed) {
        return new ChargeResult(record.totalCost(), record.id(), record.transactionId(), record.status(), replayed);
    }
}
