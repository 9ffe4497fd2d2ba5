package io.github.samzhu.billing.document;

/**
 * 交易類型。
 *
 * <p>{@link #DEPOSIT} 與 {@link #REFUND} 永遠增加餘額，{@link #USAGE} 永遠扣減餘額，
 * {@link #ADJUSTMENT} 依 {@link LedgerTransaction#credit()} 決定方向。
 */
public enum TransactionType {
    DEPOSIT,
    USAGE,
    REFUND,
    ADJUSTMENT
}
