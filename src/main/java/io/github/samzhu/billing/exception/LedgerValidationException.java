package io.github.samzhu.billing.exception;

/**
 * 帳本操作參數不合法異常（金額、幣別、退款上限）。
 */
public class LedgerValidationException extends RuntimeException {

    public LedgerValidationException(String message) {
        super(message);
    }
}
