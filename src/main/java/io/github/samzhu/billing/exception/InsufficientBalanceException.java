package io.github.samzhu.billing.exception;

import java.math.BigDecimal;

/**
 * 餘額不足異常。
 *
 * <p>面向用戶的錯誤，對應 HTTP 402 Payment Required，不會重試。
 * 拋出時餘額保持不變。
 */
public class InsufficientBalanceException extends RuntimeException {

    private final String userId;
    private final BigDecimal balance;
    private final BigDecimal required;

    public InsufficientBalanceException(String userId, BigDecimal balance, BigDecimal required) {
        super(String.format("Insufficient balance: userId='%s', have %s, need %s",
            userId, balance.toPlainString(), required.toPlainString()));
        this.userId = userId;
        this.balance = balance;
        this.required = required;
    }

    public String getUserId() {
        return userId;
    }

    public BigDecimal getBalance() {
        return balance;
    }

    public BigDecimal getRequired() {
        return required;
    }

    /**
     * 不足的金額。
     */
    public BigDecimal getShortfall() {
        return required.subtract(balance);
    }
}
