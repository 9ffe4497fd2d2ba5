package io.github.samzhu.billing.exception;

/**
 * 帳本寫入失敗異常。
 *
 * <p>樂觀鎖衝突重試用盡或資料庫錯誤時拋出。呼叫端可以用相同的 requestId 安全重試。
 */
public class LedgerPersistenceException extends RuntimeException {

    private final String userId;
    private final int attempts;

    public LedgerPersistenceException(String userId, int attempts, Throwable cause) {
        super(String.format("Ledger write failed: userId='%s', attempts=%d", userId, attempts), cause);
        this.userId = userId;
        this.attempts = attempts;
    }

    public String getUserId() {
        return userId;
    }

    public int getAttempts() {
        return attempts;
    }
}
