package io.github.samzhu.billing.exception;

/**
 * 冪等鍵衝突異常。
 *
 * <p>同一個 requestId 或 externalRef 被用在不同用戶、不同金額或不同交易類型時拋出。
 * 相同內容的重複呼叫不會拋出此異常，而是回傳先前的結果。
 */
public class IdempotencyConflictException extends RuntimeException {

    private final String idempotencyKey;

    public IdempotencyConflictException(String idempotencyKey, String detail) {
        super(String.format("Idempotency key '%s' was already used for a different operation: %s",
            idempotencyKey, detail));
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
