package io.github.samzhu.billing.exception;

/**
 * 用量資料不合法異常。
 *
 * <p>token 計數為負、總數不等於輸入加輸出、缺少必要欄位時拋出。
 * 拋出時保證沒有任何帳本異動。
 */
public class InvalidUsageException extends RuntimeException {

    public InvalidUsageException(String message) {
        super(message);
    }
}
