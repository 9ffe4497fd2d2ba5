package io.github.samzhu.billing.exception;

/**
 * 已有另一個定價套用流程正在執行。
 */
public class SyncInProgressException extends RuntimeException {

    public SyncInProgressException(String message) {
        super(message);
    }
}
