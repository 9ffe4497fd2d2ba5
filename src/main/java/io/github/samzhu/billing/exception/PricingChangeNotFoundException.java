package io.github.samzhu.billing.exception;

/**
 * 找不到待審定價變更，或該變更已經處理過。
 */
public class PricingChangeNotFoundException extends RuntimeException {

    private final String changeId;

    public PricingChangeNotFoundException(String changeId, String reason) {
        super(String.format("Pending pricing change '%s' %s", changeId, reason));
        this.changeId = changeId;
    }

    public String getChangeId() {
        return changeId;
    }
}
