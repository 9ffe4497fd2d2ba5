package io.github.samzhu.billing.exception;

/**
 * 供應商抓取失敗異常。
 *
 * <p>只在供應商內部使用，最終會轉換為失敗的
 * {@link io.github.samzhu.billing.dto.ProviderFetchResult}，不會中止整個同步。
 */
public class ProviderFetchException extends RuntimeException {

    private final String providerId;

    public ProviderFetchException(String providerId, String message) {
        super(message);
        this.providerId = providerId;
    }

    public ProviderFetchException(String providerId, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
