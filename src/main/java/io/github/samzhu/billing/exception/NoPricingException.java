package io.github.samzhu.billing.exception;

/**
 * 找不到模型定價異常。
 *
 * <p>快取、{@code model_pricing} 與內建預設價目表都找不到 {@code (providerId, modelId)} 時拋出。
 *
 * <p>處理方式：
 * <ul>
 *   <li>拒絕此次計費，不以估計價格扣款</li>
 *   <li>記錄 ERROR 日誌供維運補上定價</li>
 * </ul>
 */
public class NoPricingException extends RuntimeException {

    private final String providerId;
    private final String modelId;

    public NoPricingException(String providerId, String modelId) {
        super(String.format("No pricing available: provider='%s', model='%s'", providerId, modelId));
        this.providerId = providerId;
        this.modelId = modelId;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getModelId() {
        return modelId;
    }
}
