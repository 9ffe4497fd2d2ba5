package io.github.samzhu.billing.dto;

import java.math.BigDecimal;
import java.util.List;

import io.github.samzhu.billing.document.ChangeType;
import io.github.samzhu.billing.document.ModelPricing;

/**
 * 單一模型的定價差異。
 *
 * <p>對於 NEW、UPDATED、REMOVED，{@code autoApplicable} 與 {@code requiresReview} 恰有一個為 true；
 * UNCHANGED 兩者皆為 false。
 *
 * @param changeType 變更類型
 * @param modelId 模型 ID
 * @param providerId 供應商 ID
 * @param oldInputPrice 目前輸入單價，NEW 時為 null
 * @param oldOutputPrice 目前輸出單價，NEW 時為 null
 * @param newInputPrice 新輸入單價，REMOVED 時沿用舊值
 * @param newOutputPrice 新輸出單價，REMOVED 時沿用舊值
 * @param changePercentInput 輸入價格變動百分比，NEW/REMOVED 時為 null
 * @param changePercentOutput 輸出價格變動百分比，NEW/REMOVED 時為 null
 * @param autoApplicable 是否可自動套用
 * @param requiresReview 是否需要人工審核
 * @param validation 驗證結果，可能為 null（REMOVED 或由待審項目還原）
 * @param reviewReasons 需要審核的原因
 */
public record DetectedChange(
    ChangeType changeType,
    String modelId,
    String providerId,
    BigDecimal oldInputPrice,
    BigDecimal oldOutputPrice,
    BigDecimal newInputPrice,
    BigDecimal newOutputPrice,
    BigDecimal changePercentInput,
    BigDecimal changePercentOutput,
    boolean autoApplicable,
    boolean requiresReview,
    ValidationResult validation,
    List<String> reviewReasons
) {
    public DetectedChange {
        reviewReasons = reviewReasons != null ? List.copyOf(reviewReasons) : List.of();
    }

    public String key() {
        return ModelPricing.key(providerId, modelId);
    }

    /**
     * 驗證是否通過；沒有驗證結果時視為通過。
     */
    public boolean isValid() {
        return validation == null || validation.valid();
    }
}
