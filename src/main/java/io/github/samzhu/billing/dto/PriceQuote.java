package io.github.samzhu.billing.dto;

import java.math.BigDecimal;

import io.github.samzhu.billing.document.ModelPricing;

/**
 * 供應商回報的單一模型報價 (USD / 1k tokens)。
 *
 * @param modelId 模型 ID（已正規化）
 * @param providerId 供應商 ID
 * @param inputPricePer1kTokens 輸入單價
 * @param outputPricePer1kTokens 輸出單價
 * @param source 報價來源，例如 {@code openai-static} 或 feed URL
 */
public record PriceQuote(
    String modelId,
    String providerId,
    BigDecimal inputPricePer1kTokens,
    BigDecimal outputPricePer1kTokens,
    String source
) {
    public String key() {
        return ModelPricing.key(providerId, modelId);
    }
}
