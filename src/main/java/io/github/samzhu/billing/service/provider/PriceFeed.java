package io.github.samzhu.billing.service.provider;

import java.math.BigDecimal;
import java.util.List;

/**
 * 外部 JSON 價格來源的格式。
 *
 * <pre>
 * {
 *   "models": [
 *     { "model": "gpt-4o-mini", "inputPer1k": 0.00015, "outputPer1k": 0.0006 }
 *   ]
 * }
 * </pre>
 *
 * @param models 模型報價清單
 */
public record PriceFeed(
    List<Entry> models
) {

    /**
     * 單一模型的報價 (USD / 1k tokens)。
     *
     * @param model 廠商使用的模型名稱，會經過別名正規化
     * @param inputPer1k 輸入單價
     * @param outputPer1k 輸出單價
     */
    public record Entry(
        String model,
        BigDecimal inputPer1k,
        BigDecimal outputPer1k
    ) {}
}
