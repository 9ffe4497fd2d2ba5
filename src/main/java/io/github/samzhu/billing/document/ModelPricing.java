package io.github.samzhu.billing.document;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

/**
 * 目前生效的模型定價文件。
 *
 * <p>設計原則：
 * <ul>
 *   <li>唯一鍵：{@code (providerId, modelId)}</li>
 *   <li>價格單位：USD / 1k tokens，範圍 {@code (0, 100]}</li>
 *   <li>只由同步流程與人工核准寫入，讀取走 {@code PricingCacheService}</li>
 *   <li>下架不刪除，只設定 {@code active = false}</li>
 * </ul>
 */
@Document(collection = "model_pricing")
@CompoundIndex(name = "provider_model_idx", def = "{'providerId': 1, 'modelId': 1}", unique = true)
public record ModelPricing(
    @Id String id,

    // ========== 基本識別 ==========
    String modelId,
    String providerId,

    // ========== 價格 (USD / 1k tokens) ==========
    @Field(targetType = FieldType.DECIMAL128) BigDecimal inputPricePer1kTokens,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal outputPricePer1kTokens,

    // ========== 狀態 ==========
    boolean active,
    /** 價格來源，例如 {@code openai-static}、{@code bundled-default} */
    String source,

    // ========== 時間戳記 ==========
    /** 目前價格的生效時間 */
    Instant effectiveFrom,
    /** 最後一次由供應商確認價格未變的時間，用於判斷是否過期 */
    Instant lastVerifiedAt,
    Instant createdAt,
    Instant updatedAt
) {

    /** 內建預設價目表的來源標記 */
    public static final String SOURCE_BUNDLED_DEFAULT = "bundled-default";

    /**
     * 組合快取與比對用的鍵。
     *
     * @param providerId 供應商 ID
     * @param modelId 模型 ID
     * @return {@code providerId:modelId}
     */
    public static String key(String providerId, String modelId) {
        return providerId + ":" + modelId;
    }

    public String key() {
        return key(providerId, modelId);
    }

    /**
     * 建立新的生效定價（未持久化）。
     */
    public static ModelPricing create(String modelId, String providerId, BigDecimal inputPrice,
            BigDecimal outputPrice, String source, Instant now) {
        return new ModelPricing(null, modelId, providerId, inputPrice, outputPrice, true, source,
            now, now, now, now);
    }

    /**
     * 套用新價格，保留 ID 與建立時間。
     */
    public ModelPricing withPrices(BigDecimal inputPrice, BigDecimal outputPrice, String newSource, Instant now) {
        return new ModelPricing(id, modelId, providerId, inputPrice, outputPrice, true, newSource,
            now, now, createdAt, now);
    }

    /**
     * 下架此定價。
     */
    public ModelPricing deactivate(Instant now) {
        return new ModelPricing(id, modelId, providerId, inputPricePer1kTokens, outputPricePer1kTokens,
            false, source, effectiveFrom, lastVerifiedAt, createdAt, now);
    }

    /**
     * 判斷是否與指定價格完全相同（以數值比較，忽略 scale）。
     */
    public boolean hasSamePrices(BigDecimal inputPrice, BigDecimal outputPrice) {
        return inputPricePer1kTokens.compareTo(inputPrice) == 0
            && outputPricePer1kTokens.compareTo(outputPrice) == 0;
    }
}
