package io.github.samzhu.billing.document;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import io.github.samzhu.billing.dto.DetectedChange;

/**
 * 定價變更稽核文件。
 *
 * <p>只在變更實際寫入 {@link ModelPricing} 時建立（自動套用、人工核准、初始化），
 * dry run 預覽永遠不會產生此文件。記錄一旦建立就不會修改。
 */
@Document(collection = "pricing_changes")
@CompoundIndex(name = "provider_model_created_idx", def = "{'providerId': 1, 'modelId': 1, 'createdAt': -1}")
public record PricingChange(
    @Id String id,

    // ========== 基本識別 ==========
    String modelId,
    String providerId,
    ChangeType changeType,

    // ========== 價格 (USD / 1k tokens) ==========
    @Field(targetType = FieldType.DECIMAL128) BigDecimal oldInputPrice,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal oldOutputPrice,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal newInputPrice,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal newOutputPrice,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal changePercentInput,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal changePercentOutput,

    // ========== 稽核 ==========
    /** 執行者，例如 {@code auto-sync}、{@code system-seed} 或管理員名稱 */
    String changedBy,
    /** 變更來源：{@code auto-sync}、{@code force-sync}、{@code manual}、{@code seed} */
    String changeSource,
    String changeReason,
    /** 產生此變更的同步 ID，人工核准時為原待審項目的同步 ID */
    String syncId,
    Instant createdAt
) {

    public static final String SOURCE_AUTO_SYNC = "auto-sync";
    public static final String SOURCE_FORCE_SYNC = "force-sync";
    public static final String SOURCE_MANUAL = "manual";
    public static final String SOURCE_SEED = "seed";

    /**
     * 由偵測結果建立稽核紀錄。
     */
    public static PricingChange fromDetected(DetectedChange change, String changedBy, String changeSource,
            String changeReason, String syncId, Instant now) {
        return new PricingChange(
            null, // ID 自動產生
            change.modelId(),
            change.providerId(),
            change.changeType(),
            change.oldInputPrice(),
            change.oldOutputPrice(),
            change.newInputPrice(),
            change.newOutputPrice(),
            change.changePercentInput(),
            change.changePercentOutput(),
            changedBy,
            changeSource,
            changeReason,
            syncId,
            now
        );
    }
}
