package io.github.samzhu.billing.document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import io.github.samzhu.billing.dto.DetectedChange;

/**
 * 待人工審核的定價變更文件。
 *
 * <p>同步時被判定為 {@code requiresReview} 且未套用的變更會進入此佇列，
 * 同一個 {@code (providerId, modelId)} 最多只有一筆 {@link ReviewStatus#PENDING}。
 *
 * <p>狀態流轉：
 * <pre>
 * PENDING → APPROVED   (applyChange)
 * PENDING → REJECTED   (rejectChange)
 * PENDING → SUPERSEDED (後續同步偵測到不同價格或不再需要審核)
 * </pre>
 */
@Document(collection = "pending_pricing_changes")
@CompoundIndex(name = "status_provider_model_idx", def = "{'status': 1, 'providerId': 1, 'modelId': 1}")
public record PendingPricingChange(
    @Id String id,

    // ========== 變更內容 ==========
    ChangeType changeType,
    String modelId,
    String providerId,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal oldInputPrice,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal oldOutputPrice,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal newInputPrice,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal newOutputPrice,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal changePercentInput,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal changePercentOutput,
    /** 需要審核的原因（超過門檻、驗證錯誤與警告） */
    List<String> reasons,

    // ========== 狀態 ==========
    ReviewStatus status,
    String syncId,
    Instant detectedAt,
    String resolvedBy,
    Instant resolvedAt,
    String resolutionNote
) {

    /**
     * 由偵測結果建立待審項目。
     */
    public static PendingPricingChange fromDetected(DetectedChange change, String syncId, Instant now) {
        return new PendingPricingChange(null, change.changeType(), change.modelId(), change.providerId(),
            change.oldInputPrice(), change.oldOutputPrice(), change.newInputPrice(), change.newOutputPrice(),
            change.changePercentInput(), change.changePercentOutput(), change.reviewReasons(),
            ReviewStatus.PENDING, syncId, now, null, null, null);
    }

    /**
     * 結束此待審項目。
     */
    public PendingPricingChange resolve(ReviewStatus newStatus, String by, String note, Instant now) {
        return new PendingPricingChange(id, changeType, modelId, providerId,
            oldInputPrice, oldOutputPrice, newInputPrice, newOutputPrice,
            changePercentInput, changePercentOutput, reasons,
            newStatus, syncId, detectedAt, by, now, note);
    }

    /**
     * 判斷新偵測結果是否與此待審項目描述同一個變更。
     */
    public boolean describesSameChange(DetectedChange change) {
        return changeType == change.changeType()
            && sameValue(newInputPrice, change.newInputPrice())
            && sameValue(newOutputPrice, change.newOutputPrice());
    }

    /**
     * 轉回偵測結果，供人工核准時沿用同一套套用邏輯。
     */
    public DetectedChange toDetectedChange() {
        return new DetectedChange(changeType, modelId, providerId,
            oldInputPrice, oldOutputPrice, newInputPrice, newOutputPrice,
            changePercentInput, changePercentOutput, false, true, null, reasons);
    }

    public String key() {
        return ModelPricing.key(providerId, modelId);
    }

    private static boolean sameValue(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }
}
