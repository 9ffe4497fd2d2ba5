package io.github.samzhu.billing.document;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

/**
 * 計費用量紀錄文件。
 *
 * <p>每個已扣款的用量事件建立一筆，{@code requestId} 唯一，確保同一請求最多一筆紀錄。
 *
 * <p>{@code transactionId} 只有在 {@link UsageStatus#RECONCILIATION_PENDING}
 * 且連扣款交易都無法關聯時才可能為 null。
 */
@Document(collection = "usage_records")
@CompoundIndex(name = "user_created_idx", def = "{'userId': 1, 'createdAt': -1}")
public record UsageRecord(
    @Id String id,

    // ========== 基本識別 ==========
    String userId,
    String chatId,
    String modelId,
    String providerId,

    // ========== Token 計數 ==========
    long inputTokens,
    long outputTokens,
    long totalTokens,

    // ========== 成本 (USD, scale 6) ==========
    @Field(targetType = FieldType.DECIMAL128) BigDecimal inputPricePer1k,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal outputPricePer1k,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal totalCost,

    // ========== 關聯 ==========
    @Indexed(unique = true) String requestId,
    String transactionId,

    // ========== 狀態 ==========
    @Indexed UsageStatus status,
    /** 進入對帳狀態的原因 */
    String failureReason,
    Instant createdAt
) {

    /**
     * 建立正常完成的用量紀錄。
     */
    public static UsageRecord completed(UsageLine line, String transactionId, Instant now) {
        return new UsageRecord(null, line.userId(), line.chatId(), line.modelId(), line.providerId(),
            line.inputTokens(), line.outputTokens(), line.totalTokens(),
            line.inputPricePer1k(), line.outputPricePer1k(), line.totalCost(),
            line.requestId(), transactionId, UsageStatus.COMPLETED, null, now);
    }

    /**
     * 建立需要人工對帳的用量紀錄（扣款成功但正常紀錄寫入失敗）。
     */
    public static UsageRecord reconciliationPending(UsageLine line, String transactionId,
            String failureReason, Instant now) {
        return new UsageRecord(null, line.userId(), line.chatId(), line.modelId(), line.providerId(),
            line.inputTokens(), line.outputTokens(), line.totalTokens(),
            line.inputPricePer1k(), line.outputPricePer1k(), line.totalCost(),
            line.requestId(), transactionId, UsageStatus.RECONCILIATION_PENDING, failureReason, now);
    }

    /**
     * 一筆待寫入用量的內容。
     */
    public record UsageLine(
        String userId,
        String chatId,
        String modelId,
        String providerId,
        long inputTokens,
        long outputTokens,
        long totalTokens,
        BigDecimal inputPricePer1k,
        BigDecimal outputPricePer1k,
        BigDecimal totalCost,
        String requestId
    ) {}
}
