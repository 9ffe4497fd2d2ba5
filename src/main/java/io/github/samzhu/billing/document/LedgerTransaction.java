package io.github.samzhu.billing.document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

/**
 * 帳本交易文件。
 *
 * <p>設計原則：
 * <ul>
 *   <li>只增不改：交易一旦寫入就不會修改或刪除，更正一律以 {@link TransactionType#ADJUSTMENT} 追加</li>
 *   <li>冪等鍵：{@code requestId}（扣款）與 {@code externalRef}（入帳）各自有唯一索引</li>
 *   <li>全序：同一用戶的交易以 {@code sequence} 排序，等同提交順序與 {@code createdAt} 順序</li>
 * </ul>
 *
 * <p>不變量：
 * <pre>
 * credit = true  → balanceAfter = balanceBefore + amount
 * credit = false → balanceAfter = balanceBefore - amount
 * amount &gt; 0
 * </pre>
 */
@Document(collection = "transactions")
@CompoundIndex(name = "user_sequence_idx", def = "{'userId': 1, 'sequence': 1}", unique = true)
@CompoundIndex(name = "user_created_idx", def = "{'userId': 1, 'createdAt': -1}")
public record LedgerTransaction(
    @Id String id,

    // ========== 基本識別 ==========
    String userId,
    TransactionType type,
    /** true 表示增加餘額 */
    boolean credit,

    // ========== 金額 ==========
    @Field(targetType = FieldType.DECIMAL128) BigDecimal amount,
    String currency,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal balanceBefore,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal balanceAfter,

    // ========== 描述與關聯 ==========
    String description,
    /** 外部付款參考（例如付款 ID），入帳的冪等鍵 */
    @Indexed(unique = true, sparse = true) String externalRef,
    /** 呼叫端提供的請求 ID，扣款的冪等鍵 */
    @Indexed(unique = true, sparse = true) String requestId,
    /** 退款所對應的原始交易 ID */
    @Indexed(sparse = true) String relatedTransactionId,
    Map<String, Object> metadata,

    // ========== 排序與時間 ==========
    /** 此交易提交後的餘額 version */
    long sequence,
    Instant createdAt
) {

    /**
     * 帶正負號的金額，入帳為正、扣款為負。
     */
    public BigDecimal signedAmount() {
        return credit ? amount : amount.negate();
    }

    /**
     * 是否為可被退款的扣款交易。
     */
    public boolean isRefundable() {
        return !credit && (type == TransactionType.USAGE || type == TransactionType.ADJUSTMENT);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * LedgerTransaction Builder。
     */
    public static class Builder {
        private String id;
        private String userId;
        private TransactionType type;
        private boolean credit;
        private BigDecimal amount;
        private String currency;
        private BigDecimal balanceBefore;
        private BigDecimal balanceAfter;
        private String description;
        private String externalRef;
        private String requestId;
        private String relatedTransactionId;
        private Map<String, Object> metadata;
        private long sequence;
        private Instant createdAt;

        public Builder id(String id) { this.id = id; return this; }
        public Builder userId(String userId) { this.userId = userId; return this; }
        public Builder type(TransactionType type) { this.type = type; return this; }
        public Builder credit(boolean credit) { this.credit = credit; return this; }
        public Builder amount(BigDecimal amount) { this.amount = amount; return this; }
        public Builder currency(String currency) { this.currency = currency; return this; }
        public Builder balanceBefore(BigDecimal balanceBefore) { this.balanceBefore = balanceBefore; return this; }
        public Builder balanceAfter(BigDecimal balanceAfter) { this.balanceAfter = balanceAfter; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder externalRef(String externalRef) { this.externalRef = externalRef; return this; }
        public Builder requestId(String requestId) { this.requestId = requestId; return this; }
        public Builder relatedTransactionId(String relatedTransactionId) { this.relatedTransactionId = relatedTransactionId; return this; }
        public Builder metadata(Map<String, Object> metadata) { this.metadata = metadata; return this; }
        public Builder sequence(long sequence) { this.sequence = sequence; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }

        public LedgerTransaction build() {
            return new LedgerTransaction(id, userId, type, credit, amount, currency,
                balanceBefore, balanceAfter, description, externalRef, requestId,
                relatedTransactionId,
                metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of(),
                sequence, createdAt);
        }
    }
}
