package io.github.samzhu.billing.document;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

/**
 * 用戶餘額投影文件。
 *
 * <p>設計原則：
 * <ul>
 *   <li>一個用戶一筆：{@code userId} 唯一索引</li>
 *   <li>金額精確：以 {@code Decimal128} 儲存，永不使用浮點數</li>
 *   <li>只透過交易變更：每次變更都伴隨一筆 {@link LedgerTransaction}，且 {@code version} 加一</li>
 *   <li>樂觀鎖：更新條件為 {@code userId + version}，不符時視為衝突</li>
 * </ul>
 *
 * <p>不變量：任何已提交的讀取都滿足 {@code balance >= 0}。
 */
@Document(collection = "user_balances")
public record UserBalance(
    @Id String id,

    // ========== 基本識別 ==========
    /** 用戶唯一識別碼 */
    @Indexed(unique = true) String userId,

    // ========== 餘額 ==========
    /** 目前餘額，scale 6 */
    @Field(targetType = FieldType.DECIMAL128) BigDecimal balance,
    /** 餘額幣別（僅作標記，不做換算） */
    String currency,

    // ========== 偏好設定 ==========
    /** 顯示用幣別 */
    String preferredCurrency,
    /** 顯示用語系 */
    String locale,

    // ========== 版本與時間 ==========
    /** 已提交的交易數，也是最後一筆交易的 sequence */
    long version,
    Instant createdAt,
    Instant updatedAt
) {

    /**
     * 建立尚未有任何交易的空帳戶（未持久化）。
     *
     * @param userId 用戶 ID
     * @param currency 幣別
     * @param now 建立時間
     * @return 餘額為 0、version 為 0 的帳戶
     */
    public static UserBalance open(String userId, String currency, Instant now) {
        return new UserBalance(
            null, // ID 自動產生
            userId,
            BigDecimal.ZERO.setScale(6),
            currency,
            currency,
            null,
            0L,
            now,
            now
        );
    }

    /**
     * 套用一筆交易後的新餘額狀態。
     *
     * @param newBalance 交易後餘額
     * @param at 交易時間
     * @return version 加一的新實例
     */
    public UserBalance apply(BigDecimal newBalance, Instant at) {
        return new UserBalance(id, userId, newBalance, currency, preferredCurrency, locale,
            version + 1, createdAt, at);
    }
}
