package io.github.samzhu.billing.dto.api;

import java.math.BigDecimal;
import java.time.Instant;

import io.github.samzhu.billing.document.UserBalance;

/**
 * 餘額查詢回應。
 */
public record BalanceResponse(
    String userId,
    BigDecimal balance,
    String currency,
    long version,
    Instant updatedAt
) {

    public static BalanceResponse fromUserBalance(UserBalance balance) {
        return new BalanceResponse(balance.userId(), balance.balance(), balance.currency(),
            balance.version(), balance.updatedAt());
    }
}
