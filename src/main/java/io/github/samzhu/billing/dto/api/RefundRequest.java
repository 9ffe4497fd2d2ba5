package io.github.samzhu.billing.dto.api;

import java.math.BigDecimal;

import jakarta.validation.constraints.Positive;

/**
 * 退款請求。
 *
 * <p>{@code amount} 為 null 時退還剩餘全部。
 */
public record RefundRequest(
    @Positive(message = "amount must be positive")
    BigDecimal amount,

    String reason
) {}
