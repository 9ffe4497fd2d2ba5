package io.github.samzhu.billing.dto.api;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * 帳務調整請求。
 *
 * <p>用於 POST /api/v1/balance/users/{userId}/adjustments 端點。
 */
public record AdjustmentRequest(
    @NotNull(message = "amount is required")
    @Positive(message = "amount must be positive")
    BigDecimal amount,

    @NotNull(message = "credit is required")
    Boolean credit,

    @NotBlank(message = "reason is required")
    String reason,

    @NotBlank(message = "requestId is required")
    String requestId
) {}
