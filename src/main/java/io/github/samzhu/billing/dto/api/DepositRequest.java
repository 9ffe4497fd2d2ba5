package io.github.samzhu.billing.dto.api;

import java.math.BigDecimal;
import java.util.Map;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * 入帳請求。
 *
 * <p>用於 POST /api/v1/balance/users/{userId}/deposits 端點，{@code externalRef} 為付款流程的冪等鍵。
 */
public record DepositRequest(
    @NotNull(message = "amount is required")
    @Positive(message = "amount must be positive")
    BigDecimal amount,

    String currency,

    String externalRef,

    Map<String, Object> metadata
) {}
