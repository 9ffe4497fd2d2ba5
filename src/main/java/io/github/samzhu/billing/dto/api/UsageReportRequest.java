package io.github.samzhu.billing.dto.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import io.github.samzhu.billing.dto.UsageReportData;

/**
 * HTTP 用量回報請求，欄位與 CloudEvent payload 相同。
 *
 * <p>用於 POST /api/v1/usage/reports 端點，{@code requestId} 必填。
 */
public record UsageReportRequest(
    @NotBlank(message = "userId is required")
    String userId,

    String chatId,

    @NotBlank(message = "model is required")
    String model,

    @PositiveOrZero(message = "promptTokens must be positive or zero")
    long promptTokens,

    @PositiveOrZero(message = "completionTokens must be positive or zero")
    long completionTokens,

    @PositiveOrZero(message = "totalTokens must be positive or zero")
    long totalTokens,

    @NotBlank(message = "requestId is required")
    String requestId
) {

    public UsageReportData toData() {
        return new UsageReportData(userId, chatId, model, promptTokens, completionTokens, totalTokens, requestId);
    }
}
