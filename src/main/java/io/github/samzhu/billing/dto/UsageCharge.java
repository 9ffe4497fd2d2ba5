package io.github.samzhu.billing.dto;

/**
 * 一次用量計費指令。
 */
public record UsageCharge(
    String userId,
    String chatId,
    String modelId,
    String providerId,
    long inputTokens,
    long outputTokens,
    long totalTokens,
    String requestId
) {
}
