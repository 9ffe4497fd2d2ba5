package io.github.samzhu.billing.dto;

/**
 * 對話管線發送的用量回報事件資料 (CloudEvent data)。
 *
 * <p>範例：
 * <pre>
 * {
 *   "userId": "user-123",
 *   "chatId": "chat-456",
 *   "model": "openai:gpt-4o-mini",
 *   "promptTokens": 500,
 *   "completionTokens": 500,
 *   "totalTokens": 1000,
 *   "requestId": "req-789"
 * }
 * </pre>
 *
 * @param userId 用戶 ID
 * @param chatId 對話 ID
 * @param model {@code providerId:modelId} 格式的模型識別
 * @param promptTokens 輸入 tokens
 * @param completionTokens 輸出 tokens
 * @param totalTokens 總 tokens
 * @param requestId 冪等鍵，缺少時由 CloudEvent id 補上
 */
public record UsageReportData(
    String userId,
    String chatId,
    String model,
    long promptTokens,
    long completionTokens,
    long totalTokens,
    String requestId
) {

    /**
     * 轉換為計費指令。
     *
     * @param fallbackRequestId {@code requestId} 為空時使用的冪等鍵
     * @return 計費指令
     * @throws io.github.samzhu.billing.exception.InvalidUsageException 若 model 格式錯誤
     */
    public UsageCharge toCharge(String fallbackRequestId) {
        ModelRef ref = ModelRef.parse(model);
        String effectiveRequestId = requestId != null && !requestId.isBlank() ? requestId : fallbackRequestId;
        return new UsageCharge(userId, chatId, ref.modelId(), ref.providerId(),
            promptTokens, completionTokens, totalTokens, effectiveRequestId);
    }
}
