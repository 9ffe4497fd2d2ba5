package io.github.samzhu.billing.dto;

import java.time.Instant;
import java.util.List;

/**
 * 單一供應商的抓取結果。
 *
 * <p>抓取失敗不以例外傳遞，而是回傳 {@code success = false} 並附上錯誤訊息，
 * 讓彙整流程可以繼續處理其他供應商。
 *
 * @param providerId 供應商 ID
 * @param success 是否成功
 * @param quotes 通過驗證的報價
 * @param source 資料來源描述
 * @param fetchedAt 抓取完成時間
 * @param errors 錯誤與被丟棄報價的說明
 * @param durationMs 抓取耗時（毫秒）
 */
public record ProviderFetchResult(
    String providerId,
    boolean success,
    List<PriceQuote> quotes,
    String source,
    Instant fetchedAt,
    List<String> errors,
    long durationMs
) {
    public ProviderFetchResult {
        quotes = quotes != null ? List.copyOf(quotes) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static ProviderFetchResult success(String providerId, List<PriceQuote> quotes, String source,
            Instant fetchedAt, List<String> errors, long durationMs) {
        return new ProviderFetchResult(providerId, true, quotes, source, fetchedAt, errors, durationMs);
    }

    public static ProviderFetchResult failure(String providerId, String source, Instant fetchedAt,
            String error, long durationMs) {
        return new ProviderFetchResult(providerId, false, List.of(), source, fetchedAt, List.of(error), durationMs);
    }
}
