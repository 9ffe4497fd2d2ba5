package io.github.samzhu.billing.dto;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 所有供應商抓取結果的彙整。
 *
 * @param quotes 所有成功供應商的報價聯集
 * @param perProviderResult 每個供應商的抓取結果，依供應商 ID
 */
public record AggregatedPricing(
    List<PriceQuote> quotes,
    Map<String, ProviderFetchResult> perProviderResult
) {
    public AggregatedPricing {
        quotes = List.copyOf(quotes);
        perProviderResult = Map.copyOf(perProviderResult);
    }

    public Set<String> successfulProviders() {
        return perProviderResult.values().stream()
            .filter(ProviderFetchResult::success)
            .map(ProviderFetchResult::providerId)
            .collect(Collectors.toSet());
    }

    public Set<String> failedProviders() {
        return perProviderResult.values().stream()
            .filter(result -> !result.success())
            .map(ProviderFetchResult::providerId)
            .collect(Collectors.toSet());
    }
}
