package io.github.samzhu.billing.service.provider;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import io.github.samzhu.billing.config.BillingProperties;

/**
 * OpenAI 定價供應商。
 *
 * <p>OpenAI 沒有公開的價格 API，預設使用內建價目表；設定 {@code feed-url} 後改為每日更新的 JSON 來源。
 */
@Component
public class OpenAiPricingProvider extends AbstractPricingProvider {

    public static final String PROVIDER_ID = "openai";

    private static final Map<String, BigDecimal[]> STATIC_PRICING = new LinkedHashMap<>();
    static {
        STATIC_PRICING.put("gpt-4.1", prices("0.01", "0.03"));
        STATIC_PRICING.put("gpt-4.1-mini", prices("0.0005", "0.0015"));
        STATIC_PRICING.put("gpt-4.1-nano", prices("0.0001", "0.0003"));
        STATIC_PRICING.put("o3-mini", prices("0.0015", "0.006"));
        STATIC_PRICING.put("gpt-4o", prices("0.0025", "0.01"));
        STATIC_PRICING.put("gpt-4o-mini", prices("0.00015", "0.0006"));
        STATIC_PRICING.put("gpt-4-turbo", prices("0.01", "0.03"));
        STATIC_PRICING.put("gpt-4", prices("0.03", "0.06"));
        STATIC_PRICING.put("gpt-3.5-turbo", prices("0.0005", "0.0015"));
    }

    private static final Map<String, String> ALIASES = Map.of(
        "gpt-4-turbo-preview", "gpt-4-turbo",
        "gpt-4-1106-preview", "gpt-4-turbo",
        "gpt-3.5-turbo-0125", "gpt-3.5-turbo",
        "gpt-3.5-turbo-1106", "gpt-3.5-turbo"
    );

    public OpenAiPricingProvider(BillingProperties properties, RestClient.Builder restClientBuilder, Clock clock) {
        super(properties.provider(PROVIDER_ID), restClientBuilder, clock);
    }

    @Override
    public String id() {
        return PROVIDER_ID;
    }

    @Override
    public String displayName() {
        return "OpenAI";
    }

    @Override
    protected Map<String, BigDecimal[]> staticPricing() {
        return STATIC_PRICING;
    }

    @Override
    protected Map<String, String> modelAliases() {
        return ALIASES;
    }

    static BigDecimal[] prices(String input, String output) {
        return new BigDecimal[] { new BigDecimal(input), new BigDecimal(output) };
    }
}
