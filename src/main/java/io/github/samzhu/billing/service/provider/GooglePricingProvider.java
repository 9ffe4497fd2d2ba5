package io.github.samzhu.billing.service.provider;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import io.github.samzhu.billing.config.BillingProperties;

import static io.github.samzhu.billing.service.provider.OpenAiPricingProvider.prices;

/**
 * Google Gemini 定價供應商。
 *
 * <p>Gemini API 回傳的模型名稱帶有 {@code models/} 前綴，正規化時會移除。
 */
@Component
public class GooglePricingProvider extends AbstractPricingProvider {

    public static final String PROVIDER_ID = "google";

    private static final String MODEL_PREFIX = "models/";

    private static final Map<String, BigDecimal[]> STATIC_PRICING = new LinkedHashMap<>();
    static {
        STATIC_PRICING.put("gemini-2.0-flash", prices("0.000075", "0.0003"));
        STATIC_PRICING.put("gemini-2.0-flash-thinking-exp-01-21", prices("0.000075", "0.0003"));
        STATIC_PRICING.put("gemini-2.5-pro-exp-03-25", prices("0.00125", "0.005"));
        STATIC_PRICING.put("gemini-1.5-pro", prices("0.00125", "0.005"));
        STATIC_PRICING.put("gemini-1.5-flash", prices("0.000075", "0.0003"));
        STATIC_PRICING.put("gemini-1.5-flash-8b", prices("0.0000375", "0.00015"));
        STATIC_PRICING.put("gemini-pro", prices("0.000125", "0.000375"));
        STATIC_PRICING.put("gemini-pro-vision", prices("0.000125", "0.000375"));
    }

    private static final Map<String, String> ALIASES = Map.of(
        "gemini-2.0-flash-latest", "gemini-2.0-flash",
        "gemini-1.5-pro-latest", "gemini-1.5-pro"
    );

    public GooglePricingProvider(BillingProperties properties, RestClient.Builder restClientBuilder, Clock clock) {
        super(properties.provider(PROVIDER_ID), restClientBuilder, clock);
    }

    @Override
    public String id() {
        return PROVIDER_ID;
    }

    @Override
    public String displayName() {
        return "Google";
    }

    @Override
    protected Map<String, BigDecimal[]> staticPricing() {
        return STATIC_PRICING;
    }

    @Override
    protected Map<String, String> modelAliases() {
        return ALIASES;
    }

    @Override
    public String normalizeModelName(String providerModelName) {
        String name = providerModelName.trim();
        if (name.startsWith(MODEL_PREFIX)) {
            name = name.substring(MODEL_PREFIX.length());
        }
        return super.normalizeModelName(name);
    }
}
