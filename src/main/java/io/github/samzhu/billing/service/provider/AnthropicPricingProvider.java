package io.github.samzhu.billing.service.provider;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.dto.DataFreshness;

import static io.github.samzhu.billing.service.provider.OpenAiPricingProvider.prices;

/**
 * Anthropic 定價供應商。
 *
 * <p>Anthropic 調價頻率較低，設定外部來源時資料新鮮度為 {@link DataFreshness#WEEKLY}。
 */
@Component
public class AnthropicPricingProvider extends AbstractPricingProvider {

    public static final String PROVIDER_ID = "anthropic";

    private static final Map<String, BigDecimal[]> STATIC_PRICING = new LinkedHashMap<>();
    static {
        STATIC_PRICING.put("claude-3-7-sonnet-20250219", prices("0.003", "0.015"));
        STATIC_PRICING.put("claude-3-5-sonnet-latest", prices("0.003", "0.015"));
        STATIC_PRICING.put("claude-3-5-sonnet-20241022", prices("0.003", "0.015"));
        STATIC_PRICING.put("claude-3-5-haiku-20241022", prices("0.0008", "0.004"));
        STATIC_PRICING.put("claude-3-opus-20240229", prices("0.015", "0.075"));
        STATIC_PRICING.put("claude-3-sonnet-20240229", prices("0.003", "0.015"));
        STATIC_PRICING.put("claude-3-haiku-20240307", prices("0.00025", "0.00125"));
    }

    // 文件上常見的簡寫
    private static final Map<String, String> ALIASES = Map.of(
        "claude-3.5-sonnet", "claude-3-5-sonnet-latest",
        "claude-3.5-haiku", "claude-3-5-haiku-20241022",
        "claude-3-opus", "claude-3-opus-20240229",
        "claude-3-sonnet", "claude-3-sonnet-20240229",
        "claude-3-haiku", "claude-3-haiku-20240307"
    );

    public AnthropicPricingProvider(BillingProperties properties, RestClient.Builder restClientBuilder, Clock clock) {
        super(properties.provider(PROVIDER_ID), restClientBuilder, clock);
    }

    @Override
    public String id() {
        return PROVIDER_ID;
    }

    @Override
    public String displayName() {
        return "Anthropic";
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
    protected DataFreshness feedFreshness() {
        return DataFreshness.WEEKLY;
    }
}
