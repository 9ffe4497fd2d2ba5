package io.github.samzhu.billing.support;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import io.github.samzhu.billing.dto.DataFreshness;
import io.github.samzhu.billing.dto.PriceQuote;
import io.github.samzhu.billing.dto.ProviderFetchResult;
import io.github.samzhu.billing.service.provider.PricingProvider;

/**
 * 測試用定價供應商，回傳預先設定的報價或失敗。
 */
public class StubPricingProvider implements PricingProvider {

    private final String id;
    private volatile Supplier<ProviderFetchResult> behavior;
    private volatile boolean available = true;
    private final AtomicInteger fetchCount = new AtomicInteger();

    public StubPricingProvider(String id) {
        this.id = id;
        this.behavior = () -> ProviderFetchResult.success(id, List.of(), id + "-stub", Instant.EPOCH, List.of(), 1);
    }

    /**
     * 設定成功回傳的報價，格式為 {@code modelId, input, output} 三個一組。
     */
    public StubPricingProvider returning(String... modelPrices) {
        List<PriceQuote> quotes = new ArrayList<>();
        for (int i = 0; i < modelPrices.length; i += 3) {
            quotes.add(new PriceQuote(modelPrices[i], id,
                new BigDecimal(modelPrices[i + 1]), new BigDecimal(modelPrices[i + 2]), id + "-stub"));
        }
        this.behavior = () -> ProviderFetchResult.success(id, quotes, id + "-stub", Instant.EPOCH, List.of(), 1);
        return this;
    }

    public StubPricingProvider failing(String error) {
        this.behavior = () -> ProviderFetchResult.failure(id, id + "-stub", Instant.EPOCH, error, 1);
        return this;
    }

    public StubPricingProvider behaving(Supplier<ProviderFetchResult> behavior) {
        this.behavior = behavior;
        return this;
    }

    public StubPricingProvider unavailable() {
        this.available = false;
        return this;
    }

    public int fetchCount() {
        return fetchCount.get();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String displayName() {
        return id;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public ProviderFetchResult fetchPricing() {
        fetchCount.incrementAndGet();
        return behavior.get();
    }

    @Override
    public List<String> getSupportedModels() {
        return List.of();
    }

    @Override
    public DataFreshness getDataFreshness() {
        return DataFreshness.STATIC;
    }

    @Override
    public Instant lastSuccess() {
        return null;
    }

    @Override
    public Instant lastAttempt() {
        return null;
    }

    @Override
    public int failureCount() {
        return 0;
    }

    @Override
    public String lastError() {
        return null;
    }
}
