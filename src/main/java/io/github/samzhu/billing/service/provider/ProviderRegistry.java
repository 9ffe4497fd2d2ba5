package io.github.samzhu.billing.service.provider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.billing.dto.ProviderStatus;
import io.github.samzhu.billing.service.FetchLatencyService;

/**
 * 定價供應商註冊表。
 *
 * <p>啟動時由 {@code AppConfig} 建立一次，收集所有 {@link PricingProvider} Bean，
 * 再以 constructor injection 傳給同步流程與 API 控制器，不使用全域單例。
 *
 * <p>註冊只發生在啟動階段；之後的讀取不需同步。
 */
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, PricingProvider> providers = Collections.synchronizedMap(new LinkedHashMap<>());
    private final FetchLatencyService latencyService;

    public ProviderRegistry(FetchLatencyService latencyService) {
        this.latencyService = latencyService;
    }

    /**
     * 註冊供應商，相同 ID 會覆蓋先前的實例。
     */
    public void register(PricingProvider provider) {
        PricingProvider previous = providers.put(provider.id(), provider);
        if (previous != null) {
            log.warn("Pricing provider replaced: id={}", provider.id());
        }
        log.info("Pricing provider registered: id={}, freshness={}, models={}",
            provider.id(), provider.getDataFreshness(), provider.getSupportedModels().size());
    }

    public Optional<PricingProvider> get(String providerId) {
        return Optional.ofNullable(providers.get(providerId));
    }

    public List<PricingProvider> getAll() {
        synchronized (providers) {
            return List.copyOf(providers.values());
        }
    }

    /**
     * 取得目前可抓取的供應商（已啟用且不在退避期間）。
     */
    public List<PricingProvider> getAvailable() {
        List<PricingProvider> available = new ArrayList<>();
        for (PricingProvider provider : getAll()) {
            if (provider.isAvailable()) {
                available.add(provider);
            }
        }
        return available;
    }

    /**
     * 取得所有供應商的狀態快照，含抓取延遲百分位。
     */
    public List<ProviderStatus> getStats() {
        return getAll().stream()
            .map(this::toStatus)
            .toList();
    }

    private ProviderStatus toStatus(PricingProvider provider) {
        return new ProviderStatus(
            provider.id(),
            provider.displayName(),
            provider.isAvailable(),
            provider.getDataFreshness(),
            provider.getSupportedModels().size(),
            provider.lastSuccess(),
            provider.lastAttempt(),
            provider.failureCount(),
            provider.lastError(),
            latencyService.stats(provider.id())
        );
    }
}
