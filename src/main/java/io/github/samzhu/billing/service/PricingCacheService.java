package io.github.samzhu.billing.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.config.BillingProperties.DefaultPrice;
import io.github.samzhu.billing.document.ModelPricing;
import io.github.samzhu.billing.exception.NoPricingException;
import io.github.samzhu.billing.repository.ModelPricingRepository;

/**
 * 模型定價快取服務。
 *
 * <p>查價的 fallback 順序：
 * <ol>
 *   <li>未過期的快取（預設 TTL 300 秒）</li>
 *   <li>{@code model_pricing} 中生效的定價；資料庫錯誤時記錄 WARN 並繼續往下</li>
 *   <li>組態中的內建預設價目表 {@code billing.pricing.default-prices}</li>
 *   <li>都找不到時拋出 {@link NoPricingException}，不快取找不到的結果</li>
 * </ol>
 *
 * <p>Single-flight：同一個 key 同時只有一個執行緒負責重新載入，
 * 其他執行緒在有舊值且啟用 {@code serveStaleWhileRefreshing} 時直接拿舊值，否則等待同一次載入的結果。
 *
 * <p>{@link #invalidate} 會遞增世代編號，載入期間若發生失效，該次結果不寫回快取。
 */
@Service
public class PricingCacheService {

    private static final Logger log = LoggerFactory.getLogger(PricingCacheService.class);

    private final ModelPricingRepository repository;
    private final Clock clock;
    private final Duration ttl;
    private final boolean serveStaleWhileRefreshing;
    private final Map<String, DefaultPrice> defaults;

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<ModelPricing>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();

    public PricingCacheService(ModelPricingRepository repository, BillingProperties properties, Clock clock) {
        this.repository = repository;
        this.clock = clock;
        this.ttl = properties.pricing().cacheTtl();
        this.serveStaleWhileRefreshing = properties.pricing().serveStaleWhileRefreshing();
        this.defaults = properties.pricing().defaultPrices();
    }

    /**
     * 取得模型目前的定價。
     *
     * @param modelId 模型 ID
     * @param providerId 供應商 ID
     * @return 生效中的定價（可能來自內建預設，此時 {@code source = bundled-default}）
     * @throws NoPricingException 若所有來源都找不到定價
     */
    public ModelPricing getPrice(String modelId, String providerId) {
        String key = ModelPricing.key(providerId, modelId);
        CacheEntry entry = entries.get(key);
        if (entry != null && isFresh(entry)) {
            return entry.pricing();
        }

        CompletableFuture<ModelPricing> refresh = new CompletableFuture<>();
        CompletableFuture<ModelPricing> leader = inFlight.putIfAbsent(key, refresh);
        if (leader != null) {
            if (entry != null && serveStaleWhileRefreshing) {
                log.debug("Serving stale pricing while refresh in flight: key={}", key);
                return entry.pricing();
            }
            return await(leader);
        }

        try {
            long observedGeneration = generation.get();
            // 前一個 leader 可能在首次檢查後、取得 inFlight 前已寫回快取
            CacheEntry current = entries.get(key);
            if (current != null && isFresh(current)) {
                refresh.complete(current.pricing());
                return current.pricing();
            }
            ModelPricing loaded = load(modelId, providerId);
            if (generation.get() == observedGeneration) {
                entries.put(key, new CacheEntry(loaded, clock.instant()));
            }
            refresh.complete(loaded);
            return loaded;
        } catch (RuntimeException e) {
            refresh.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, refresh);
        }
    }

    /**
     * 使指定模型的快取失效，同步套用價格後呼叫。
     */
    public void invalidate(String modelId, String providerId) {
        generation.incrementAndGet();
        entries.remove(ModelPricing.key(providerId, modelId));
        log.debug("Pricing cache invalidated: provider={}, model={}", providerId, modelId);
    }

    public void invalidateAll() {
        generation.incrementAndGet();
        entries.clear();
    }

    /**
     * 列出所有生效中的定價（不經過快取）。
     */
    public List<ModelPricing> listActive() {
        return repository.findByActiveTrueOrderByProviderIdAscModelIdAsc();
    }

    int size() {
        return entries.size();
    }

    // ========== 內部 ==========

    private ModelPricing load(String modelId, String providerId) {
        try {
            Optional<ModelPricing> stored = repository.findByProviderIdAndModelIdAndActiveTrue(providerId, modelId);
            if (stored.isPresent()) {
                log.debug("Pricing loaded from store: provider={}, model={}", providerId, modelId);
                return stored.get();
            }
        } catch (DataAccessException e) {
            log.warn("Pricing store lookup failed, falling back to bundled defaults: provider={}, model={}, error={}",
                providerId, modelId, e.getMessage());
        }

        DefaultPrice fallback = defaults.get(ModelPricing.key(providerId, modelId));
        if (fallback != null) {
            log.info("Using bundled default pricing: provider={}, model={}", providerId, modelId);
            return new ModelPricing(null, modelId, providerId, fallback.inputPer1k(), fallback.outputPer1k(),
                true, ModelPricing.SOURCE_BUNDLED_DEFAULT, null, null, null, null);
        }

        log.warn("No pricing found in cache, store or bundled defaults: provider={}, model={}", providerId, modelId);
        throw new NoPricingException(providerId, modelId);
    }

    private boolean isFresh(CacheEntry entry) {
        return entry.loadedAt().plus(ttl).isAfter(clock.instant());
    }

    private static ModelPricing await(CompletableFuture<ModelPricing> leader) {
        try {
            return leader.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private record CacheEntry(ModelPricing pricing, Instant loadedAt) {}
}
