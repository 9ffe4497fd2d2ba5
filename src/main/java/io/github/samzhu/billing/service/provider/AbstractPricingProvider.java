package io.github.samzhu.billing.service.provider;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import io.github.samzhu.billing.config.BillingProperties.ProviderConfig;
import io.github.samzhu.billing.dto.DataFreshness;
import io.github.samzhu.billing.dto.PriceQuote;
import io.github.samzhu.billing.dto.ProviderFetchResult;
import io.github.samzhu.billing.exception.ProviderFetchException;

/**
 * 定價供應商的共用實作。
 *
 * <p>子類別只需提供：
 * <ul>
 *   <li>{@link #staticPricing()} - 內建的靜態價目表</li>
 *   <li>{@link #modelAliases()} - 廠商模型名稱到標準名稱的對照</li>
 *   <li>{@link #feedFreshness()} - 設定外部來源時的更新頻率</li>
 * </ul>
 *
 * <p>抓取流程：有設定 {@code feedUrl} 時以 {@link RestClient} 讀取 JSON 來源
 * （格式見 {@link PriceFeed}），否則使用靜態價目表；接著正規化模型名稱並過濾不合理的報價。
 *
 * <p>退避：連續失敗達到 {@code failureThreshold} 次後，下一次可抓取的時間為
 * {@code lastAttempt + backoff × 2^(failureCount - failureThreshold)}，
 * 退避期間 {@link #isAvailable()} 回傳 false。
 */
public abstract class AbstractPricingProvider implements PricingProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractPricingProvider.class);

    static final BigDecimal MAX_PRICE_PER_1K = new BigDecimal("100");
    private static final int MAX_BACKOFF_SHIFT = 6;
    private static final String USER_AGENT = "billing-ledger-pricing-sync/1.0";

    private final ProviderConfig config;
    private final RestClient restClient;
    private final Clock clock;

    private volatile Instant lastSuccess;
    private volatile Instant lastAttempt;
    private volatile String lastError;
    private final AtomicInteger failureCount = new AtomicInteger();

    protected AbstractPricingProvider(ProviderConfig config, RestClient.Builder restClientBuilder, Clock clock) {
        this.config = config;
        this.restClient = hasFeed(config)
            ? restClientBuilder.defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT).build()
            : null;
        this.clock = clock;
    }

    /**
     * 內建靜態價目表，key 為標準模型 ID，價格為 {@code [input, output]} (USD / 1k tokens)。
     */
    protected abstract Map<String, BigDecimal[]> staticPricing();

    /**
     * 廠商模型名稱對照，預設沒有別名。
     */
    protected Map<String, String> modelAliases() {
        return Map.of();
    }

    /**
     * 設定外部來源時的資料更新頻率。
     */
    protected DataFreshness feedFreshness() {
        return DataFreshness.DAILY;
    }

    // ========== PricingProvider ==========

    @Override
    public boolean isAvailable() {
        if (!config.enabled()) {
            return false;
        }
        Instant retryAt = nextAttemptAllowedAt();
        return retryAt == null || !clock.instant().isBefore(retryAt);
    }

    @Override
    public final ProviderFetchResult fetchPricing() {
        long startNanos = System.nanoTime();
        lastAttempt = clock.instant();
        String source = hasFeed(config) ? config.feedUrl() : id() + "-static";

        try {
            List<String> errors = new ArrayList<>();
            List<PriceQuote> quotes = validate(hasFeed(config) ? fetchFeed() : staticQuotes(), errors);
            if (quotes.isEmpty()) {
                throw new ProviderFetchException(id(), "No valid quotes returned from " + source);
            }

            recordSuccess();
            long durationMs = elapsedMs(startNanos);
            log.info("Fetched pricing: provider={}, quotes={}, dropped={}, source={}, durationMs={}",
                id(), quotes.size(), errors.size(), source, durationMs);
            return ProviderFetchResult.success(id(), quotes, source, clock.instant(), errors, durationMs);
        } catch (ProviderFetchException | RestClientException e) {
            recordFailure(e.getMessage());
            long durationMs = elapsedMs(startNanos);
            log.warn("Pricing fetch failed: provider={}, failureCount={}, error={}",
                id(), failureCount.get(), e.getMessage());
            return ProviderFetchResult.failure(id(), source, clock.instant(), e.getMessage(), durationMs);
        } catch (RuntimeException e) {
            String error = e.getClass().getSimpleName() + ": " + e.getMessage();
            recordFailure(error);
            long durationMs = elapsedMs(startNanos);
            log.error("Unexpected pricing fetch error: provider={}, failureCount={}, source={}",
                id(), failureCount.get(), source, e);
            return ProviderFetchResult.failure(id(), source, clock.instant(), error, durationMs);
        }
    }

    @Override
    public List<String> getSupportedModels() {
        return List.copyOf(staticPricing().keySet());
    }

    @Override
    public DataFreshness getDataFreshness() {
        return hasFeed(config) ? feedFreshness() : DataFreshness.STATIC;
    }

    @Override
    public Instant lastSuccess() {
        return lastSuccess;
    }

    @Override
    public Instant lastAttempt() {
        return lastAttempt;
    }

    @Override
    public int failureCount() {
        return failureCount.get();
    }

    @Override
    public String lastError() {
        return lastError;
    }

    // ========== 名稱正規化 ==========

    /**
     * 將廠商模型名稱轉為標準模型 ID。
     */
    public String normalizeModelName(String providerModelName) {
        String trimmed = providerModelName.trim();
        return modelAliases().getOrDefault(trimmed, trimmed);
    }

    // ========== 內部 ==========

    private List<PriceQuote> staticQuotes() {
        List<PriceQuote> quotes = new ArrayList<>();
        staticPricing().forEach((modelId, prices) ->
            quotes.add(new PriceQuote(modelId, id(), prices[0], prices[1], id() + "-static")));
        return quotes;
    }

    private List<PriceQuote> fetchFeed() {
        PriceFeed feed = restClient.get()
            .uri(config.feedUrl())
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .body(PriceFeed.class);

        if (feed == null || feed.models() == null) {
            throw new ProviderFetchException(id(), "Empty price feed from " + config.feedUrl());
        }

        List<PriceQuote> quotes = new ArrayList<>();
        for (PriceFeed.Entry entry : feed.models()) {
            String modelId = entry.model() != null ? normalizeModelName(entry.model()) : null;
            quotes.add(new PriceQuote(modelId, id(), entry.inputPer1k(), entry.outputPer1k(), config.feedUrl()));
        }
        return quotes;
    }

    /**
     * 過濾不合理的報價，被丟棄的報價寫入 errors。
     * 正規化後重複的模型只保留第一筆。
     */
    List<PriceQuote> validate(List<PriceQuote> quotes, List<String> errors) {
        Map<String, PriceQuote> accepted = new LinkedHashMap<>();
        for (PriceQuote quote : quotes) {
            if (quote.modelId() == null || quote.modelId().isBlank()) {
                errors.add("Dropped quote without model id");
                continue;
            }
            if (!inRange(quote.inputPricePer1kTokens()) || !inRange(quote.outputPricePer1kTokens())) {
                errors.add(String.format("Dropped %s: prices %s/%s outside (0, 100]",
                    quote.key(), quote.inputPricePer1kTokens(), quote.outputPricePer1kTokens()));
                continue;
            }
            if (accepted.putIfAbsent(quote.modelId(), quote) != null) {
                errors.add("Dropped duplicate quote for " + quote.key());
            }
        }
        return List.copyOf(accepted.values());
    }

    private static boolean inRange(BigDecimal price) {
        return price != null && price.signum() > 0 && price.compareTo(MAX_PRICE_PER_1K) <= 0;
    }

    private void recordSuccess() {
        lastSuccess = clock.instant();
        failureCount.set(0);
        lastError = null;
    }

    private void recordFailure(String error) {
        failureCount.incrementAndGet();
        lastError = error;
    }

    private Instant nextAttemptAllowedAt() {
        int failures = failureCount.get();
        Instant attempted = lastAttempt;
        if (failures < config.failureThreshold() || attempted == null) {
            return null;
        }
        int shift = Math.min(failures - config.failureThreshold(), MAX_BACKOFF_SHIFT);
        Duration delay = config.backoff().multipliedBy(1L << shift);
        return attempted.plus(delay);
    }

    private static boolean hasFeed(ProviderConfig config) {
        return config.feedUrl() != null && !config.feedUrl().isBlank();
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
