package io.github.samzhu.billing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.config.BillingProperties.DefaultPrice;
import io.github.samzhu.billing.config.BillingProperties.PricingConfig;
import io.github.samzhu.billing.document.ModelPricing;
import io.github.samzhu.billing.exception.NoPricingException;
import io.github.samzhu.billing.repository.ModelPricingRepository;
import io.github.samzhu.billing.support.MutableClock;

class PricingCacheServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private ModelPricingRepository repository;
    private BillingProperties properties;
    private PricingCacheService cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        repository = mock(ModelPricingRepository.class);
        properties = new BillingProperties(null,
            new PricingConfig(Duration.ofSeconds(300), true, false, Map.of(
                "openai:gpt-4o", new DefaultPrice(new BigDecimal("0.0025"), new BigDecimal("0.01")))),
            null, null, null, null);
        cache = new PricingCacheService(repository, properties, clock);
    }

    @Test
    void shouldServeCachedPriceUntilTtlExpires() {
        // Given
        ModelPricing stored = pricing("gpt-4o", "0.002", "0.008");
        when(repository.findByProviderIdAndModelIdAndActiveTrue("openai", "gpt-4o")).thenReturn(Optional.of(stored));

        // When
        cache.getPrice("gpt-4o", "openai");
        clock.advance(Duration.ofSeconds(299));
        ModelPricing cached = cache.getPrice("gpt-4o", "openai");

        // Then
        assertThat(cached.inputPricePer1kTokens()).isEqualByComparingTo("0.002");
        verify(repository, times(1)).findByProviderIdAndModelIdAndActiveTrue("openai", "gpt-4o");

        // When: TTL 過期
        clock.advance(Duration.ofSeconds(2));
        cache.getPrice("gpt-4o", "openai");

        // Then
        verify(repository, times(2)).findByProviderIdAndModelIdAndActiveTrue("openai", "gpt-4o");
    }

    @Test
    void shouldReloadAfterInvalidate() {
        // Given
        when(repository.findByProviderIdAndModelIdAndActiveTrue("openai", "gpt-4o"))
            .thenReturn(Optional.of(pricing("gpt-4o", "0.002", "0.008")))
            .thenReturn(Optional.of(pricing("gpt-4o", "0.003", "0.009")));
        cache.getPrice("gpt-4o", "openai");

        // When
        cache.invalidate("gpt-4o", "openai");
        ModelPricing reloaded = cache.getPrice("gpt-4o", "openai");

        // Then
        assertThat(reloaded.inputPricePer1kTokens()).isEqualByComparingTo("0.003");
    }

    @Test
    void shouldFallBackToBundledDefaultWhenStoreHasNoRow() {
        // Given
        when(repository.findByProviderIdAndModelIdAndActiveTrue("openai", "gpt-4o")).thenReturn(Optional.empty());

        // When
        ModelPricing fallback = cache.getPrice("gpt-4o", "openai");

        // Then
        assertThat(fallback.source()).isEqualTo(ModelPricing.SOURCE_BUNDLED_DEFAULT);
        assertThat(fallback.inputPricePer1kTokens()).isEqualByComparingTo("0.0025");
        assertThat(fallback.outputPricePer1kTokens()).isEqualByComparingTo("0.01");
    }

    @Test
    void shouldFallBackToBundledDefaultWhenStoreFails() {
        // Given
        when(repository.findByProviderIdAndModelIdAndActiveTrue("openai", "gpt-4o"))
            .thenThrow(new DataAccessResourceFailureException("mongo down"));

        // When
        ModelPricing fallback = cache.getPrice("gpt-4o", "openai");

        // Then
        assertThat(fallback.source()).isEqualTo(ModelPricing.SOURCE_BUNDLED_DEFAULT);
    }

    @Test
    void shouldThrowNoPricingWithoutCachingTheMiss() {
        // Given
        when(repository.findByProviderIdAndModelIdAndActiveTrue("openai", "gpt-5"))
            .thenReturn(Optional.empty())
            .thenReturn(Optional.of(pricing("gpt-5", "0.01", "0.04")));

        // When / Then
        assertThatThrownBy(() -> cache.getPrice("gpt-5", "openai"))
            .isInstanceOf(NoPricingException.class)
            .hasMessageContaining("gpt-5");
        assertThat(cache.size()).isZero();

        assertThat(cache.getPrice("gpt-5", "openai").inputPricePer1kTokens()).isEqualByComparingTo("0.01");
    }

    @Test
    void shouldCollapseConcurrentMissesIntoSingleLookup() throws Exception {
        // Given: 資料庫查詢需要一段時間
        when(repository.findByProviderIdAndModelIdAndActiveTrue("openai", "gpt-4o")).thenAnswer(inv -> {
            Thread.sleep(300);
            return Optional.of(pricing("gpt-4o", "0.002", "0.008"));
        });
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ModelPricing>> results = new ArrayList<>();

        // When
        for (int i = 0; i < 8; i++) {
            results.add(pool.submit(() -> {
                start.await();
                return cache.getPrice("gpt-4o", "openai");
            }));
        }
        start.countDown();
        for (Future<ModelPricing> result : results) {
            assertThat(result.get(5, TimeUnit.SECONDS).inputPricePer1kTokens()).isEqualByComparingTo("0.002");
        }
        pool.shutdown();

        // Then
        verify(repository, times(1)).findByProviderIdAndModelIdAndActiveTrue("openai", "gpt-4o");
    }

    @Test
    void shouldNotReloadWhenPreviousLeaderAlreadyRefreshedStaleEntry() throws Exception {
        // Given: 快取已過期，B 在檢查新鮮度時被暫停
        GatedClock gatedClock = new GatedClock(NOW);
        PricingCacheService gatedCache = new PricingCacheService(repository, properties, gatedClock);
        when(repository.findByProviderIdAndModelIdAndActiveTrue("openai", "gpt-4o"))
            .thenReturn(Optional.of(pricing("gpt-4o", "0.002", "0.008")));
        gatedCache.getPrice("gpt-4o", "openai");
        gatedClock.advance(Duration.ofSeconds(301));

        ExecutorService pool = Executors.newSingleThreadExecutor();
        Future<ModelPricing> threadB = pool.submit(() -> {
            gatedClock.parkNextCall();
            return gatedCache.getPrice("gpt-4o", "openai");
        });
        assertThat(gatedClock.parked.await(5, TimeUnit.SECONDS)).isTrue();

        // When: A 完成重新載入後才放行 B
        gatedCache.getPrice("gpt-4o", "openai");
        gatedClock.release.countDown();
        ModelPricing seenByB = threadB.get(5, TimeUnit.SECONDS);
        pool.shutdown();

        // Then: 初次載入 + A 的一次重新載入，B 直接使用 A 的結果
        assertThat(seenByB.inputPricePer1kTokens()).isEqualByComparingTo("0.002");
        verify(repository, times(2)).findByProviderIdAndModelIdAndActiveTrue("openai", "gpt-4o");
    }

    private static ModelPricing pricing(String modelId, String input, String output) {
        return ModelPricing.create(modelId, "openai", new BigDecimal(input), new BigDecimal(output),
            "openai-static", NOW);
    }

    /**
     * 讓指定執行緒下一次讀取時間時暫停，直到測試放行。
     */
    private static class GatedClock extends MutableClock {

        private final ThreadLocal<Boolean> parkNext = ThreadLocal.withInitial(() -> false);
        final CountDownLatch parked = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        GatedClock(Instant start) {
            super(start);
        }

        void parkNextCall() {
            parkNext.set(true);
        }

        @Override
        public Instant instant() {
            if (parkNext.get()) {
                parkNext.set(false);
                parked.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return super.instant();
        }
    }
}
