package io.github.samzhu.billing.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.config.BillingProperties.SyncConfig;
import io.github.samzhu.billing.dto.AggregatedPricing;
import io.github.samzhu.billing.dto.PriceQuote;
import io.github.samzhu.billing.dto.ProviderFetchResult;
import io.github.samzhu.billing.support.StubPricingProvider;

class ProviderAggregatorServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ExecutorService executor;
    private FetchLatencyService latencyService;
    private ProviderAggregatorService aggregator;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        BillingProperties properties = new BillingProperties(null, null,
            new SyncConfig(false, null, null, null, false, null, null, Duration.ofMillis(300)), null, null, null);
        latencyService = new FetchLatencyService(properties);
        aggregator = new ProviderAggregatorService(executor, latencyService, properties,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldMergeQuotesFromSuccessfulProviders() {
        // Given
        StubPricingProvider openai = new StubPricingProvider("openai").returning("gpt-4o", "0.0025", "0.01");
        StubPricingProvider anthropic = new StubPricingProvider("anthropic")
            .returning("claude-3-haiku", "0.00025", "0.00125", "claude-3-opus", "0.015", "0.075");

        // When
        AggregatedPricing aggregated = aggregator.fetchAll(List.of(openai, anthropic));

        // Then
        assertThat(aggregated.quotes()).extracting(PriceQuote::key)
            .containsExactly("openai:gpt-4o", "anthropic:claude-3-haiku", "anthropic:claude-3-opus");
        assertThat(aggregated.successfulProviders()).containsExactlyInAnyOrder("openai", "anthropic");
        assertThat(latencyService.stats("openai").count()).isEqualTo(1);
    }

    @Test
    void shouldKeepOtherProvidersWhenOneFails() {
        // Given
        StubPricingProvider openai = new StubPricingProvider("openai").failing("HTTP 500");
        StubPricingProvider google = new StubPricingProvider("google").returning("gemini-1.5-pro", "0.00125", "0.005");
        StubPricingProvider broken = new StubPricingProvider("broken").behaving(() -> {
            throw new IllegalStateException("parser bug");
        });

        // When
        AggregatedPricing aggregated = aggregator.fetchAll(List.of(openai, google, broken));

        // Then
        assertThat(aggregated.successfulProviders()).containsExactly("google");
        assertThat(aggregated.failedProviders()).containsExactlyInAnyOrder("openai", "broken");
        assertThat(aggregated.quotes()).hasSize(1);
        assertThat(aggregated.perProviderResult().get("broken").errors())
            .containsExactly("IllegalStateException: parser bug");
    }

    @Test
    void shouldRecordTimeoutAsFailureWithoutWaitingForSlowProvider() {
        // Given
        StubPricingProvider slow = new StubPricingProvider("slow").behaving(() -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ProviderFetchResult.success("slow", List.of(
                new PriceQuote("late", "slow", BigDecimal.ONE, BigDecimal.ONE, "slow")), "slow", NOW, List.of(), 0);
        });
        StubPricingProvider fast = new StubPricingProvider("openai").returning("gpt-4o", "0.0025", "0.01");

        // When
        long start = System.nanoTime();
        AggregatedPricing aggregated = aggregator.fetchAll(List.of(slow, fast));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        // Then
        assertThat(elapsedMs).isLessThan(5_000);
        ProviderFetchResult timedOut = aggregated.perProviderResult().get("slow");
        assertThat(timedOut.success()).isFalse();
        assertThat(timedOut.errors()).containsExactly("Timed out after 300ms");
        assertThat(aggregated.successfulProviders()).containsExactly("openai");
        assertThat(aggregated.quotes()).extracting(PriceQuote::modelId).containsExactly("gpt-4o");
    }

    @Test
    void shouldMeasureTimeoutFromEachProviderStart() {
        // Given: 單一執行緒，第二個供應商要等第一個結束才開始
        ExecutorService singleThread = Executors.newSingleThreadExecutor();
        BillingProperties properties = new BillingProperties(null, null,
            new SyncConfig(false, null, null, null, false, null, null, Duration.ofMillis(600)), null, null, null);
        ProviderAggregatorService serialAggregator = new ProviderAggregatorService(singleThread,
            new FetchLatencyService(properties), properties, Clock.fixed(NOW, ZoneOffset.UTC));
        StubPricingProvider first = new StubPricingProvider("openai").behaving(() -> sleepThenQuote("openai", 400));
        StubPricingProvider second = new StubPricingProvider("anthropic").behaving(() -> sleepThenQuote("anthropic", 400));

        try {
            // When
            AggregatedPricing aggregated = serialAggregator.fetchAll(List.of(first, second));

            // Then: 總耗時超過 600ms，但各自都在期限內完成
            assertThat(aggregated.successfulProviders()).containsExactlyInAnyOrder("openai", "anthropic");
            assertThat(aggregated.failedProviders()).isEmpty();
        } finally {
            singleThread.shutdownNow();
        }
    }

    @Test
    void shouldCancelTimedOutTask() throws Exception {
        // Given
        CountDownLatch interrupted = new CountDownLatch(1);
        StubPricingProvider slow = new StubPricingProvider("slow").behaving(() -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return ProviderFetchResult.failure("slow", "slow", NOW, "interrupted", 0);
        });

        // When
        aggregator.fetchAll(List.of(slow));

        // Then
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    private static ProviderFetchResult sleepThenQuote(String providerId, long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return ProviderFetchResult.success(providerId, List.of(
            new PriceQuote("m-" + providerId, providerId, BigDecimal.ONE, BigDecimal.ONE, providerId)),
            providerId, NOW, List.of(), millis);
    }
}
