package io.github.samzhu.billing.service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.dto.AggregatedPricing;
import io.github.samzhu.billing.dto.PriceQuote;
import io.github.samzhu.billing.dto.ProviderFetchResult;
import io.github.samzhu.billing.service.provider.PricingProvider;

/**
 * 多供應商報價彙整服務。
 *
 * <p>所有供應商同時抓取，每個供應商各自受 {@code providerTimeout}（預設 30 秒）限制：
 * <ul>
 *   <li>逾時從該供應商實際開始執行時起算，排隊等待執行緒的時間不計入</li>
 *   <li>逾時的任務會被中斷並放棄，記錄為失敗結果，不影響其他供應商</li>
 *   <li>任一供應商失敗不會取消其他任務，等全部結束或逾時後收集成功的結果</li>
 *   <li>彙整後的報價為所有成功供應商報價的聯集</li>
 * </ul>
 */
@Service
public class ProviderAggregatorService {

    private static final Logger log = LoggerFactory.getLogger(ProviderAggregatorService.class);

    private final ExecutorService executor;
    private final FetchLatencyService latencyService;
    private final Duration providerTimeout;
    private final Clock clock;

    public ProviderAggregatorService(@Qualifier("pricingFetchExecutor") ExecutorService executor,
            FetchLatencyService latencyService, BillingProperties properties, Clock clock) {
        this.executor = executor;
        this.latencyService = latencyService;
        this.providerTimeout = properties.sync().providerTimeout();
        this.clock = clock;
    }

    /**
     * 同時抓取所有供應商的報價。
     *
     * @param providers 要抓取的供應商
     * @return 彙整結果，含每個供應商的抓取結果
     */
    public AggregatedPricing fetchAll(List<PricingProvider> providers) {
        long startNanos = System.nanoTime();

        Map<String, FetchTask> tasks = new LinkedHashMap<>();
        for (PricingProvider provider : providers) {
            FetchTask task = new FetchTask(provider);
            task.future = executor.submit(task);
            tasks.put(provider.id(), task);
        }

        Map<String, ProviderFetchResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, FetchTask> task : tasks.entrySet()) {
            String providerId = task.getKey();
            ProviderFetchResult result = await(providerId, task.getValue());
            latencyService.record(providerId, result.durationMs());
            results.put(providerId, result);
        }

        List<PriceQuote> quotes = new ArrayList<>();
        for (ProviderFetchResult result : results.values()) {
            if (result.success()) {
                quotes.addAll(result.quotes());
            }
        }

        AggregatedPricing aggregated = new AggregatedPricing(quotes, results);
        log.info("Provider fetch finished: providers={}, succeeded={}, failed={}, quotes={}, durationMs={}",
            providers.size(), aggregated.successfulProviders().size(), aggregated.failedProviders().size(),
            quotes.size(), elapsedMs(startNanos));
        return aggregated;
    }

    private ProviderFetchResult await(String providerId, FetchTask task) {
        Future<ProviderFetchResult> future = task.future;
        long waitStartNanos = System.nanoTime();
        try {
            return awaitWithinTimeout(task);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Provider fetch timed out and was abandoned: provider={}, timeoutMs={}",
                providerId, providerTimeout.toMillis());
            return ProviderFetchResult.failure(providerId, providerId, clock.instant(),
                "Timed out after " + providerTimeout.toMillis() + "ms", task.elapsedMs(waitStartNanos));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Provider fetch threw unexpectedly: provider={}, error={}", providerId, cause.toString());
            return ProviderFetchResult.failure(providerId, providerId, clock.instant(),
                cause.getClass().getSimpleName() + ": " + cause.getMessage(), task.elapsedMs(waitStartNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ProviderFetchResult.failure(providerId, providerId, clock.instant(),
                "Interrupted while waiting for provider", task.elapsedMs(waitStartNanos));
        }
    }

    /**
     * 等待任務完成，期限為任務開始執行的時間加上 {@code providerTimeout}；
     * 尚未開始的任務以目前時間估算，逾時後重新檢查。
     */
    private ProviderFetchResult awaitWithinTimeout(FetchTask task)
            throws InterruptedException, ExecutionException, TimeoutException {
        long timeoutNanos = providerTimeout.toNanos();
        while (true) {
            long taskStart = task.started ? task.startNanos : System.nanoTime();
            long remaining = Math.max(0, taskStart + timeoutNanos - System.nanoTime());
            try {
                return task.future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                if (task.started && System.nanoTime() - task.startNanos >= timeoutNanos) {
                    throw e;
                }
            }
        }
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    private static final class FetchTask implements Callable<ProviderFetchResult> {

        private final PricingProvider provider;
        private volatile boolean started;
        private volatile long startNanos;
        private Future<ProviderFetchResult> future;

        private FetchTask(PricingProvider provider) {
            this.provider = provider;
        }

        @Override
        public ProviderFetchResult call() {
            startNanos = System.nanoTime();
            started = true;
            return provider.fetchPricing();
        }

        private long elapsedMs(long fallbackStartNanos) {
            return ProviderAggregatorService.elapsedMs(started ? startNanos : fallbackStartNanos);
        }
    }
}
