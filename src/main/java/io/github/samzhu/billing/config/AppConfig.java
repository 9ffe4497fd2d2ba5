package io.github.samzhu.billing.config;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import io.github.samzhu.billing.service.FetchLatencyService;
import io.github.samzhu.billing.service.provider.PricingProvider;
import io.github.samzhu.billing.service.provider.ProviderRegistry;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link BillingProperties} 的型別安全配置綁定，並註冊跨服務共用的元件：
 * <ul>
 *   <li>{@link Clock} - 所有時間戳記的來源，測試可替換為固定時鐘</li>
 *   <li>{@link ProviderRegistry} - 啟動時建立一次，透過 constructor injection 傳遞</li>
 *   <li>供應商抓取執行緒池 - 每個供應商一個獨立任務</li>
 * </ul>
 *
 * @see BillingProperties
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html#features.external-config.typesafe-configuration-properties.enabling-annotated-types">Enabling @ConfigurationProperties</a>
 */
@Configuration
@EnableConfigurationProperties(BillingProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 供應商註冊表。
     *
     * <p>收集所有 {@link PricingProvider} Bean，建立唯一的註冊表實例，
     * 由 {@code SyncOrchestratorService} 與 API 控制器共用。
     */
    @Bean
    public ProviderRegistry providerRegistry(List<PricingProvider> providers, FetchLatencyService latencyService) {
        ProviderRegistry registry = new ProviderRegistry(latencyService);
        providers.forEach(registry::register);
        return registry;
    }

    /**
     * 供應商抓取專用執行緒池。
     *
     * <p>逾時的抓取任務會被中斷並放棄，因此使用 cached pool 避免慢速供應商佔滿固定執行緒。
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pricingFetchExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("pricing-fetch-"));
    }
}
