package io.github.samzhu.billing.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Billing 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link LedgerConfig} - 帳本設定，控制幣別、重試次數與預檢餘額下限</li>
 *   <li>{@link PricingConfig} - 定價快取 TTL 與內建預設價目表</li>
 *   <li>{@link SyncConfig} - 定價同步排程、自動套用門檻與健康度判斷</li>
 *   <li>{@link ProviderConfig} - 各供應商的啟用狀態、價格來源與退避策略</li>
 *   <li>{@link AlertConfig} - 告警通道設定</li>
 *   <li>{@link LatencyConfig} - 供應商抓取延遲百分位計算設定 (T-Digest)</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * billing:
 *   ledger:
 *     default-currency: USD
 *     max-attempts: 3
 *     preflight-minimum-balance: 0.01
 *   pricing:
 *     cache-ttl: 300s
 *     default-prices:
 *       "[openai:gpt-4o-mini]":
 *         input-per1k: 0.00015
 *         output-per1k: 0.0006
 *   sync:
 *     enabled: false
 *     cron: "0 0 *&#47;6 * * *"
 *     auto-apply-threshold: 10
 *   providers:
 *     anthropic:
 *       enabled: true
 *       feed-url: https://pricing.example.com/anthropic.json
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "billing")
public record BillingProperties(
    LedgerConfig ledger,
    PricingConfig pricing,
    SyncConfig sync,
    Map<String, ProviderConfig> providers,
    AlertConfig alerts,
    LatencyConfig latency
) {
    public BillingProperties {
        if (ledger == null) {
            ledger = LedgerConfig.defaults();
        }
        if (pricing == null) {
            pricing = PricingConfig.defaults();
        }
        if (sync == null) {
            sync = SyncConfig.defaults();
        }
        if (providers == null) {
            providers = Map.of();
        }
        if (alerts == null) {
            alerts = AlertConfig.defaults();
        }
        if (latency == null) {
            latency = LatencyConfig.defaults();
        }
    }

    /**
     * 取得指定供應商的設定，未設定時回傳預設值。
     *
     * @param providerId 供應商 ID，例如 {@code openai}
     * @return 供應商設定
     */
    public ProviderConfig provider(String providerId) {
        ProviderConfig config = providers.get(providerId);
        return config != null ? config : ProviderConfig.defaults();
    }

    /**
     * 帳本設定。
     *
     * <p>控制 {@link io.github.samzhu.billing.service.BalanceLedgerService} 的行為：
     * <ul>
     *   <li>餘額變更採 version compare-and-swap，衝突時最多重試 {@code maxAttempts} 次</li>
     *   <li>每次重試前等待 {@code retryBackoff × attempt}</li>
     *   <li>同一 JVM 內以 {@code lockStripes} 個分段鎖依 userId 序列化</li>
     * </ul>
     *
     * @param defaultCurrency 新帳戶的預設幣別（僅作標記，不做匯率換算），預設 USD
     * @param maxAttempts 樂觀鎖衝突時的最大嘗試次數，預設 3
     * @param retryBackoff 重試退避基準時間，預設 20ms
     * @param lockStripes 分段鎖數量，預設 256
     * @param preflightMinimumBalance 對話開始前的最低餘額，預設 0.01
     */
    public record LedgerConfig(
        String defaultCurrency,
        int maxAttempts,
        Duration retryBackoff,
        int lockStripes,
        BigDecimal preflightMinimumBalance
    ) {
        public LedgerConfig {
            if (defaultCurrency == null || defaultCurrency.isBlank()) {
                defaultCurrency = "USD";
            }
            if (maxAttempts <= 0) {
                maxAttempts = 3;
            }
            if (retryBackoff == null || retryBackoff.isNegative()) {
                retryBackoff = Duration.ofMillis(20);
            }
            if (lockStripes <= 0) {
                lockStripes = 256;
            }
            if (preflightMinimumBalance == null) {
                preflightMinimumBalance = new BigDecimal("0.01");
            }
        }

        /**
         * 建立預設帳本設定。
         */
        public static LedgerConfig defaults() {
            return new LedgerConfig("USD", 3, Duration.ofMillis(20), 256, new BigDecimal("0.01"));
        }
    }

    /**
     * 定價快取設定。
     *
     * <p>查價的 fallback 順序：快取 → {@code model_pricing} → {@code defaultPrices} → NoPricing。
     *
     * @param cacheTtl 快取有效時間，預設 300 秒
     * @param serveStaleWhileRefreshing 其他執行緒正在刷新時，是否直接回傳過期值
     * @param seedOnStartup {@code model_pricing} 為空時是否以 {@code defaultPrices} 初始化
     * @param defaultPrices 內建預設價目表，key 為 {@code providerId:modelId}
     */
    public record PricingConfig(
        Duration cacheTtl,
        boolean serveStaleWhileRefreshing,
        boolean seedOnStartup,
        Map<String, DefaultPrice> defaultPrices
    ) {
        public PricingConfig {
            if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero()) {
                cacheTtl = Duration.ofSeconds(300);
            }
            if (defaultPrices == null) {
                defaultPrices = Map.of();
            }
        }

        /**
         * 建立預設定價設定。
         */
        public static PricingConfig defaults() {
            return new PricingConfig(Duration.ofSeconds(300), true, true, Map.of());
        }
    }

    /**
     * 每千 tokens 的預設價格 (USD)。
     *
     * @param inputPer1k 輸入單價
     * @param outputPer1k 輸出單價
     */
    public record DefaultPrice(
        BigDecimal inputPer1k,
        BigDecimal outputPer1k
    ) {}

    /**
     * 定價同步設定。
     *
     * @param enabled 是否啟用排程同步
     * @param cron 排程 Cron 表達式，預設每 6 小時
     * @param minInterval 兩次排程同步的最小間隔，預設 1 小時
     * @param autoApplyThreshold 自動套用的變動百分比上限，預設 10
     * @param autoApplyNewModels 新模型是否可自動建立，預設 false
     * @param staleAfter 定價未驗證超過此時間視為過期，預設 7 天
     * @param reviewStaleAfter 待審變更超過此時間影響健康度，預設 72 小時
     * @param providerTimeout 單一供應商抓取逾時，預設 30 秒
     */
    public record SyncConfig(
        boolean enabled,
        String cron,
        Duration minInterval,
        BigDecimal autoApplyThreshold,
        boolean autoApplyNewModels,
        Duration staleAfter,
        Duration reviewStaleAfter,
        Duration providerTimeout
    ) {
        public SyncConfig {
            if (cron == null || cron.isBlank()) {
                cron = "0 0 */6 * * *";
            }
            if (minInterval == null || minInterval.isNegative()) {
                minInterval = Duration.ofHours(1);
            }
            if (autoApplyThreshold == null || autoApplyThreshold.signum() < 0) {
                autoApplyThreshold = BigDecimal.TEN;
            }
            if (staleAfter == null || staleAfter.isNegative() || staleAfter.isZero()) {
                staleAfter = Duration.ofDays(7);
            }
            if (reviewStaleAfter == null || reviewStaleAfter.isNegative() || reviewStaleAfter.isZero()) {
                reviewStaleAfter = Duration.ofHours(72);
            }
            if (providerTimeout == null || providerTimeout.isNegative() || providerTimeout.isZero()) {
                providerTimeout = Duration.ofSeconds(30);
            }
        }

        /**
         * 建立預設同步設定（排程關閉）。
         */
        public static SyncConfig defaults() {
            return new SyncConfig(false, "0 0 */6 * * *", Duration.ofHours(1), BigDecimal.TEN,
                false, Duration.ofDays(7), Duration.ofHours(72), Duration.ofSeconds(30));
        }
    }

    /**
     * 單一供應商設定。
     *
     * <p>未設定 {@code feedUrl} 時，供應商只使用內建靜態價目表。
     * 連續失敗達 {@code failureThreshold} 次後，以 {@code backoff} 為基準指數退避。
     *
     * @param enabled 是否啟用
     * @param feedUrl JSON 價格來源 URL，可為 null
     * @param failureThreshold 觸發退避的連續失敗次數，預設 3
     * @param backoff 退避基準時間，預設 5 分鐘
     */
    public record ProviderConfig(
        boolean enabled,
        String feedUrl,
        int failureThreshold,
        Duration backoff
    ) {
        public ProviderConfig {
            if (failureThreshold <= 0) {
                failureThreshold = 3;
            }
            if (backoff == null || backoff.isNegative()) {
                backoff = Duration.ofMinutes(5);
            }
        }

        /**
         * 建立預設供應商設定（啟用、無外部來源）。
         */
        public static ProviderConfig defaults() {
            return new ProviderConfig(true, null, 3, Duration.ofMinutes(5));
        }
    }

    /**
     * 告警設定。
     *
     * @param slackWebhookUrl Slack Incoming Webhook URL，未設定則不發送
     * @param applicationUrl 告警訊息中附帶的管理介面連結
     */
    public record AlertConfig(
        String slackWebhookUrl,
        String applicationUrl
    ) {
        public AlertConfig {
            if (applicationUrl == null || applicationUrl.isBlank()) {
                applicationUrl = "http://localhost:8080";
            }
        }

        /**
         * 建立預設告警設定（只輸出日誌）。
         */
        public static AlertConfig defaults() {
            return new AlertConfig(null, "http://localhost:8080");
        }
    }

    /**
     * 延遲百分位計算設定。
     *
     * @param digestCompression T-Digest 壓縮因子，預設 100
     */
    public record LatencyConfig(
        int digestCompression
    ) {
        public LatencyConfig {
            if (digestCompression <= 0) {
                digestCompression = 100;
            }
        }

        /**
         * 建立預設延遲設定。
         */
        public static LatencyConfig defaults() {
            return new LatencyConfig(100);
        }
    }
}
