package io.github.samzhu.billing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Billing Ledger Service - 多供應商 AI 對話產品的按量計費核心。
 *
 * <p>此服務負責：
 * <ul>
 *   <li>維護用戶餘額與只增不改的交易帳本 (deposit / usage / refund / adjustment)</li>
 *   <li>接收 CloudEvents 格式的 token 用量回報，換算成本並扣款</li>
 *   <li>從多個上游供應商同步模型定價，偵測變更並依門檻自動套用或送審</li>
 *   <li>提供 REST API 供付款流程、管理介面與對話管線呼叫</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * Chat pipeline → Pub/Sub → usageReportConsumer → UsageMeter → BalanceLedger → MongoDB
 *                                                     ↑
 *                                               PricingCache ← model_pricing
 *                                                                   ↑
 * Scheduler / Admin → SyncOrchestrator → ProviderAggregator → PricingProvider (×N)
 *                            ↓
 *                     ChangeDetector → apply / review queue → AlertService
 * </pre>
 *
 * @see <a href="https://cloudevents.io/">CloudEvents Specification</a>
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/">Spring Data MongoDB</a>
 */
@SpringBootApplication
@EnableScheduling
public class BillingLedgerApplication {

    private static final Logger log = LoggerFactory.getLogger(BillingLedgerApplication.class);

    public static void main(String[] args) {
        log.info("Starting Billing Ledger Service - balance ledger and pricing sync");
        SpringApplication.run(BillingLedgerApplication.class, args);
    }
}
