package io.github.samzhu.billing.config;

import org.springframework.aot.hint.MemberCategory;
import org.springframework.aot.hint.RuntimeHints;
import org.springframework.aot.hint.RuntimeHintsRegistrar;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.ImportRuntimeHints;

import io.github.samzhu.billing.document.LedgerTransaction;
import io.github.samzhu.billing.document.ModelPricing;
import io.github.samzhu.billing.document.PendingPricingChange;
import io.github.samzhu.billing.document.PricingChange;
import io.github.samzhu.billing.document.SyncLog;
import io.github.samzhu.billing.document.UsageRecord;
import io.github.samzhu.billing.document.UserBalance;
import io.github.samzhu.billing.dto.BalanceAudit;
import io.github.samzhu.billing.dto.ChangeSet;
import io.github.samzhu.billing.dto.ChargeResult;
import io.github.samzhu.billing.dto.DetectedChange;
import io.github.samzhu.billing.dto.HealthReport;
import io.github.samzhu.billing.dto.PreflightResult;
import io.github.samzhu.billing.dto.ProviderFetchResult;
import io.github.samzhu.billing.dto.ProviderStatus;
import io.github.samzhu.billing.dto.SyncResult;
import io.github.samzhu.billing.dto.SyncStatus;
import io.github.samzhu.billing.dto.TransactionStats;
import io.github.samzhu.billing.dto.UsageReportData;
import io.github.samzhu.billing.dto.UsageSummary;
import io.github.samzhu.billing.dto.ValidationResult;
import io.github.samzhu.billing.dto.api.AdjustmentRequest;
import io.github.samzhu.billing.dto.api.BalanceResponse;
import io.github.samzhu.billing.dto.api.DepositRequest;
import io.github.samzhu.billing.dto.api.RefundRequest;
import io.github.samzhu.billing.dto.api.ReviewDecisionRequest;
import io.github.samzhu.billing.dto.api.SyncRequest;
import io.github.samzhu.billing.dto.api.UsageReportRequest;
import io.github.samzhu.billing.service.FetchLatencyService;
import io.github.samzhu.billing.service.provider.PriceFeed;

/**
 * GraalVM Native Image 執行時期提示配置。
 *
 * <p>註冊 Jackson 與 Spring Data 需要反射存取的 record：
 * <ul>
 *   <li>{@link UsageReportData} - CloudEvent payload</li>
 *   <li>{@link PriceFeed} - 供應商 JSON 價目表</li>
 *   <li>MongoDB 文件與 REST 請求、回應</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/native-image/introducing-graalvm-native-images.html">Spring Boot Native Image Support</a>
 */
@Configuration
@ImportRuntimeHints(NativeHintsConfig.BillingRuntimeHints.class)
public class NativeHintsConfig {

    static class BillingRuntimeHints implements RuntimeHintsRegistrar {

        @Override
        public void registerHints(RuntimeHints hints, ClassLoader classLoader) {
            // 訊息與外部資料
            hints.reflection()
                .registerType(UsageReportData.class, MemberCategory.values())
                .registerType(PriceFeed.class, MemberCategory.values())
                .registerType(PriceFeed.Entry.class, MemberCategory.values());

            // MongoDB 文件
            hints.reflection()
                .registerType(UserBalance.class, MemberCategory.values())
                .registerType(LedgerTransaction.class, MemberCategory.values())
                .registerType(UsageRecord.class, MemberCategory.values())
                .registerType(ModelPricing.class, MemberCategory.values())
                .registerType(PricingChange.class, MemberCategory.values())
                .registerType(PendingPricingChange.class, MemberCategory.values())
                .registerType(SyncLog.class, MemberCategory.values());

            // REST 請求
            hints.reflection()
                .registerType(DepositRequest.class, MemberCategory.values())
                .registerType(AdjustmentRequest.class, MemberCategory.values())
                .registerType(RefundRequest.class, MemberCategory.values())
                .registerType(UsageReportRequest.class, MemberCategory.values())
                .registerType(SyncRequest.class, MemberCategory.values())
                .registerType(ReviewDecisionRequest.class, MemberCategory.values());

            // REST 回應
            hints.reflection()
                .registerType(BalanceResponse.class, MemberCategory.values())
                .registerType(BalanceAudit.class, MemberCategory.values())
                .registerType(TransactionStats.class, MemberCategory.values())
                .registerType(PreflightResult.class, MemberCategory.values())
                .registerType(ChargeResult.class, MemberCategory.values())
                .registerType(UsageSummary.class, MemberCategory.values())
                .registerType(UsageSummary.ModelUsage.class, MemberCategory.values())
                .registerType(SyncResult.class, MemberCategory.values())
                .registerType(SyncResult.ProviderSummary.class, MemberCategory.values())
                .registerType(SyncResult.ChangeSummary.class, MemberCategory.values())
                .registerType(ChangeSet.class, MemberCategory.values())
                .registerType(DetectedChange.class, MemberCategory.values())
                .registerType(ValidationResult.class, MemberCategory.values())
                .registerType(ProviderFetchResult.class, MemberCategory.values())
                .registerType(SyncStatus.class, MemberCategory.values())
                .registerType(HealthReport.class, MemberCategory.values())
                .registerType(ProviderStatus.class, MemberCategory.values())
                .registerType(FetchLatencyService.LatencyStats.class, MemberCategory.values());
        }
    }
}
