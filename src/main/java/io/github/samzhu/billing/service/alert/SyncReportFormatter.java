package io.github.samzhu.billing.service.alert;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import org.springframework.stereotype.Component;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.document.ChangeType;
import io.github.samzhu.billing.dto.DetectedChange;
import io.github.samzhu.billing.dto.SyncResult;
import io.github.samzhu.billing.dto.SyncResult.ChangeSummary;
import io.github.samzhu.billing.dto.SyncResult.ProviderSummary;

/**
 * 將同步結果格式化為 Slack mrkdwn 文字。
 */
@Component
public class SyncReportFormatter {

    private static final int MAX_NOTABLE_CHANGES = 5;
    private static final int MAX_MESSAGES = 3;

    private final String applicationUrl;

    public SyncReportFormatter(BillingProperties properties) {
        this.applicationUrl = properties.alerts().applicationUrl();
    }

    public String title(SyncResult result) {
        return result.success() ? "Pricing Sync Completed Successfully" : "Pricing Sync Failed";
    }

    public String formatSyncMessage(SyncResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("*Sync:* ").append(result.syncId()).append('\n');
        sb.append("*Time:* ").append(result.completedAt()).append('\n');
        sb.append("*Duration:* ").append(result.durationMs()).append("ms\n\n");

        ProviderSummary providers = result.providers();
        sb.append("*Providers:*\n");
        sb.append("• Total: ").append(providers.total()).append('\n');
        sb.append("• Successful: ").append(providers.successful()).append('\n');
        if (providers.failed() > 0) {
            sb.append("• Failed: ").append(providers.failed()).append('\n');
        }

        ChangeSummary changes = result.changes();
        sb.append("\n*Changes:*\n");
        appendCount(sb, "Applied", changes.applied());
        appendCount(sb, "New models", changes.newModels());
        appendCount(sb, "Updated models", changes.updatedModels());
        appendCount(sb, "Removed models", changes.removedModels());
        appendCount(sb, "Skipped", changes.skipped());
        appendCount(sb, "Failed", changes.failed());

        if (result.changeSet() != null) {
            List<DetectedChange> notable = result.changeSet().autoApplicable();
            if (!notable.isEmpty() && notable.size() <= MAX_NOTABLE_CHANGES) {
                sb.append("\n*Notable Changes:*\n");
                for (DetectedChange change : notable) {
                    if (change.changeType() == ChangeType.UPDATED) {
                        sb.append("• ").append(change.key())
                            .append(": Input ").append(formatPercent(change.changePercentInput()))
                            .append(", Output ").append(formatPercent(change.changePercentOutput()))
                            .append('\n');
                    } else if (change.changeType() == ChangeType.NEW) {
                        sb.append("• ").append(change.key()).append(": Added to pricing\n");
                    }
                }
            }
        }

        appendMessages(sb, "Errors", result.errors());
        appendMessages(sb, "Warnings", result.warnings());

        if (result.health() != null) {
            sb.append("\n*Health:* ").append(result.health().status())
                .append(" (").append(result.health().healthScore()).append("/100)\n");
        }
        sb.append("\n<").append(applicationUrl).append("/api/v1/pricing/status|View sync status>");
        return sb.toString();
    }

    /**
     * 格式化變動百分比，例如 {@code +10.0%}。
     */
    static String formatPercent(BigDecimal value) {
        if (value == null) {
            return "n/a";
        }
        String sign = value.signum() > 0 ? "+" : "";
        return sign + value.setScale(1, RoundingMode.HALF_UP).toPlainString() + "%";
    }

    private static void appendCount(StringBuilder sb, String label, int count) {
        if (count > 0) {
            sb.append("• ").append(label).append(": ").append(count).append('\n');
        }
    }

    private static void appendMessages(StringBuilder sb, String label, List<String> messages) {
        if (messages.isEmpty()) {
            return;
        }
        sb.append("\n*").append(label).append(":*\n");
        messages.stream().limit(MAX_MESSAGES).forEach(m -> sb.append("• ").append(m).append('\n'));
    }
}
