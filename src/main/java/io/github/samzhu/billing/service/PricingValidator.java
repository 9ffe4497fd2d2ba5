package io.github.samzhu.billing.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import io.github.samzhu.billing.dto.ValidationResult;
import io.github.samzhu.billing.util.MoneyUtils;

/**
 * 定價資料驗證器。
 *
 * <p>在套用任何價格變更前檢查數值是否合理，避免解析錯誤造成 $0 或異常高價：
 * <pre>
 * 錯誤（不得自動套用）：
 *   價格 &lt;= 0 或 &gt; 100 (USD / 1k tokens)
 *   漲幅 &gt; 200%
 *   跌幅 &gt; 90%
 * 警告（審核參考）：
 *   價格 &lt; 0.00001
 *   輸出價格低於輸入價格
 *   漲幅介於 50% 到 200%，或跌幅介於 50% 到 90%
 * </pre>
 */
@Component
public class PricingValidator {

    static final BigDecimal MAX_PRICE_PER_1K = new BigDecimal("100");
    static final BigDecimal MIN_REASONABLE_PRICE_PER_1K = new BigDecimal("0.00001");

    private static final BigDecimal MAX_INCREASE_PERCENT = new BigDecimal("200");
    private static final BigDecimal MAX_DECREASE_PERCENT = new BigDecimal("-90");
    private static final BigDecimal WARN_INCREASE_PERCENT = new BigDecimal("50");
    private static final BigDecimal WARN_DECREASE_PERCENT = new BigDecimal("-50");

    private final Clock clock;

    public PricingValidator(Clock clock) {
        this.clock = clock;
    }

    /**
     * 驗證單一模型的價格。
     */
    public ValidationResult validatePrice(String modelId, String providerId,
            BigDecimal inputPrice, BigDecimal outputPrice) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (modelId == null || modelId.isBlank()) {
            errors.add("Model ID is required");
        }
        if (providerId == null || providerId.isBlank()) {
            errors.add("Provider ID is required");
        }
        checkPrice("Input", inputPrice, errors, warnings);
        checkPrice("Output", outputPrice, errors, warnings);

        if (inputPrice != null && outputPrice != null && outputPrice.compareTo(inputPrice) < 0) {
            warnings.add(String.format("Output price (%s) < input price (%s) - unusual but may be correct",
                outputPrice.toPlainString(), inputPrice.toPlainString()));
        }

        return ValidationResult.of(errors, warnings);
    }

    /**
     * 驗證價格變更（舊值 → 新值）。沒有舊價格時只驗證新價格。
     */
    public ValidationResult validateChange(String modelId, String providerId,
            BigDecimal oldInputPrice, BigDecimal oldOutputPrice,
            BigDecimal newInputPrice, BigDecimal newOutputPrice) {
        ValidationResult base = validatePrice(modelId, providerId, newInputPrice, newOutputPrice);
        if (oldInputPrice == null || oldOutputPrice == null || newInputPrice == null || newOutputPrice == null) {
            return base;
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        checkChange("Input", oldInputPrice, newInputPrice, errors, warnings);
        checkChange("Output", oldOutputPrice, newOutputPrice, errors, warnings);
        return base.merge(ValidationResult.of(errors, warnings));
    }

    /**
     * 判斷定價是否超過驗證期限。從未驗證過的定價視為過期。
     */
    public boolean isStale(Instant lastVerifiedAt, Duration maxAge) {
        if (lastVerifiedAt == null) {
            return true;
        }
        return lastVerifiedAt.plus(maxAge).isBefore(clock.instant());
    }

    private static void checkPrice(String side, BigDecimal price, List<String> errors, List<String> warnings) {
        if (price == null) {
            errors.add(side + " price is required");
            return;
        }
        if (price.signum() <= 0) {
            errors.add(String.format("%s price must be > 0, got %s", side, price.toPlainString()));
            return;
        }
        if (price.compareTo(MAX_PRICE_PER_1K) > 0) {
            errors.add(String.format("%s price suspiciously high: $%s > $%s",
                side, price.toPlainString(), MAX_PRICE_PER_1K));
        }
        if (price.compareTo(MIN_REASONABLE_PRICE_PER_1K) < 0) {
            warnings.add(String.format("%s price very low: $%s < $%s",
                side, price.toPlainString(), MIN_REASONABLE_PRICE_PER_1K.toPlainString()));
        }
    }

    private static void checkChange(String side, BigDecimal oldPrice, BigDecimal newPrice,
            List<String> errors, List<String> warnings) {
        if (oldPrice.signum() <= 0) {
            return;
        }
        BigDecimal percent = MoneyUtils.changePercent(oldPrice, newPrice);
        String shown = percent.abs().setScale(1, RoundingMode.HALF_UP).toPlainString();

        if (percent.compareTo(MAX_INCREASE_PERCENT) > 0) {
            errors.add(String.format("%s price increased by %s%% - this seems incorrect", side, shown));
        } else if (percent.compareTo(MAX_DECREASE_PERCENT) < 0) {
            errors.add(String.format("%s price decreased by %s%% - this seems incorrect", side, shown));
        } else if (percent.compareTo(WARN_INCREASE_PERCENT) > 0) {
            warnings.add(String.format("%s price increased by %s%% - please verify", side, shown));
        } else if (percent.compareTo(WARN_DECREASE_PERCENT) < 0) {
            warnings.add(String.format("%s price decreased by %s%% - please verify", side, shown));
        }
    }
}
