package io.github.samzhu.billing.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.document.ChangeType;
import io.github.samzhu.billing.document.ModelPricing;
import io.github.samzhu.billing.dto.ChangeSet;
import io.github.samzhu.billing.dto.DetectedChange;
import io.github.samzhu.billing.dto.PriceQuote;
import io.github.samzhu.billing.dto.ValidationResult;
import io.github.samzhu.billing.util.MoneyUtils;

/**
 * 定價變更偵測服務。
 *
 * <p>比對供應商報價與目前生效的定價，對兩側出現過的每個 {@code (providerId, modelId)} 分類：
 * <ul>
 *   <li>NEW - 只出現在報價；預設需要審核，不會默默新增模型</li>
 *   <li>UPDATED - 兩側都有且價格不同；輸入與輸出的變動幅度都在門檻內且驗證通過才可自動套用</li>
 *   <li>REMOVED - 只出現在目前定價；一律需要審核，避免供應商暫時漏列就清掉定價</li>
 *   <li>UNCHANGED - 價格相同，只計數</li>
 * </ul>
 *
 * <p>此服務為純計算，不存取資料庫；結果依 key 排序，相同輸入產生相同結果。
 */
@Service
public class ChangeDetectorService {

    private static final Logger log = LoggerFactory.getLogger(ChangeDetectorService.class);

    private final PricingValidator validator;
    private final boolean autoApplyNewModels;

    public ChangeDetectorService(PricingValidator validator, BillingProperties properties) {
        this.validator = validator;
        this.autoApplyNewModels = properties.sync().autoApplyNewModels();
    }

    /**
     * 偵測價格變更。
     *
     * @param quotes 供應商報價
     * @param currentPricing 目前生效的定價（呼叫端負責只傳入要比對的供應商）
     * @param autoApplyThresholdPct 自動套用門檻（百分比）
     * @return 變更偵測結果
     */
    public ChangeSet detectChanges(List<PriceQuote> quotes, List<ModelPricing> currentPricing,
            BigDecimal autoApplyThresholdPct) {
        Map<String, PriceQuote> fetched = new LinkedHashMap<>();
        for (PriceQuote quote : quotes) {
            fetched.putIfAbsent(quote.key(), quote);
        }
        Map<String, ModelPricing> stored = new LinkedHashMap<>();
        for (ModelPricing pricing : currentPricing) {
            stored.putIfAbsent(pricing.key(), pricing);
        }

        TreeSet<String> keys = new TreeSet<>(fetched.keySet());
        keys.addAll(stored.keySet());

        List<DetectedChange> autoApplicable = new ArrayList<>();
        List<DetectedChange> requiresReview = new ArrayList<>();
        List<DetectedChange> unchanged = new ArrayList<>();
        int newModels = 0;
        int updatedModels = 0;
        int removedModels = 0;

        for (String key : keys) {
            PriceQuote quote = fetched.get(key);
            ModelPricing current = stored.get(key);

            DetectedChange change;
            if (current == null) {
                change = classifyNew(quote);
                newModels++;
            } else if (quote == null) {
                change = classifyRemoved(current);
                removedModels++;
            } else if (current.hasSamePrices(quote.inputPricePer1kTokens(), quote.outputPricePer1kTokens())) {
                unchanged.add(classifyUnchanged(current));
                continue;
            } else {
                change = classifyUpdated(current, quote, autoApplyThresholdPct);
                updatedModels++;
            }

            if (change.autoApplicable()) {
                autoApplicable.add(change);
            } else {
                requiresReview.add(change);
            }
        }

        String summary = String.format(
            "%d models: %d new, %d updated, %d removed, %d unchanged (%d auto-applicable, %d require review)",
            keys.size(), newModels, updatedModels, removedModels, unchanged.size(),
            autoApplicable.size(), requiresReview.size());
        log.debug("Change detection finished: {}", summary);

        return new ChangeSet(keys.size(), newModels, updatedModels, removedModels, unchanged.size(),
            autoApplicable, requiresReview, unchanged, summary);
    }

    private DetectedChange classifyNew(PriceQuote quote) {
        ValidationResult validation = validator.validatePrice(quote.modelId(), quote.providerId(),
            quote.inputPricePer1kTokens(), quote.outputPricePer1kTokens());

        boolean auto = autoApplyNewModels && validation.valid() && !validation.hasWarnings();
        List<String> reasons = new ArrayList<>();
        if (!auto) {
            reasons.add("New model requires review");
            reasons.addAll(validation.errors());
            reasons.addAll(validation.warnings());
        }

        return new DetectedChange(ChangeType.NEW, quote.modelId(), quote.providerId(),
            null, null, quote.inputPricePer1kTokens(), quote.outputPricePer1kTokens(),
            null, null, auto, !auto, validation, reasons);
    }

    private DetectedChange classifyUpdated(ModelPricing current, PriceQuote quote, BigDecimal threshold) {
        BigDecimal oldInput = current.inputPricePer1kTokens();
        BigDecimal oldOutput = current.outputPricePer1kTokens();
        BigDecimal newInput = quote.inputPricePer1kTokens();
        BigDecimal newOutput = quote.outputPricePer1kTokens();

        BigDecimal percentInput = MoneyUtils.changePercent(oldInput, newInput);
        BigDecimal percentOutput = MoneyUtils.changePercent(oldOutput, newOutput);
        ValidationResult validation = validator.validateChange(quote.modelId(), quote.providerId(),
            oldInput, oldOutput, newInput, newOutput);

        List<String> reasons = new ArrayList<>();
        if (percentInput.abs().compareTo(threshold) > 0) {
            reasons.add(String.format("Input price change %s%% exceeds threshold %s%%",
                percentInput.toPlainString(), threshold.toPlainString()));
        }
        if (percentOutput.abs().compareTo(threshold) > 0) {
            reasons.add(String.format("Output price change %s%% exceeds threshold %s%%",
                percentOutput.toPlainString(), threshold.toPlainString()));
        }
        reasons.addAll(validation.errors());

        boolean auto = reasons.isEmpty() && validation.valid();
        if (!auto) {
            reasons.addAll(validation.warnings());
        }

        return new DetectedChange(ChangeType.UPDATED, quote.modelId(), quote.providerId(),
            oldInput, oldOutput, newInput, newOutput, percentInput, percentOutput,
            auto, !auto, validation, auto ? List.of() : reasons);
    }

    private static DetectedChange classifyRemoved(ModelPricing current) {
        return new DetectedChange(ChangeType.REMOVED, current.modelId(), current.providerId(),
            current.inputPricePer1kTokens(), current.outputPricePer1kTokens(),
            current.inputPricePer1kTokens(), current.outputPricePer1kTokens(),
            null, null, false, true, null, List.of("Model no longer reported by provider"));
    }

    private static DetectedChange classifyUnchanged(ModelPricing current) {
        return new DetectedChange(ChangeType.UNCHANGED, current.modelId(), current.providerId(),
            current.inputPricePer1kTokens(), current.outputPricePer1kTokens(),
            current.inputPricePer1kTokens(), current.outputPricePer1kTokens(),
            BigDecimal.ZERO.setScale(MoneyUtils.PERCENT_SCALE), BigDecimal.ZERO.setScale(MoneyUtils.PERCENT_SCALE),
            false, false, ValidationResult.ok(), List.of());
    }
}
