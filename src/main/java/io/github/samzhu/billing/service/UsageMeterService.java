package io.github.samzhu.billing.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.document.LedgerTransaction;
import io.github.samzhu.billing.document.ModelPricing;
import io.github.samzhu.billing.document.UsageRecord;
import io.github.samzhu.billing.document.UsageRecord.UsageLine;
import io.github.samzhu.billing.document.UsageStatus;
import io.github.samzhu.billing.document.UserBalance;
import io.github.samzhu.billing.dto.ChargeResult;
import io.github.samzhu.billing.dto.PreflightResult;
import io.github.samzhu.billing.dto.UsageCharge;
import io.github.samzhu.billing.exception.IdempotencyConflictException;
import io.github.samzhu.billing.exception.InsufficientBalanceException;
import io.github.samzhu.billing.exception.InvalidUsageException;
import io.github.samzhu.billing.exception.NoPricingException;
import io.github.samzhu.billing.repository.UsageRecordRepository;
import io.github.samzhu.billing.service.alert.AlertService;
import io.github.samzhu.billing.util.MoneyUtils;

/**
 * 用量計費服務。
 *
 * <p>處理流程：
 * <ol>
 *   <li>驗證 token 計數：皆 &gt;= 0、{@code totalTokens = inputTokens + outputTokens} 且大於 0</li>
 *   <li>同一 {@code requestId} 已有用量紀錄時直接回傳原結果</li>
 *   <li>透過 {@link PricingCacheService} 取得定價，找不到則拒絕，不以估計價格扣款</li>
 *   <li>計算成本並四捨五入到 6 位小數；大於 0 但捨入為 0 的成本以最小單位 0.000001 計</li>
 *   <li>先扣款，再寫入用量紀錄</li>
 *   <li>扣款成功但紀錄寫入失敗時，不重試扣款，改寫入 {@code RECONCILIATION_PENDING} 紀錄並發出嚴重告警</li>
 * </ol>
 *
 * <p>成本公式：
 * <pre>
 * cost = round6(inputTokens / 1000 × inputPrice + outputTokens / 1000 × outputPrice)
 * </pre>
 */
@Service
public class UsageMeterService {

    private static final Logger log = LoggerFactory.getLogger(UsageMeterService.class);

    private final UsageRecordRepository usageRecordRepository;
    private final PricingCacheService pricingCache;
    private final BalanceLedgerService ledger;
    private final AlertService alertService;
    private final BigDecimal preflightMinimumBalance;
    private final Clock clock;

    public UsageMeterService(
            UsageRecordRepository usageRecordRepository,
            PricingCacheService pricingCache,
            BalanceLedgerService ledger,
            AlertService alertService,
            BillingProperties properties,
            Clock clock) {
        this.usageRecordRepository = usageRecordRepository;
        this.pricingCache = pricingCache;
        this.ledger = ledger;
        this.alertService = alertService;
        this.preflightMinimumBalance = properties.ledger().preflightMinimumBalance();
        this.clock = clock;
    }

    /**
     * 記錄用量並扣款。
     *
     * @see #recordAndCharge(UsageCharge)
     */
    public ChargeResult recordAndCharge(String userId, String chatId, String modelId, String providerId,
            long inputTokens, long outputTokens, long totalTokens, String requestId) {
        return recordAndCharge(new UsageCharge(userId, chatId, modelId, providerId,
            inputTokens, outputTokens, totalTokens, requestId));
    }

    /**
     * 記錄用量並扣款。
     *
     * @param charge 計費指令
     * @return 計費結果；{@code status = RECONCILIATION_PENDING} 時扣款已成功但紀錄需要人工對帳
     * @throws InvalidUsageException 若 token 計數不合法（不會有任何帳本異動）
     * @throws NoPricingException 若找不到定價
     * @throws InsufficientBalanceException 若餘額不足
     * @throws IdempotencyConflictException 若 requestId 已被其他用戶使用
     * @throws io.github.samzhu.billing.exception.LedgerPersistenceException 若扣款寫入失敗
     */
    public ChargeResult recordAndCharge(UsageCharge charge) {
        validate(charge);

        Optional<UsageRecord> recorded = usageRecordRepository.findByRequestId(charge.requestId());
        if (recorded.isPresent()) {
            return replay(recorded.get(), charge);
        }

        ModelPricing pricing;
        try {
            pricing = pricingCache.getPrice(charge.modelId(), charge.providerId());
        } catch (NoPricingException e) {
            log.error("Usage rejected, no pricing: userId={}, provider={}, model={}, requestId={}",
                charge.userId(), charge.providerId(), charge.modelId(), charge.requestId());
            throw e;
        }

        BigDecimal cost = calculateCost(charge.inputTokens(), charge.outputTokens(), pricing);

        LedgerTransaction tx;
        try {
            tx = ledger.debit(charge.userId(), cost, charge.requestId(),
                "Usage: " + pricing.key(), debitMetadata(charge));
        } catch (InsufficientBalanceException e) {
            log.warn("Usage rejected, insufficient balance: userId={}, balance={}, cost={}, requestId={}",
                charge.userId(), e.getBalance(), cost, charge.requestId());
            throw e;
        }

        // 重播的扣款以原交易金額為準
        UsageLine line = new UsageLine(charge.userId(), charge.chatId(), charge.modelId(), charge.providerId(),
            charge.inputTokens(), charge.outputTokens(), charge.totalTokens(),
            pricing.inputPricePer1kTokens(), pricing.outputPricePer1kTokens(), tx.amount(), charge.requestId());

        try {
            UsageRecord saved = usageRecordRepository.save(UsageRecord.completed(line, tx.id(), clock.instant()));
            log.info("Usage charged: userId={}, model={}, tokens={}, cost={}, txId={}, requestId={}",
                charge.userId(), pricing.key(), charge.totalTokens(), tx.amount(), tx.id(), charge.requestId());
            return ChargeResult.of(saved, false);
        } catch (DuplicateKeyException e) {
            Optional<UsageRecord> concurrent = usageRecordRepository.findByRequestId(charge.requestId());
            if (concurrent.isPresent()) {
                return replay(concurrent.get(), charge);
            }
            return markReconciliationPending(line, tx, e);
        } catch (DataAccessException e) {
            return markReconciliationPending(line, tx, e);
        }
    }

    /**
     * 回傳已記錄的計費結果；requestId 屬於其他用戶時視為冪等鍵衝突。
     */
    private ChargeResult replay(UsageRecord recorded, UsageCharge charge) {
        if (!recorded.userId().equals(charge.userId())) {
            log.warn("Usage report requestId reused by another user: requestId={}, owner={}, userId={}",
                charge.requestId(), recorded.userId(), charge.userId());
            throw new IdempotencyConflictException(charge.requestId(), String.format(
                "usage record %s belongs to user %s", recorded.id(), recorded.userId()));
        }
        log.info("Duplicate usage report ignored: requestId={}, usageRecordId={}",
            charge.requestId(), recorded.id());
        return ChargeResult.of(recorded, true);
    }

    /**
     * 對話開始前的餘額預檢。
     *
     * <p>只看目前餘額是否達到下限，與下一輪的實際成本無關。
     */
    public PreflightResult checkPreflight(String userId) {
        UserBalance balance = ledger.getBalance(userId);
        boolean allowed = balance.balance().compareTo(preflightMinimumBalance) >= 0;
        if (!allowed) {
            log.debug("Preflight denied: userId={}, balance={}, minimum={}",
                userId, balance.balance(), preflightMinimumBalance);
        }
        return new PreflightResult(allowed, balance.balance(), preflightMinimumBalance, balance.currency());
    }

    /**
     * 依定價計算成本。
     */
    public BigDecimal calculateCost(long inputTokens, long outputTokens, ModelPricing pricing) {
        BigDecimal raw = MoneyUtils.tokenCost(inputTokens, pricing.inputPricePer1kTokens())
            .add(MoneyUtils.tokenCost(outputTokens, pricing.outputPricePer1kTokens()));
        BigDecimal cost = MoneyUtils.round6(raw);
        return cost.signum() > 0 ? cost : MoneyUtils.MINIMUM_UNIT;
    }

    // ========== 內部 ==========

    private ChargeResult markReconciliationPending(UsageLine line, LedgerTransaction tx, DataAccessException cause) {
        String reason = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        log.error("CRITICAL: usage record write failed after successful debit, reconciliation required: "
                + "userId={}, requestId={}, txId={}, cost={}, error={}",
            line.userId(), line.requestId(), tx.id(), line.totalCost(), cause.getMessage());
        alertService.critical("Usage record write failed after debit", String.format(
            "userId=%s requestId=%s transactionId=%s cost=%s error=%s",
            line.userId(), line.requestId(), tx.id(), line.totalCost().toPlainString(), reason));

        try {
            UsageRecord flagged = usageRecordRepository.save(
                UsageRecord.reconciliationPending(line, tx.id(), reason, clock.instant()));
            return ChargeResult.of(flagged, false);
        } catch (DataAccessException e) {
            log.error("CRITICAL: reconciliation marker could not be persisted: userId={}, requestId={}, txId={}, error={}",
                line.userId(), line.requestId(), tx.id(), e.getMessage());
            return new ChargeResult(line.totalCost(), null, tx.id(), UsageStatus.RECONCILIATION_PENDING, false);
        }
    }

    private static Map<String, Object> debitMetadata(UsageCharge charge) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("providerId", charge.providerId());
        metadata.put("modelId", charge.modelId());
        if (charge.chatId() != null) {
            metadata.put("chatId", charge.chatId());
        }
        metadata.put("inputTokens", charge.inputTokens());
        metadata.put("outputTokens", charge.outputTokens());
        return metadata;
    }

    private static void validate(UsageCharge charge) {
        requireText(charge.userId(), "userId");
        requireText(charge.modelId(), "modelId");
        requireText(charge.providerId(), "providerId");
        requireText(charge.requestId(), "requestId");

        if (charge.inputTokens() < 0 || charge.outputTokens() < 0 || charge.totalTokens() < 0) {
            throw new InvalidUsageException(String.format(
                "Token counts must be >= 0: input=%d, output=%d, total=%d",
                charge.inputTokens(), charge.outputTokens(), charge.totalTokens()));
        }
        long sum;
        try {
            sum = Math.addExact(charge.inputTokens(), charge.outputTokens());
        } catch (ArithmeticException e) {
            throw new InvalidUsageException("Token counts overflow");
        }
        if (sum != charge.totalTokens()) {
            throw new InvalidUsageException(String.format(
                "totalTokens (%d) must equal inputTokens (%d) + outputTokens (%d)",
                charge.totalTokens(), charge.inputTokens(), charge.outputTokens()));
        }
        if (charge.totalTokens() == 0) {
            throw new InvalidUsageException("Usage without tokens is not billable");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidUsageException(field + " is required");
        }
    }
}
