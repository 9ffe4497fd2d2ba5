package io.github.samzhu.billing.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.config.BillingProperties.LedgerConfig;
import io.github.samzhu.billing.document.LedgerTransaction;
import io.github.samzhu.billing.document.TransactionType;
import io.github.samzhu.billing.document.UserBalance;
import io.github.samzhu.billing.dto.BalanceAudit;
import io.github.samzhu.billing.dto.TransactionStats;
import io.github.samzhu.billing.exception.IdempotencyConflictException;
import io.github.samzhu.billing.exception.InsufficientBalanceException;
import io.github.samzhu.billing.exception.LedgerPersistenceException;
import io.github.samzhu.billing.exception.LedgerValidationException;
import io.github.samzhu.billing.exception.TransactionNotFoundException;
import io.github.samzhu.billing.repository.LedgerStore;
import io.github.samzhu.billing.util.MoneyUtils;

/**
 * 餘額帳本服務。
 *
 * <p>所有餘額變更都經過同一條路徑：
 * <ol>
 *   <li>依 userId 取得分段鎖，同一 JVM 內同一用戶的變更依序執行</li>
 *   <li>讀取目前帳戶狀態，計算交易後餘額，扣款時檢查 {@code balance >= amount}</li>
 *   <li>以 {@link LedgerStore#commit} 原子地執行 version compare-and-swap 並追加交易</li>
 *   <li>version 衝突時最多重試 {@code maxAttempts} 次，用盡後拋出 {@link LedgerPersistenceException}</li>
 * </ol>
 *
 * <p>冪等性：
 * <ul>
 *   <li>扣款與調整以 {@code requestId} 去重，重複呼叫回傳原交易</li>
 *   <li>入帳以付款的 {@code externalRef} 去重，重複的付款確認不會重複入帳</li>
 *   <li>兩者都有唯一索引，併發競爭時由索引擋下，再回讀先寫入的交易</li>
 * </ul>
 *
 * <p>帳本只增不改：更正一律以 {@link TransactionType#ADJUSTMENT} 追加，不修改任何歷史交易。
 */
@Service
public class BalanceLedgerService {

    private static final Logger log = LoggerFactory.getLogger(BalanceLedgerService.class);

    private final LedgerStore store;
    private final LedgerConfig config;
    private final Clock clock;
    private final ReentrantLock[] stripes;

    public BalanceLedgerService(LedgerStore store, BillingProperties properties, Clock clock) {
        this.store = store;
        this.config = properties.ledger();
        this.clock = clock;
        this.stripes = new ReentrantLock[config.lockStripes()];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    // ========== 入帳 ==========

    /**
     * 入帳（外部付款確認後呼叫）。
     *
     * @param userId 用戶 ID
     * @param amount 金額，必須大於 0
     * @param currency 幣別，null 時使用帳戶幣別
     * @param externalRef 付款參考，作為冪等鍵；可為 null
     * @param metadata 附加資訊
     * @return 入帳交易；若 externalRef 已入帳過則回傳原交易
     * @throws IdempotencyConflictException 若 externalRef 已被用於不同用戶或金額
     */
    public LedgerTransaction deposit(String userId, BigDecimal amount, String currency,
            String externalRef, Map<String, Object> metadata) {
        requireUserId(userId);
        BigDecimal money = requireAmount(amount);

        if (externalRef != null) {
            var existing = store.findByExternalRef(externalRef);
            if (existing.isPresent()) {
                return replayDeposit(existing.get(), userId, money);
            }
        }

        try {
            return mutate(userId, currency, account -> {
                requireCurrency(account, currency);
                return new Entry(TransactionType.DEPOSIT, true, money, "Deposit",
                    externalRef, null, null, metadata);
            });
        } catch (DuplicateKeyException e) {
            if (externalRef == null) {
                throw new LedgerPersistenceException(userId, 1, e);
            }
            log.info("Concurrent deposit for same externalRef detected, returning committed one: externalRef={}",
                externalRef);
            return store.findByExternalRef(externalRef)
                .map(tx -> replayDeposit(tx, userId, money))
                .orElseThrow(() -> new LedgerPersistenceException(userId, 1, e));
        }
    }

    // ========== 扣款 ==========

    /**
     * 扣款。
     *
     * @see #debit(String, BigDecimal, String, String, Map)
     */
    public LedgerTransaction debit(String userId, BigDecimal amount, String requestId, String description) {
        return debit(userId, amount, requestId, description, Map.of());
    }

    /**
     * 扣款。
     *
     * <p>同一個 {@code requestId} 已有扣款交易時，直接回傳該交易，不會再次扣款。
     *
     * @param userId 用戶 ID
     * @param amount 金額，必須大於 0
     * @param requestId 冪等鍵，必填
     * @param description 描述
     * @param metadata 附加資訊
     * @return 扣款交易
     * @throws InsufficientBalanceException 若餘額小於金額（餘額保持不變）
     * @throws LedgerPersistenceException 若重試用盡或資料庫錯誤
     * @throws IdempotencyConflictException 若 requestId 已用於其他用戶或入帳類交易
     */
    public LedgerTransaction debit(String userId, BigDecimal amount, String requestId, String description,
            Map<String, Object> metadata) {
        requireUserId(userId);
        BigDecimal money = requireAmount(amount);
        requireRequestId(requestId);

        var existing = store.findByRequestId(requestId);
        if (existing.isPresent()) {
            return replayDebit(existing.get(), userId, money);
        }

        try {
            return mutate(userId, null, account -> new Entry(TransactionType.USAGE, false, money,
                description != null ? description : "Usage", null, requestId, null, metadata));
        } catch (DuplicateKeyException e) {
            log.info("Concurrent debit for same requestId detected, returning committed one: requestId={}",
                requestId);
            return store.findByRequestId(requestId)
                .map(tx -> replayDebit(tx, userId, money))
                .orElseThrow(() -> new LedgerPersistenceException(userId, 1, e));
        }
    }

    // ========== 調整 ==========

    /**
     * 追加一筆調整交易（對帳更正）。
     *
     * @param userId 用戶 ID
     * @param amount 金額，必須大於 0
     * @param credit true 為補入，false 為扣除
     * @param reason 調整原因
     * @param requestId 冪等鍵，必填
     * @param adjustedBy 執行者
     * @return 調整交易
     */
    public LedgerTransaction adjust(String userId, BigDecimal amount, boolean credit, String reason,
            String requestId, String adjustedBy) {
        requireUserId(userId);
        BigDecimal money = requireAmount(amount);
        requireRequestId(requestId);

        var existing = store.findByRequestId(requestId);
        if (existing.isPresent()) {
            return replayAdjustment(existing.get(), userId, credit);
        }

        Map<String, Object> metadata = Map.of("adjustedBy", adjustedBy != null ? adjustedBy : "system");
        try {
            LedgerTransaction tx = mutate(userId, null, account -> new Entry(TransactionType.ADJUSTMENT, credit,
                money, reason != null ? reason : "Adjustment", null, requestId, null, metadata));
            log.info("Adjustment committed: userId={}, credit={}, amount={}, adjustedBy={}",
                userId, credit, money, adjustedBy);
            return tx;
        } catch (DuplicateKeyException e) {
            return store.findByRequestId(requestId)
                .map(tx -> replayAdjustment(tx, userId, credit))
                .orElseThrow(() -> new LedgerPersistenceException(userId, 1, e));
        }
    }

    // ========== 退款 ==========

    /**
     * 對一筆扣款交易退款。
     *
     * <p>同一筆原始交易的退款總額不會超過原始金額。
     *
     * @param transactionId 原始扣款交易 ID
     * @param amount 退款金額，null 表示退還剩餘全部
     * @param reason 退款原因
     * @return 退款交易
     * @throws TransactionNotFoundException 若原始交易不存在
     * @throws LedgerValidationException 若原始交易不可退款或金額超過剩餘可退金額
     */
    public LedgerTransaction refund(String transactionId, BigDecimal amount, String reason) {
        LedgerTransaction original = store.findTransaction(transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
        if (!original.isRefundable()) {
            throw new LedgerValidationException(String.format(
                "Transaction %s of type %s cannot be refunded", transactionId, original.type()));
        }
        BigDecimal requested = amount != null ? requireAmount(amount) : null;

        LedgerTransaction tx = mutate(original.userId(), null, account -> {
            // 在鎖與 CAS 範圍內計算剩餘可退金額
            BigDecimal refunded = sum(store.findRefunds(original.id()));
            BigDecimal remaining = original.amount().subtract(refunded);
            if (remaining.signum() <= 0) {
                throw new LedgerValidationException("Transaction " + transactionId + " is already fully refunded");
            }
            BigDecimal refundAmount = requested != null ? requested : remaining;
            if (refundAmount.compareTo(remaining) > 0) {
                throw new LedgerValidationException(String.format(
                    "Refund amount %s exceeds refundable remainder %s of transaction %s",
                    refundAmount.toPlainString(), remaining.toPlainString(), transactionId));
            }
            return new Entry(TransactionType.REFUND, true, refundAmount,
                reason != null ? reason : "Refund of " + transactionId,
                null, null, original.id(), Map.of());
        });
        log.info("Refund committed: userId={}, originalTxId={}, amount={}",
            original.userId(), transactionId, tx.amount());
        return tx;
    }

    // ========== 查詢 ==========

    /**
     * 取得用戶目前餘額。
     *
     * <p>從未有交易的用戶回傳餘額 0 的帳戶（不會寫入資料庫）。
     */
    public UserBalance getBalance(String userId) {
        requireUserId(userId);
        return store.findBalance(userId)
            .orElseGet(() -> UserBalance.open(userId, config.defaultCurrency(), clock.instant()));
    }

    public Page<LedgerTransaction> listTransactions(String userId, Pageable pageable) {
        requireUserId(userId);
        return store.findTransactions(userId, pageable);
    }

    /**
     * 依類型加總用戶的交易。
     */
    public TransactionStats getTransactionStats(String userId) {
        List<LedgerTransaction> history = store.findHistory(userId);
        BigDecimal deposits = BigDecimal.ZERO;
        BigDecimal usage = BigDecimal.ZERO;
        BigDecimal refunds = BigDecimal.ZERO;
        BigDecimal adjustmentCredits = BigDecimal.ZERO;
        BigDecimal adjustmentDebits = BigDecimal.ZERO;

        for (LedgerTransaction tx : history) {
            switch (tx.type()) {
                case DEPOSIT -> deposits = deposits.add(tx.amount());
                case USAGE -> usage = usage.add(tx.amount());
                case REFUND -> refunds = refunds.add(tx.amount());
                case ADJUSTMENT -> {
                    if (tx.credit()) {
                        adjustmentCredits = adjustmentCredits.add(tx.amount());
                    } else {
                        adjustmentDebits = adjustmentDebits.add(tx.amount());
                    }
                }
            }
        }

        return new TransactionStats(userId, getBalance(userId).currency(),
            MoneyUtils.round6(deposits), MoneyUtils.round6(usage), MoneyUtils.round6(refunds),
            MoneyUtils.round6(adjustmentCredits), MoneyUtils.round6(adjustmentDebits), history.size());
    }

    /**
     * 以交易歷史重播餘額，檢查是否與目前餘額一致且交易鏈沒有斷點。
     */
    public BalanceAudit audit(String userId) {
        List<LedgerTransaction> history = store.findHistory(userId);
        BigDecimal running = BigDecimal.ZERO;
        Long firstBroken = null;

        for (LedgerTransaction tx : history) {
            BigDecimal expectedAfter = tx.balanceBefore().add(tx.signedAmount());
            boolean chained = tx.balanceBefore().compareTo(running) == 0
                && tx.balanceAfter().compareTo(expectedAfter) == 0;
            if (!chained && firstBroken == null) {
                firstBroken = tx.sequence();
            }
            running = running.add(tx.signedAmount());
        }

        BigDecimal stored = getBalance(userId).balance();
        boolean consistent = firstBroken == null && stored.compareTo(running) == 0;
        if (!consistent) {
            log.error("Ledger audit mismatch: userId={}, stored={}, replayed={}, firstBrokenSequence={}",
                userId, stored, running, firstBroken);
        }
        return new BalanceAudit(userId, stored, MoneyUtils.round6(running), history.size(), consistent, firstBroken);
    }

    // ========== 內部：原子變更 ==========

    /**
     * 待寫入的交易內容（餘額欄位由 {@link #mutate} 填入）。
     */
    private record Entry(
        TransactionType type,
        boolean credit,
        BigDecimal amount,
        String description,
        String externalRef,
        String requestId,
        String relatedTransactionId,
        Map<String, Object> metadata
    ) {}

    @FunctionalInterface
    private interface EntryFactory {
        Entry create(UserBalance account);
    }

    /**
     * 在分段鎖內以 compare-and-swap 追加一筆交易，衝突時有限次重試。
     *
     * @throws DuplicateKeyException 冪等鍵衝突，由呼叫端回讀原交易
     */
    private LedgerTransaction mutate(String userId, String currency, EntryFactory factory) {
        ReentrantLock lock = stripes[Math.floorMod(userId.hashCode(), stripes.length)];
        lock.lock();
        try {
            TransientDataAccessException lastConflict = null;
            for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
                try {
                    return commitOnce(userId, currency, factory);
                } catch (TransientDataAccessException e) {
                    lastConflict = e;
                    log.debug("Balance commit conflict, will retry: userId={}, attempt={}/{}",
                        userId, attempt, config.maxAttempts());
                    if (attempt < config.maxAttempts()) {
                        backoff(userId, attempt, e);
                    }
                } catch (DuplicateKeyException e) {
                    throw e;
                } catch (DataAccessException e) {
                    log.error("Ledger write failed: userId={}, attempt={}, error={}", userId, attempt, e.getMessage());
                    throw new LedgerPersistenceException(userId, attempt, e);
                }
            }
            log.error("Ledger write retries exhausted: userId={}, attempts={}", userId, config.maxAttempts());
            throw new LedgerPersistenceException(userId, config.maxAttempts(), lastConflict);
        } finally {
            lock.unlock();
        }
    }

    private LedgerTransaction commitOnce(String userId, String currency, EntryFactory factory) {
        UserBalance account = store.findBalance(userId)
            .orElseGet(() -> store.openAccount(userId,
                currency != null ? currency : config.defaultCurrency()));

        Entry entry = factory.create(account);
        BigDecimal before = account.balance();
        if (!entry.credit() && before.compareTo(entry.amount()) < 0) {
            throw new InsufficientBalanceException(userId, before, entry.amount());
        }
        BigDecimal after = MoneyUtils.round6(entry.credit()
            ? before.add(entry.amount())
            : before.subtract(entry.amount()));

        // 同一用戶的 createdAt 不得早於上一筆交易
        Instant now = clock.instant();
        Instant at = now.isBefore(account.updatedAt()) ? account.updatedAt() : now;
        UserBalance updated = account.apply(after, at);

        LedgerTransaction draft = LedgerTransaction.builder()
            .userId(userId)
            .type(entry.type())
            .credit(entry.credit())
            .amount(entry.amount())
            .currency(account.currency())
            .balanceBefore(before)
            .balanceAfter(after)
            .description(entry.description())
            .externalRef(entry.externalRef())
            .requestId(entry.requestId())
            .relatedTransactionId(entry.relatedTransactionId())
            .metadata(entry.metadata())
            .sequence(updated.version())
            .createdAt(at)
            .build();

        LedgerTransaction committed = store.commit(account, updated, draft);
        log.info("Ledger {} committed: userId={}, amount={}, balance {} -> {}, sequence={}, txId={}",
            entry.type(), userId, entry.amount(), before, after, committed.sequence(), committed.id());
        return committed;
    }

    private void backoff(String userId, int attempt, TransientDataAccessException cause) {
        Duration delay = config.retryBackoff().multipliedBy(attempt);
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LedgerPersistenceException(userId, attempt, cause);
        }
    }

    // ========== 內部：冪等重播 ==========

    private LedgerTransaction replayDebit(LedgerTransaction existing, String userId, BigDecimal amount) {
        if (!existing.userId().equals(userId) || existing.credit()) {
            throw new IdempotencyConflictException(existing.requestId(), String.format(
                "existing %s transaction %s belongs to user %s", existing.type(), existing.id(), existing.userId()));
        }
        if (existing.amount().compareTo(amount) != 0) {
            log.warn("Debit replay with different amount, returning original: requestId={}, original={}, requested={}",
                existing.requestId(), existing.amount(), amount);
        }
        log.info("Duplicate debit ignored: userId={}, requestId={}, txId={}", userId, existing.requestId(), existing.id());
        return existing;
    }

    private LedgerTransaction replayDeposit(LedgerTransaction existing, String userId, BigDecimal amount) {
        if (!existing.userId().equals(userId)
                || existing.type() != TransactionType.DEPOSIT
                || existing.amount().compareTo(amount) != 0) {
            throw new IdempotencyConflictException(existing.externalRef(), String.format(
                "existing %s of %s for user %s", existing.type(), existing.amount().toPlainString(), existing.userId()));
        }
        log.info("Duplicate deposit ignored: userId={}, externalRef={}, txId={}",
            userId, existing.externalRef(), existing.id());
        return existing;
    }

    private LedgerTransaction replayAdjustment(LedgerTransaction existing, String userId, boolean credit) {
        if (!existing.userId().equals(userId)
                || existing.type() != TransactionType.ADJUSTMENT
                || existing.credit() != credit) {
            throw new IdempotencyConflictException(existing.requestId(), String.format(
                "existing %s transaction %s belongs to user %s", existing.type(), existing.id(), existing.userId()));
        }
        return existing;
    }

    // ========== 內部：驗證 ==========

    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new LedgerValidationException("userId is required");
        }
    }

    private static void requireRequestId(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            throw new LedgerValidationException("requestId is required");
        }
    }

    private static BigDecimal requireAmount(BigDecimal amount) {
        if (!MoneyUtils.isPositive(amount)) {
            throw new LedgerValidationException("Amount must be greater than 0");
        }
        try {
            return MoneyUtils.toMoney(amount);
        } catch (ArithmeticException e) {
            throw new LedgerValidationException(
                "Amount " + amount.toPlainString() + " has more than " + MoneyUtils.SCALE + " decimal places");
        }
    }

    private static void requireCurrency(UserBalance account, String currency) {
        if (currency != null && !currency.equalsIgnoreCase(account.currency())) {
            throw new LedgerValidationException(String.format(
                "Currency %s does not match account currency %s", currency, account.currency()));
        }
    }

    private static BigDecimal sum(List<LedgerTransaction> transactions) {
        return transactions.stream()
            .map(LedgerTransaction::amount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
