package io.github.samzhu.billing.repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import io.github.samzhu.billing.document.LedgerTransaction;
import io.github.samzhu.billing.document.TransactionType;
import io.github.samzhu.billing.document.UserBalance;

/**
 * 以記憶體實作的帳本儲存，語意與 {@link MongoLedgerStore} 相同：
 * version compare-and-swap、冪等鍵唯一、餘額與交易同時生效。
 *
 * <p>可注入下一次或多次 commit 失敗，用來測試重試與錯誤路徑。
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<String, UserBalance> balances = new HashMap<>();
    private final Map<String, LedgerTransaction> transactions = new HashMap<>();
    private final List<LedgerTransaction> log = new ArrayList<>();
    private final AtomicInteger commits = new AtomicInteger();

    private int failuresRemaining;
    private DataAccessException injectedFailure;

    /**
     * 接下來 {@code times} 次 commit 拋出指定例外。
     */
    public synchronized void failNextCommits(int times, DataAccessException failure) {
        this.failuresRemaining = times;
        this.injectedFailure = failure;
    }

    public int commitCount() {
        return commits.get();
    }

    public synchronized List<LedgerTransaction> allTransactions() {
        return List.copyOf(log);
    }

    @Override
    public synchronized Optional<UserBalance> findBalance(String userId) {
        return Optional.ofNullable(balances.get(userId));
    }

    @Override
    public synchronized UserBalance openAccount(String userId, String currency) {
        return balances.computeIfAbsent(userId, id -> {
            UserBalance open = UserBalance.open(id, currency, Instant.EPOCH);
            return new UserBalance("bal-" + id, open.userId(), open.balance(), open.currency(),
                open.preferredCurrency(), open.locale(), open.version(), open.createdAt(), open.updatedAt());
        });
    }

    @Override
    public synchronized Optional<LedgerTransaction> findTransaction(String transactionId) {
        return Optional.ofNullable(transactions.get(transactionId));
    }

    @Override
    public synchronized Optional<LedgerTransaction> findByRequestId(String requestId) {
        return log.stream().filter(tx -> requestId.equals(tx.requestId())).findFirst();
    }

    @Override
    public synchronized Optional<LedgerTransaction> findByExternalRef(String externalRef) {
        return log.stream().filter(tx -> externalRef.equals(tx.externalRef())).findFirst();
    }

    @Override
    public synchronized List<LedgerTransaction> findRefunds(String originalTransactionId) {
        return log.stream()
            .filter(tx -> tx.type() == TransactionType.REFUND)
            .filter(tx -> originalTransactionId.equals(tx.relatedTransactionId()))
            .toList();
    }

    @Override
    public synchronized List<LedgerTransaction> findHistory(String userId) {
        return log.stream()
            .filter(tx -> tx.userId().equals(userId))
            .sorted(Comparator.comparingLong(LedgerTransaction::sequence))
            .toList();
    }

    @Override
    public synchronized Page<LedgerTransaction> findTransactions(String userId, Pageable pageable) {
        List<LedgerTransaction> newestFirst = log.stream()
            .filter(tx -> tx.userId().equals(userId))
            .sorted(Comparator.comparingLong(LedgerTransaction::sequence).reversed())
            .toList();
        int from = (int) Math.min(pageable.getOffset(), newestFirst.size());
        int to = Math.min(from + pageable.getPageSize(), newestFirst.size());
        return new PageImpl<>(newestFirst.subList(from, to), pageable, newestFirst.size());
    }

    @Override
    public synchronized LedgerTransaction commit(UserBalance expected, UserBalance updated,
            LedgerTransaction transaction) {
        if (failuresRemaining > 0) {
            failuresRemaining--;
            throw injectedFailure;
        }

        UserBalance current = balances.get(expected.userId());
        if (current == null || current.version() != expected.version()) {
            throw new OptimisticLockingFailureException("Balance version moved: userId=" + expected.userId());
        }
        if (transaction.requestId() != null && findByRequestId(transaction.requestId()).isPresent()) {
            throw new DuplicateKeyException("Duplicate requestId " + transaction.requestId());
        }
        if (transaction.externalRef() != null && findByExternalRef(transaction.externalRef()).isPresent()) {
            throw new DuplicateKeyException("Duplicate externalRef " + transaction.externalRef());
        }

        LedgerTransaction stored = new LedgerTransaction(UUID.randomUUID().toString(), transaction.userId(),
            transaction.type(), transaction.credit(), transaction.amount(), transaction.currency(),
            transaction.balanceBefore(), transaction.balanceAfter(), transaction.description(),
            transaction.externalRef(), transaction.requestId(), transaction.relatedTransactionId(),
            transaction.metadata(), transaction.sequence(), transaction.createdAt());

        balances.put(updated.userId(), updated);
        transactions.put(stored.id(), stored);
        log.add(stored);
        commits.incrementAndGet();
        return stored;
    }
}
