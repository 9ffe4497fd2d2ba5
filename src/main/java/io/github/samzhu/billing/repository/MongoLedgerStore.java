package io.github.samzhu.billing.repository;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import com.mongodb.MongoException;
import com.mongodb.client.result.UpdateResult;

import io.github.samzhu.billing.document.LedgerTransaction;
import io.github.samzhu.billing.document.TransactionType;
import io.github.samzhu.billing.document.UserBalance;

/**
 * 以 MongoDB 實作的帳本儲存。
 *
 * <p>原子單位：
 * <ol>
 *   <li>在 {@link TransactionTemplate} 開啟的多文件交易中，以 {@code userId + version}
 *       為條件更新 {@code user_balances}，並將 version 加一</li>
 *   <li>同一交易內插入 {@code transactions}</li>
 * </ol>
 *
 * <p>任一步驟失敗整個交易回滾。{@code modifiedCount = 0} 或交易層的
 * {@code TransientTransactionError} 都轉為 {@link OptimisticLockingFailureException}，
 * 由上層決定是否重試。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/client-session-transactions.html">Sessions &amp; Transactions</a>
 */
@Repository
public class MongoLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(MongoLedgerStore.class);

    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate transactionTemplate;
    private final UserBalanceRepository balanceRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final Clock clock;

    public MongoLedgerStore(
            MongoTemplate mongoTemplate,
            TransactionTemplate transactionTemplate,
            UserBalanceRepository balanceRepository,
            LedgerTransactionRepository transactionRepository,
            Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.transactionTemplate = transactionTemplate;
        this.balanceRepository = balanceRepository;
        this.transactionRepository = transactionRepository;
        this.clock = clock;
    }

    @Override
    public Optional<UserBalance> findBalance(String userId) {
        return balanceRepository.findByUserId(userId);
    }

    @Override
    public UserBalance openAccount(String userId, String currency) {
        Optional<UserBalance> existing = balanceRepository.findByUserId(userId);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            UserBalance created = mongoTemplate.insert(
                UserBalance.open(userId, currency, clock.instant()));
            log.info("Balance account opened: userId={}, currency={}", userId, currency);
            return created;
        } catch (DuplicateKeyException e) {
            // 併發開戶，以先寫入者為準
            return balanceRepository.findByUserId(userId)
                .orElseThrow(() -> e);
        }
    }

    @Override
    public Optional<LedgerTransaction> findTransaction(String transactionId) {
        return transactionRepository.findById(transactionId);
    }

    @Override
    public Optional<LedgerTransaction> findByRequestId(String requestId) {
        return transactionRepository.findByRequestId(requestId);
    }

    @Override
    public Optional<LedgerTransaction> findByExternalRef(String externalRef) {
        return transactionRepository.findByExternalRef(externalRef);
    }

    @Override
    public List<LedgerTransaction> findRefunds(String originalTransactionId) {
        return transactionRepository.findByRelatedTransactionIdAndType(originalTransactionId, TransactionType.REFUND);
    }

    @Override
    public List<LedgerTransaction> findHistory(String userId) {
        return transactionRepository.findByUserIdOrderBySequenceAsc(userId);
    }

    @Override
    public Page<LedgerTransaction> findTransactions(String userId, Pageable pageable) {
        return transactionRepository.findByUserIdOrderBySequenceDesc(userId, pageable);
    }

    @Override
    public LedgerTransaction commit(UserBalance expected, UserBalance updated, LedgerTransaction transaction) {
        try {
            return transactionTemplate.execute(status -> {
                UpdateResult result = mongoTemplate.updateFirst(
                    Query.query(Criteria.where("userId").is(expected.userId())
                        .and("version").is(expected.version())),
                    new Update()
                        .set("balance", updated.balance())
                        .set("version", updated.version())
                        .set("updatedAt", updated.updatedAt()),
                    UserBalance.class);

                if (result.getModifiedCount() == 0) {
                    throw new OptimisticLockingFailureException(String.format(
                        "Balance version moved: userId=%s, expectedVersion=%d",
                        expected.userId(), expected.version()));
                }
                return mongoTemplate.insert(transaction);
            });
        } catch (DuplicateKeyException | OptimisticLockingFailureException e) {
            throw e;
        } catch (DataAccessException e) {
            if (isTransientTransactionError(e)) {
                log.debug("Transient transaction error on balance commit: userId={}", expected.userId());
                throw new OptimisticLockingFailureException("Write conflict on balance commit", e);
            }
            throw e;
        }
    }

    private static boolean isTransientTransactionError(DataAccessException e) {
        Throwable cause = e.getMostSpecificCause();
        return cause instanceof MongoException mongoException
            && mongoException.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL);
    }
}
