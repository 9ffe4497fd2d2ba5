package io.github.samzhu.billing.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import io.github.samzhu.billing.document.LedgerTransaction;
import io.github.samzhu.billing.document.UserBalance;

/**
 * 帳本儲存介面。
 *
 * <p>把「餘額 compare-and-swap + 追加交易」這個原子單位收斂在一個方法，
 * 讓 {@code BalanceLedgerService} 只負責驗證、冪等判斷與重試。
 *
 * <p>正式環境由 {@link MongoLedgerStore} 以 MongoDB 多文件交易實作。
 */
public interface LedgerStore {

    Optional<UserBalance> findBalance(String userId);

    /**
     * 確保用戶有一筆餘額為 0、version 為 0 的帳戶，已存在則直接回傳。
     *
     * @param userId 用戶 ID
     * @param currency 新帳戶的幣別
     * @return 目前的帳戶
     */
    UserBalance openAccount(String userId, String currency);

    Optional<LedgerTransaction> findTransaction(String transactionId);

    Optional<LedgerTransaction> findByRequestId(String requestId);

    Optional<LedgerTransaction> findByExternalRef(String externalRef);

    /**
     * 查詢原始交易已產生的退款。
     */
    List<LedgerTransaction> findRefunds(String originalTransactionId);

    /**
     * 依 sequence 遞增取得完整歷史。
     */
    List<LedgerTransaction> findHistory(String userId);

    Page<LedgerTransaction> findTransactions(String userId, Pageable pageable);

    /**
     * 原子地把餘額從 {@code expected} 更新為 {@code updated} 並追加交易。
     *
     * @param expected 讀取時的帳戶狀態（以 version 比對）
     * @param updated 交易後的帳戶狀態
     * @param transaction 要追加的交易
     * @return 已寫入的交易（含 ID）
     * @throws OptimisticLockingFailureException 帳戶 version 已被其他交易改變
     * @throws DuplicateKeyException 冪等鍵已存在
     */
    LedgerTransaction commit(UserBalance expected, UserBalance updated, LedgerTransaction transaction);
}
