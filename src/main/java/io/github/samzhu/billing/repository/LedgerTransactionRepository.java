package io.github.samzhu.billing.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.billing.document.LedgerTransaction;
import io.github.samzhu.billing.document.TransactionType;

/**
 * 帳本交易資料存取介面。
 *
 * <p>提供對 {@code transactions} 集合的查詢。交易只會被插入，不會被更新或刪除。
 *
 * @see io.github.samzhu.billing.document.LedgerTransaction
 */
public interface LedgerTransactionRepository extends MongoRepository<LedgerTransaction, String> {

    // ========== 冪等查詢 ==========

    Optional<LedgerTransaction> findByRequestId(String requestId);

    Optional<LedgerTransaction> findByExternalRef(String externalRef);

    // ========== 退款 ==========

    /**
     * 查詢原始交易已產生的退款。
     *
     * @param relatedTransactionId 原始交易 ID
     * @param type 交易類型，固定為 {@link TransactionType#REFUND}
     * @return 退款交易清單
     */
    List<LedgerTransaction> findByRelatedTransactionIdAndType(String relatedTransactionId, TransactionType type);

    // ========== 歷史查詢 ==========

    /**
     * 依提交順序取得用戶的完整交易歷史（用於稽核重播）。
     */
    List<LedgerTransaction> findByUserIdOrderBySequenceAsc(String userId);

    /**
     * 分頁查詢用戶交易，最新的在前。
     */
    Page<LedgerTransaction> findByUserIdOrderBySequenceDesc(String userId, Pageable pageable);
}
