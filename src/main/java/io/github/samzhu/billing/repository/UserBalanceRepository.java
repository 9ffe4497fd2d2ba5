package io.github.samzhu.billing.repository;

import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.billing.document.UserBalance;

/**
 * 用戶餘額資料存取介面。
 *
 * <p>只提供查詢；餘額變更一律透過 {@link LedgerStore#commit} 以 compare-and-swap 完成。
 */
public interface UserBalanceRepository extends MongoRepository<UserBalance, String> {

    Optional<UserBalance> findByUserId(String userId);
}
