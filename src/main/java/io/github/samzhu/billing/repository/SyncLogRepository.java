package io.github.samzhu.billing.repository;

import java.util.Optional;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.billing.document.SyncLog;

/**
 * 同步執行紀錄資料存取介面。
 */
public interface SyncLogRepository extends MongoRepository<SyncLog, String> {

    Optional<SyncLog> findFirstByOrderByCompletedAtDesc();

    Optional<SyncLog> findFirstBySuccessTrueOrderByCompletedAtDesc();

    Page<SyncLog> findAllByOrderByCompletedAtDesc(Pageable pageable);
}
