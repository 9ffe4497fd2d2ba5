package io.github.samzhu.billing.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.billing.document.UsageRecord;
import io.github.samzhu.billing.document.UsageStatus;

/**
 * 用量紀錄資料存取介面。
 */
public interface UsageRecordRepository extends MongoRepository<UsageRecord, String> {

    Optional<UsageRecord> findByRequestId(String requestId);

    /**
     * 查詢用戶在時間區間內的用量（from 含，to 不含）。
     */
    List<UsageRecord> findByUserIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(
        String userId, Instant from, Instant to);

    /**
     * 查詢需要人工對帳的紀錄。
     */
    Page<UsageRecord> findByStatusOrderByCreatedAtDesc(UsageStatus status, Pageable pageable);

    long countByStatus(UsageStatus status);
}
