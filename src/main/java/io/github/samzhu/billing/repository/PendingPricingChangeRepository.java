package io.github.samzhu.billing.repository;

import java.time.Instant;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.billing.document.PendingPricingChange;
import io.github.samzhu.billing.document.ReviewStatus;

/**
 * 待審定價變更資料存取介面。
 */
public interface PendingPricingChangeRepository extends MongoRepository<PendingPricingChange, String> {

    List<PendingPricingChange> findByStatusOrderByDetectedAtAsc(ReviewStatus status);

    long countByStatus(ReviewStatus status);

    /**
     * 計算超過審核期限仍未處理的項目數。
     */
    long countByStatusAndDetectedAtBefore(ReviewStatus status, Instant threshold);
}
