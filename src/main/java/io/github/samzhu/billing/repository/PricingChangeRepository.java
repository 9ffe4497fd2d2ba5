package io.github.samzhu.billing.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.billing.document.PricingChange;

/**
 * 定價變更稽核資料存取介面。
 */
public interface PricingChangeRepository extends MongoRepository<PricingChange, String> {

    Page<PricingChange> findAllByOrderByCreatedAtDesc(Pageable pageable);

    Page<PricingChange> findByProviderIdOrderByCreatedAtDesc(String providerId, Pageable pageable);

    Page<PricingChange> findByModelIdOrderByCreatedAtDesc(String modelId, Pageable pageable);

    Page<PricingChange> findByProviderIdAndModelIdOrderByCreatedAtDesc(String providerId, String modelId,
        Pageable pageable);
}
