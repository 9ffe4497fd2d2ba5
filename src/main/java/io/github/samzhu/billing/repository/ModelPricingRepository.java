package io.github.samzhu.billing.repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;

import io.github.samzhu.billing.document.ModelPricing;

/**
 * 模型定價資料存取介面。
 *
 * <p>寫入只發生在同步套用、人工核准與初始化；一般查價請走 {@code PricingCacheService}。
 */
public interface ModelPricingRepository extends MongoRepository<ModelPricing, String> {

    // ========== 基本查詢 ==========

    Optional<ModelPricing> findByProviderIdAndModelId(String providerId, String modelId);

    Optional<ModelPricing> findByProviderIdAndModelIdAndActiveTrue(String providerId, String modelId);

    List<ModelPricing> findByActiveTrue();

    List<ModelPricing> findByActiveTrueOrderByProviderIdAscModelIdAsc();

    // ========== 更新操作 (@Query + @Update) ==========

    /**
     * 更新價格未變模型的最後驗證時間。
     *
     * @param providerId 供應商 ID
     * @param modelIds 價格未變的模型
     * @param verifiedAt 驗證時間
     * @return 更新的文件數
     */
    @Query("{ 'providerId': ?0, 'modelId': { '$in': ?1 }, 'active': true }")
    @Update("{ '$set': { 'lastVerifiedAt': ?2 } }")
    long markVerified(String providerId, Collection<String> modelIds, Instant verifiedAt);
}
