package io.github.samzhu.billing.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import io.github.samzhu.billing.document.ModelPricing;
import io.github.samzhu.billing.document.UsageRecord;
import io.github.samzhu.billing.document.UsageStatus;
import io.github.samzhu.billing.dto.UsageSummary;
import io.github.samzhu.billing.dto.UsageSummary.ModelUsage;
import io.github.samzhu.billing.repository.UsageRecordRepository;

/**
 * 用量查詢服務。
 *
 * <p>提供用戶用量摘要與待對帳紀錄查詢，只讀取 {@code usage_records}。
 */
@Service
public class UsageQueryService {

    private static final Logger log = LoggerFactory.getLogger(UsageQueryService.class);

    private final UsageRecordRepository usageRecordRepository;

    public UsageQueryService(UsageRecordRepository usageRecordRepository) {
        this.usageRecordRepository = usageRecordRepository;
    }

    /**
     * 查詢用戶在指定期間的用量摘要。
     *
     * @param userId 用戶 ID
     * @param from 起始時間（含）
     * @param to 結束時間（不含）
     * @return 用量摘要，依模型細分並依成本由高到低排序
     */
    public UsageSummary getUserSummary(String userId, Instant from, Instant to) {
        List<UsageRecord> records = usageRecordRepository
            .findByUserIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(userId, from, to);
        log.debug("User usage query: userId={}, period={} to {}, found {} records",
            userId, from, to, records.size());

        long inputTokens = 0;
        long outputTokens = 0;
        long totalTokens = 0;
        BigDecimal totalCost = BigDecimal.ZERO;
        Map<String, ModelAccumulator> byModel = new LinkedHashMap<>();

        for (UsageRecord record : records) {
            inputTokens += record.inputTokens();
            outputTokens += record.outputTokens();
            totalTokens += record.totalTokens();
            totalCost = totalCost.add(record.totalCost());
            byModel.computeIfAbsent(ModelPricing.key(record.providerId(), record.modelId()),
                    k -> new ModelAccumulator(record.providerId(), record.modelId()))
                .add(record);
        }

        List<ModelUsage> models = new ArrayList<>();
        for (ModelAccumulator acc : byModel.values()) {
            models.add(acc.toModelUsage());
        }
        models.sort(Comparator.comparing(ModelUsage::totalCost).reversed());

        return new UsageSummary(userId, from, to, records.size(),
            inputTokens, outputTokens, totalTokens, totalCost, models);
    }

    /**
     * 查詢需要人工對帳的用量紀錄（最新的在前）。
     */
    public Page<UsageRecord> getReconciliationPending(Pageable pageable) {
        return usageRecordRepository.findByStatusOrderByCreatedAtDesc(UsageStatus.RECONCILIATION_PENDING, pageable);
    }

    public long countReconciliationPending() {
        return usageRecordRepository.countByStatus(UsageStatus.RECONCILIATION_PENDING);
    }

    private static final class ModelAccumulator {
        private final String providerId;
        private final String modelId;
        private long requestCount;
        private long totalTokens;
        private BigDecimal totalCost = BigDecimal.ZERO;

        ModelAccumulator(String providerId, String modelId) {
            this.providerId = providerId;
            this.modelId = modelId;
        }

        void add(UsageRecord record) {
            requestCount++;
            totalTokens += record.totalTokens();
            totalCost = totalCost.add(record.totalCost());
        }

        ModelUsage toModelUsage() {
            return new ModelUsage(providerId, modelId, requestCount, totalTokens, totalCost);
        }
    }
}
