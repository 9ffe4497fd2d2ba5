package io.github.samzhu.billing.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.billing.document.PendingPricingChange;
import io.github.samzhu.billing.document.ReviewStatus;
import io.github.samzhu.billing.dto.DetectedChange;
import io.github.samzhu.billing.exception.PricingChangeNotFoundException;
import io.github.samzhu.billing.repository.PendingPricingChangeRepository;

/**
 * 定價變更審核佇列。
 *
 * <p>每個 {@code (providerId, modelId)} 最多一筆 PENDING：
 * <ul>
 *   <li>同步再次偵測到相同變更時保留原項目（保留原偵測時間，用於判斷逾期）</li>
 *   <li>偵測到不同的變更時，舊項目標記為 SUPERSEDED 並建立新項目</li>
 *   <li>本次成功抓取的供應商不再標記某個 key 時，該 key 的待審項目標記為 SUPERSEDED</li>
 * </ul>
 */
@Service
public class PricingReviewQueueService {

    private static final Logger log = LoggerFactory.getLogger(PricingReviewQueueService.class);

    static final String RESOLVED_BY_SYNC = "auto-sync";

    private final PendingPricingChangeRepository repository;
    private final Clock clock;

    public PricingReviewQueueService(PendingPricingChangeRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * 以本次同步的待審變更更新佇列。
     *
     * @param reviewItems 本次同步未套用、需要審核的變更
     * @param coveredProviders 本次成功抓取的供應商，只有這些供應商的舊項目會被取代
     * @param syncId 同步 ID
     * @return 本次同步後仍在佇列中的待審項目數（含沿用的舊項目）
     */
    public int enqueue(List<DetectedChange> reviewItems, Set<String> coveredProviders, String syncId) {
        Instant now = clock.instant();
        Map<String, PendingPricingChange> pending = new LinkedHashMap<>();
        for (PendingPricingChange item : repository.findByStatusOrderByDetectedAtAsc(ReviewStatus.PENDING)) {
            PendingPricingChange previous = pending.put(item.key(), item);
            if (previous != null) {
                // 同一 key 只保留最新的一筆
                repository.save(previous.resolve(ReviewStatus.SUPERSEDED, RESOLVED_BY_SYNC,
                    "Duplicate pending entry", now));
            }
        }

        Set<String> flagged = new HashSet<>();
        int created = 0;
        for (DetectedChange change : reviewItems) {
            flagged.add(change.key());
            PendingPricingChange existing = pending.get(change.key());
            if (existing != null && existing.describesSameChange(change)) {
                continue;
            }
            if (existing != null) {
                repository.save(existing.resolve(ReviewStatus.SUPERSEDED, RESOLVED_BY_SYNC,
                    "Superseded by sync " + syncId, now));
            }
            repository.save(PendingPricingChange.fromDetected(change, syncId, now));
            created++;
        }

        int superseded = 0;
        for (PendingPricingChange item : pending.values()) {
            if (!flagged.contains(item.key()) && coveredProviders.contains(item.providerId())) {
                repository.save(item.resolve(ReviewStatus.SUPERSEDED, RESOLVED_BY_SYNC,
                    "No longer flagged by sync " + syncId, now));
                superseded++;
            }
        }

        log.info("Review queue updated: syncId={}, flagged={}, created={}, superseded={}",
            syncId, flagged.size(), created, superseded);
        return flagged.size();
    }

    public List<PendingPricingChange> getPending() {
        return repository.findByStatusOrderByDetectedAtAsc(ReviewStatus.PENDING);
    }

    /**
     * 取得尚未處理的待審項目。
     *
     * @throws PricingChangeNotFoundException 若項目不存在或已處理
     */
    public PendingPricingChange getPendingItem(String changeId) {
        PendingPricingChange item = repository.findById(changeId)
            .orElseThrow(() -> new PricingChangeNotFoundException(changeId, "not found"));
        if (item.status() != ReviewStatus.PENDING) {
            throw new PricingChangeNotFoundException(changeId, "is already " + item.status());
        }
        return item;
    }

    /**
     * 結束待審項目。
     */
    public PendingPricingChange resolve(PendingPricingChange item, ReviewStatus status, String by, String note) {
        PendingPricingChange resolved = repository.save(item.resolve(status, by, note, clock.instant()));
        log.info("Pending pricing change resolved: id={}, key={}, status={}, by={}",
            item.id(), item.key(), status, by);
        return resolved;
    }

    public long countPending() {
        return repository.countByStatus(ReviewStatus.PENDING);
    }

    /**
     * 計算偵測後超過 {@code maxAge} 仍未處理的項目數。
     */
    public long countOverdue(Duration maxAge) {
        return repository.countByStatusAndDetectedAtBefore(ReviewStatus.PENDING, clock.instant().minus(maxAge));
    }
}
