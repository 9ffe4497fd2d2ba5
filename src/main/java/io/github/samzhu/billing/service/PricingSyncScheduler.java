package io.github.samzhu.billing.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.document.SyncLog;
import io.github.samzhu.billing.dto.SyncOptions;
import io.github.samzhu.billing.dto.SyncResult;
import io.github.samzhu.billing.exception.SyncInProgressException;
import io.github.samzhu.billing.repository.SyncLogRepository;

/**
 * 定價同步排程。
 *
 * <p>依 {@code billing.sync.cron} 觸發，預設每 6 小時一次：
 * <ul>
 *   <li>{@code billing.sync.enabled = false} 時不執行</li>
 *   <li>距離上次成功同步未滿 {@code minInterval} 時跳過</li>
 *   <li>已有同步正在套用時跳過，等待下一次排程</li>
 * </ul>
 */
@Service
public class PricingSyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(PricingSyncScheduler.class);

    private final SyncOrchestratorService orchestrator;
    private final SyncLogRepository syncLogRepository;
    private final BillingProperties.SyncConfig config;
    private final Clock clock;

    public PricingSyncScheduler(SyncOrchestratorService orchestrator, SyncLogRepository syncLogRepository,
            BillingProperties properties, Clock clock) {
        this.orchestrator = orchestrator;
        this.syncLogRepository = syncLogRepository;
        this.config = properties.sync();
        this.clock = clock;
    }

    @Scheduled(cron = "${billing.sync.cron:0 0 */6 * * *}")
    public void scheduledSync() {
        if (!config.enabled()) {
            log.debug("Scheduled pricing sync disabled");
            return;
        }
        runIfDue();
    }

    /**
     * 檢查最小間隔後執行一次排程同步。
     *
     * @return 同步結果；跳過時為 empty
     */
    Optional<SyncResult> runIfDue() {
        Optional<SyncLog> lastSuccess = syncLogRepository.findFirstBySuccessTrueOrderByCompletedAtDesc();
        if (lastSuccess.isPresent() && lastSuccess.get().completedAt() != null) {
            Duration elapsed = Duration.between(lastSuccess.get().completedAt(), clock.instant());
            if (elapsed.compareTo(config.minInterval()) < 0) {
                log.info("Scheduled pricing sync skipped: last success {} ago, minInterval={}",
                    elapsed, config.minInterval());
                return Optional.empty();
            }
        }

        Instant start = clock.instant();
        log.info("Starting scheduled pricing sync...");
        try {
            SyncResult result = orchestrator.sync(SyncOptions.scheduled());
            log.info("Scheduled pricing sync completed: success={}, applied={}, durationMs={}",
                result.success(), result.changes().applied(), Duration.between(start, clock.instant()).toMillis());
            return Optional.of(result);
        } catch (SyncInProgressException e) {
            log.warn("Scheduled pricing sync skipped: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
