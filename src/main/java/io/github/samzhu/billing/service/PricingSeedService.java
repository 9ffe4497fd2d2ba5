package io.github.samzhu.billing.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Service;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.config.BillingProperties.DefaultPrice;
import io.github.samzhu.billing.document.ChangeType;
import io.github.samzhu.billing.document.ModelPricing;
import io.github.samzhu.billing.document.PricingChange;
import io.github.samzhu.billing.dto.DetectedChange;
import io.github.samzhu.billing.dto.ModelRef;
import io.github.samzhu.billing.exception.InvalidUsageException;
import io.github.samzhu.billing.repository.ModelPricingRepository;
import io.github.samzhu.billing.repository.PricingChangeRepository;

/**
 * 啟動時以內建價目表初始化 {@code model_pricing}。
 *
 * <p>只在集合為空且 {@code billing.pricing.seed-on-startup = true} 時執行，每筆都寫入稽核紀錄。
 */
@Service
public class PricingSeedService implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(PricingSeedService.class);

    static final String SEEDED_BY = "system-seed";

    private final ModelPricingRepository modelPricingRepository;
    private final PricingChangeRepository pricingChangeRepository;
    private final BillingProperties.PricingConfig config;
    private final Clock clock;

    public PricingSeedService(ModelPricingRepository modelPricingRepository,
            PricingChangeRepository pricingChangeRepository, BillingProperties properties, Clock clock) {
        this.modelPricingRepository = modelPricingRepository;
        this.pricingChangeRepository = pricingChangeRepository;
        this.config = properties.pricing();
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!config.seedOnStartup()) {
            return;
        }
        int seeded = seedIfEmpty();
        if (seeded > 0) {
            log.info("Model pricing seeded from bundled defaults: {} models", seeded);
        }
    }

    /**
     * 集合為空時寫入所有內建定價。
     *
     * @return 寫入的筆數
     */
    int seedIfEmpty() {
        if (modelPricingRepository.count() > 0) {
            log.debug("Model pricing already present, seed skipped");
            return 0;
        }

        Instant now = clock.instant();
        int seeded = 0;
        for (Map.Entry<String, DefaultPrice> entry : config.defaultPrices().entrySet()) {
            DefaultPrice price = entry.getValue();
            ModelRef ref;
            try {
                ref = ModelRef.parse(entry.getKey());
            } catch (InvalidUsageException e) {
                log.warn("Bundled default skipped: {}", e.getMessage());
                continue;
            }
            if (price.inputPer1k() == null || price.outputPer1k() == null) {
                log.warn("Bundled default skipped, both prices are required: key={}", entry.getKey());
                continue;
            }

            modelPricingRepository.save(ModelPricing.create(ref.modelId(), ref.providerId(),
                price.inputPer1k(), price.outputPer1k(), PricingChange.SOURCE_SEED, now));
            DetectedChange change = new DetectedChange(ChangeType.NEW, ref.modelId(), ref.providerId(),
                null, null, price.inputPer1k(), price.outputPer1k(), null, null, false, false, null, List.of());
            pricingChangeRepository.save(PricingChange.fromDetected(change, SEEDED_BY, PricingChange.SOURCE_SEED,
                "Initial pricing from bundled defaults", null, now));
            seeded++;
        }
        return seeded;
    }
}
