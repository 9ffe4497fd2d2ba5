package io.github.samzhu.billing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.config.BillingProperties.DefaultPrice;
import io.github.samzhu.billing.config.BillingProperties.PricingConfig;
import io.github.samzhu.billing.document.ChangeType;
import io.github.samzhu.billing.document.ModelPricing;
import io.github.samzhu.billing.document.PricingChange;
import io.github.samzhu.billing.repository.ModelPricingRepository;
import io.github.samzhu.billing.repository.PricingChangeRepository;

class PricingSeedServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ModelPricingRepository modelPricingRepository;
    private PricingChangeRepository pricingChangeRepository;

    @BeforeEach
    void setUp() {
        modelPricingRepository = mock(ModelPricingRepository.class);
        pricingChangeRepository = mock(PricingChangeRepository.class);
    }

    @Test
    void shouldSeedEmptyCollectionWithAuditTrail() {
        // Given
        Map<String, DefaultPrice> defaults = new LinkedHashMap<>();
        defaults.put("openai:gpt-4o", new DefaultPrice(new BigDecimal("0.0025"), new BigDecimal("0.01")));
        defaults.put("anthropic:claude-3-haiku-20240307", new DefaultPrice(new BigDecimal("0.00025"), new BigDecimal("0.00125")));
        defaults.put("not-a-key", new DefaultPrice(BigDecimal.ONE, BigDecimal.ONE));
        defaults.put("google:gemini-pro", new DefaultPrice(null, BigDecimal.ONE));
        when(modelPricingRepository.count()).thenReturn(0L);

        // When
        int seeded = seedService(defaults, true).seedIfEmpty();

        // Then
        assertThat(seeded).isEqualTo(2);
        ArgumentCaptor<ModelPricing> pricing = ArgumentCaptor.forClass(ModelPricing.class);
        verify(modelPricingRepository, times(2)).save(pricing.capture());
        assertThat(pricing.getAllValues()).extracting(ModelPricing::key)
            .containsExactly("openai:gpt-4o", "anthropic:claude-3-haiku-20240307");
        assertThat(pricing.getAllValues()).allSatisfy(p -> {
            assertThat(p.active()).isTrue();
            assertThat(p.source()).isEqualTo(PricingChange.SOURCE_SEED);
            assertThat(p.lastVerifiedAt()).isEqualTo(NOW);
        });

        ArgumentCaptor<PricingChange> audit = ArgumentCaptor.forClass(PricingChange.class);
        verify(pricingChangeRepository, times(2)).save(audit.capture());
        assertThat(audit.getAllValues()).allSatisfy(change -> {
            assertThat(change.changeType()).isEqualTo(ChangeType.NEW);
            assertThat(change.changedBy()).isEqualTo(PricingSeedService.SEEDED_BY);
            assertThat(change.changeSource()).isEqualTo(PricingChange.SOURCE_SEED);
        });
    }

    @Test
    void shouldNotSeedWhenPricingExists() {
        // Given
        when(modelPricingRepository.count()).thenReturn(12L);

        // When
        int seeded = seedService(Map.of("openai:gpt-4o",
            new DefaultPrice(new BigDecimal("0.0025"), new BigDecimal("0.01"))), true).seedIfEmpty();

        // Then
        assertThat(seeded).isZero();
        verify(modelPricingRepository, never()).save(any());
    }

    @Test
    void shouldSkipSeedingOnStartupWhenDisabled() throws Exception {
        // When
        seedService(Map.of(), false).run(new DefaultApplicationArguments());

        // Then
        verify(modelPricingRepository, never()).count();
    }

    private PricingSeedService seedService(Map<String, DefaultPrice> defaults, boolean seedOnStartup) {
        BillingProperties properties = new BillingProperties(null,
            new PricingConfig(null, true, seedOnStartup, defaults), null, null, null, null);
        return new PricingSeedService(modelPricingRepository, pricingChangeRepository, properties,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
