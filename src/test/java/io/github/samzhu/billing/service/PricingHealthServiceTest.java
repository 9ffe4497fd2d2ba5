package io.github.samzhu.billing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.document.ModelPricing;
import io.github.samzhu.billing.dto.DataFreshness;
import io.github.samzhu.billing.dto.HealthReport;
import io.github.samzhu.billing.dto.HealthStatus;
import io.github.samzhu.billing.dto.ProviderStatus;
import io.github.samzhu.billing.repository.ModelPricingRepository;
import io.github.samzhu.billing.service.FetchLatencyService.LatencyStats;
import io.github.samzhu.billing.service.alert.AlertService;
import io.github.samzhu.billing.service.provider.ProviderRegistry;

class PricingHealthServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ModelPricingRepository repository;
    private ProviderRegistry registry;
    private PricingReviewQueueService reviewQueue;
    private AlertService alertService;
    private PricingHealthService healthService;

    @BeforeEach
    void setUp() {
        repository = mock(ModelPricingRepository.class);
        registry = mock(ProviderRegistry.class);
        reviewQueue = mock(PricingReviewQueueService.class);
        alertService = mock(AlertService.class);
        healthService = new PricingHealthService(repository, registry, reviewQueue,
            new PricingValidator(Clock.fixed(NOW, ZoneOffset.UTC)), alertService, new BillingProperties(null, null, null, null, null, null));

        when(alertService.hasExternalChannel()).thenReturn(true);
        when(reviewQueue.countOverdue(any(Duration.class))).thenReturn(0L);
    }

    @Test
    void shouldReportHealthyWhenEverythingIsFresh() {
        // Given
        when(repository.findByActiveTrue()).thenReturn(List.of(verified("gpt-4o", 1), verified("gpt-4o-mini", 2)));
        when(registry.getStats()).thenReturn(List.of(status("openai", 0), status("anthropic", 0)));

        // When
        HealthReport report = healthService.evaluate();

        // Then
        assertThat(report.healthScore()).isEqualTo(100);
        assertThat(report.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(report.issues()).isEmpty();
        assertThat(report.totalModels()).isEqualTo(2);
    }

    @Test
    void shouldDeductForStaleModelsAndFailingProvider() {
        // Given: 3 個模型有 1 個超過 7 天未驗證
        when(repository.findByActiveTrue()).thenReturn(List.of(
            verified("gpt-4o", 1), verified("gpt-4o-mini", 2), verified("gpt-4", 10)));
        when(registry.getStats()).thenReturn(List.of(status("openai", 2), status("anthropic", 0)));
        when(reviewQueue.countPending()).thenReturn(4L);

        // When
        HealthReport report = healthService.evaluate();

        // Then: 100 - 20 - 15
        assertThat(report.healthScore()).isEqualTo(65);
        assertThat(report.status()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(report.staleModels()).isEqualTo(1);
        assertThat(report.failingProviders()).isEqualTo(1);
        assertThat(report.pendingReviews()).isEqualTo(4);
        assertThat(report.issues()).containsExactly(
            "1 of 3 models not verified for more than 7 days",
            "1 of 2 pricing providers are failing");
    }

    @Test
    void shouldReportCriticalWithoutPricingOrProviders() {
        // Given
        when(repository.findByActiveTrue()).thenReturn(List.of());
        when(registry.getStats()).thenReturn(List.of(status("openai", 1)));
        when(reviewQueue.countOverdue(any(Duration.class))).thenReturn(2L);
        when(alertService.hasExternalChannel()).thenReturn(false);

        // When
        HealthReport report = healthService.evaluate();

        // Then: 100 - 50 - 30 - 15 - 10，下限為 0
        assertThat(report.healthScore()).isZero();
        assertThat(report.status()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(report.issues()).contains(
            "No active model pricing",
            "All pricing providers are failing",
            "2 pricing changes awaiting review for more than 72 hours",
            "No external alert channel configured");
    }

    private static ModelPricing verified(String modelId, int daysAgo) {
        Instant at = NOW.minus(Duration.ofDays(daysAgo));
        return ModelPricing.create(modelId, "openai", new BigDecimal("0.001"), new BigDecimal("0.002"), "openai-static", at);
    }

    private static ProviderStatus status(String providerId, int failureCount) {
        return new ProviderStatus(providerId, providerId, true, DataFreshness.STATIC, 5,
            null, null, failureCount, failureCount > 0 ? "HTTP 500" : null, LatencyStats.empty());
    }
}
