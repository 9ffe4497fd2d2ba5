package io.github.samzhu.billing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.config.BillingProperties.LedgerConfig;
import io.github.samzhu.billing.document.ModelPricing;
import io.github.samzhu.billing.document.UsageRecord;
import io.github.samzhu.billing.document.UsageStatus;
import io.github.samzhu.billing.dto.ChargeResult;
import io.github.samzhu.billing.dto.PreflightResult;
import io.github.samzhu.billing.dto.UsageCharge;
import io.github.samzhu.billing.exception.IdempotencyConflictException;
import io.github.samzhu.billing.exception.InsufficientBalanceException;
import io.github.samzhu.billing.exception.InvalidUsageException;
import io.github.samzhu.billing.exception.NoPricingException;
import io.github.samzhu.billing.repository.InMemoryLedgerStore;
import io.github.samzhu.billing.repository.UsageRecordRepository;
import io.github.samzhu.billing.service.alert.AlertService;

class UsageMeterServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private InMemoryLedgerStore store;
    private BalanceLedgerService ledger;
    private UsageRecordRepository usageRecordRepository;
    private PricingCacheService pricingCache;
    private AlertService alertService;
    private UsageMeterService usageMeter;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        BillingProperties properties = new BillingProperties(
            new LedgerConfig("USD", 3, Duration.ofMillis(1), 16, new BigDecimal("0.01")),
            null, null, null, null, null);

        store = new InMemoryLedgerStore();
        ledger = new BalanceLedgerService(store, properties, clock);
        usageRecordRepository = mock(UsageRecordRepository.class);
        pricingCache = mock(PricingCacheService.class);
        alertService = mock(AlertService.class);
        usageMeter = new UsageMeterService(usageRecordRepository, pricingCache, ledger, alertService, properties, clock);

        when(usageRecordRepository.findByRequestId(anyString())).thenReturn(Optional.empty());
        when(usageRecordRepository.save(any(UsageRecord.class))).thenAnswer(inv -> inv.getArgument(0));
        when(pricingCache.getPrice("gpt-4o", "openai")).thenReturn(ModelPricing.create("gpt-4o", "openai",
            new BigDecimal("0.0025"), new BigDecimal("0.01"), "openai-static", NOW));
        when(pricingCache.getPrice("gpt-4o-mini", "openai")).thenReturn(ModelPricing.create("gpt-4o-mini", "openai",
            new BigDecimal("0.00015"), new BigDecimal("0.0006"), "openai-static", NOW));
    }

    @Test
    void shouldDebitComputedCostAndRecordUsage() {
        // Given: 1000 輸入 × 0.0025 + 500 輸出 × 0.01 = 0.0075
        ledger.deposit("user-1", BigDecimal.ONE, null, null, null);

        // When
        ChargeResult result = usageMeter.recordAndCharge(
            "user-1", "chat-1", "gpt-4o", "openai", 1000, 500, 1500, "req-1");

        // Then
        assertThat(result.cost()).isEqualByComparingTo("0.0075");
        assertThat(result.status()).isEqualTo(UsageStatus.COMPLETED);
        assertThat(result.replayed()).isFalse();
        assertThat(ledger.getBalance("user-1").balance()).isEqualByComparingTo("0.9925");

        ArgumentCaptor<UsageRecord> captor = ArgumentCaptor.forClass(UsageRecord.class);
        verify(usageRecordRepository).save(captor.capture());
        UsageRecord record = captor.getValue();
        assertThat(record.totalCost()).isEqualByComparingTo("0.0075");
        assertThat(record.transactionId()).isEqualTo(result.transactionId());
        assertThat(record.inputPricePer1k()).isEqualByComparingTo("0.0025");
        assertThat(record.chatId()).isEqualTo("chat-1");
    }

    @Test
    void shouldRejectInconsistentTokenCountsBeforeAnyLookup() {
        // Given
        ledger.deposit("user-1", BigDecimal.ONE, null, null, null);

        // When / Then
        assertThatThrownBy(() -> usageMeter.recordAndCharge(
                "user-1", null, "gpt-4o", "openai", 100, 50, 151, "req-1"))
            .isInstanceOf(InvalidUsageException.class)
            .hasMessageContaining("totalTokens");
        assertThatThrownBy(() -> usageMeter.recordAndCharge(
                "user-1", null, "gpt-4o", "openai", -1, 50, 49, "req-2"))
            .isInstanceOf(InvalidUsageException.class);
        assertThatThrownBy(() -> usageMeter.recordAndCharge(
                "user-1", null, "gpt-4o", "openai", 0, 0, 0, "req-3"))
            .isInstanceOf(InvalidUsageException.class);

        verifyNoInteractions(pricingCache);
        assertThat(store.allTransactions()).hasSize(1);
    }

    @Test
    void shouldChargeMinimumUnitWhenCostRoundsToZero() {
        // Given: 1 × 0.00015 / 1000 = 0.00000015
        ledger.deposit("user-1", BigDecimal.ONE, null, null, null);

        // When
        ChargeResult result = usageMeter.recordAndCharge(
            new UsageCharge("user-1", null, "gpt-4o-mini", "openai", 1, 0, 1, "req-1"));

        // Then
        assertThat(result.cost()).isEqualByComparingTo("0.000001");
        assertThat(ledger.getBalance("user-1").balance()).isEqualByComparingTo("0.999999");
    }

    @Test
    void shouldRefuseToChargeUnpricedModel() {
        // Given
        ledger.deposit("user-1", BigDecimal.ONE, null, null, null);
        when(pricingCache.getPrice("mystery", "openai")).thenThrow(new NoPricingException("openai", "mystery"));

        // When / Then
        assertThatThrownBy(() -> usageMeter.recordAndCharge(
                "user-1", null, "mystery", "openai", 10, 10, 20, "req-1"))
            .isInstanceOf(NoPricingException.class);
        assertThat(ledger.getBalance("user-1").balance()).isEqualByComparingTo("1");
        verify(usageRecordRepository, never()).save(any());
    }

    @Test
    void shouldNotRecordUsageWhenBalanceIsInsufficient() {
        // Given: 沒有任何入帳

        // When / Then
        assertThatThrownBy(() -> usageMeter.recordAndCharge(
                "user-1", null, "gpt-4o", "openai", 1000, 500, 1500, "req-1"))
            .isInstanceOf(InsufficientBalanceException.class);
        verify(usageRecordRepository, never()).save(any());
        assertThat(store.allTransactions()).isEmpty();
    }

    @Test
    void shouldReturnRecordedResultForRepeatedRequest() {
        // Given
        ledger.deposit("user-1", BigDecimal.ONE, null, null, null);
        ChargeResult first = usageMeter.recordAndCharge(
            "user-1", null, "gpt-4o", "openai", 1000, 500, 1500, "req-1");
        ArgumentCaptor<UsageRecord> captor = ArgumentCaptor.forClass(UsageRecord.class);
        verify(usageRecordRepository).save(captor.capture());
        when(usageRecordRepository.findByRequestId("req-1")).thenReturn(Optional.of(captor.getValue()));

        // When
        ChargeResult replay = usageMeter.recordAndCharge(
            "user-1", null, "gpt-4o", "openai", 1000, 500, 1500, "req-1");

        // Then
        assertThat(replay.replayed()).isTrue();
        assertThat(replay.transactionId()).isEqualTo(first.transactionId());
        assertThat(ledger.getBalance("user-1").balance()).isEqualByComparingTo("0.9925");
        verify(usageRecordRepository, times(1)).save(any());
    }

    @Test
    void shouldRejectRequestIdReusedByAnotherUser() {
        // Given: alice 已用 req-1 計費
        ledger.deposit("alice", BigDecimal.ONE, null, null, null);
        ledger.deposit("bob", BigDecimal.ONE, null, null, null);
        usageMeter.recordAndCharge("alice", null, "gpt-4o", "openai", 1000, 500, 1500, "req-1");
        ArgumentCaptor<UsageRecord> captor = ArgumentCaptor.forClass(UsageRecord.class);
        verify(usageRecordRepository).save(captor.capture());
        when(usageRecordRepository.findByRequestId("req-1")).thenReturn(Optional.of(captor.getValue()));

        // When / Then
        assertThatThrownBy(() -> usageMeter.recordAndCharge(
                "bob", null, "gpt-4o", "openai", 1000, 500, 1500, "req-1"))
            .isInstanceOf(IdempotencyConflictException.class)
            .hasMessageContaining("req-1")
            .hasMessageContaining("alice");
        assertThat(ledger.getBalance("bob").balance()).isEqualByComparingTo("1");
        verify(usageRecordRepository, times(1)).save(any());
    }

    @Test
    void shouldFlagReconciliationWhenRecordWriteFailsAfterDebit() {
        // Given
        ledger.deposit("user-1", BigDecimal.ONE, null, null, null);
        when(usageRecordRepository.save(any(UsageRecord.class)))
            .thenThrow(new DataAccessResourceFailureException("write timeout"))
            .thenAnswer(inv -> inv.getArgument(0));

        // When
        ChargeResult result = usageMeter.recordAndCharge(
            "user-1", null, "gpt-4o", "openai", 1000, 500, 1500, "req-1");

        // Then: 扣款保留一次，紀錄標記為待對帳並發出嚴重告警
        assertThat(result.status()).isEqualTo(UsageStatus.RECONCILIATION_PENDING);
        assertThat(result.transactionId()).isNotNull();
        assertThat(ledger.getBalance("user-1").balance()).isEqualByComparingTo("0.9925");
        assertThat(store.allTransactions()).hasSize(2);
        verify(alertService).critical(eq("Usage record write failed after debit"), contains("req-1"));

        ArgumentCaptor<UsageRecord> captor = ArgumentCaptor.forClass(UsageRecord.class);
        verify(usageRecordRepository, times(2)).save(captor.capture());
        assertThat(captor.getValue().status()).isEqualTo(UsageStatus.RECONCILIATION_PENDING);
        assertThat(captor.getValue().failureReason()).contains("write timeout");
    }

    @Test
    void shouldGatePreflightOnMinimumBalance() {
        // Given
        ledger.deposit("rich", new BigDecimal("0.01"), null, null, null);

        // When
        PreflightResult allowed = usageMeter.checkPreflight("rich");
        PreflightResult denied = usageMeter.checkPreflight("broke");

        // Then
        assertThat(allowed.allowed()).isTrue();
        assertThat(denied.allowed()).isFalse();
        assertThat(denied.balance()).isEqualByComparingTo("0");
        assertThat(denied.minimumBalance()).isEqualByComparingTo("0.01");
    }
}
