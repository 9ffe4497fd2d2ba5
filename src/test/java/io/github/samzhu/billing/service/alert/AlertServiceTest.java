package io.github.samzhu.billing.service.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import io.github.samzhu.billing.config.BillingProperties;
import io.github.samzhu.billing.config.BillingProperties.AlertConfig;
import io.github.samzhu.billing.document.ChangeType;
import io.github.samzhu.billing.dto.ChangeSet;
import io.github.samzhu.billing.dto.DetectedChange;
import io.github.samzhu.billing.dto.HealthReport;
import io.github.samzhu.billing.dto.HealthStatus;
import io.github.samzhu.billing.dto.SyncResult;
import io.github.samzhu.billing.dto.SyncResult.ChangeSummary;
import io.github.samzhu.billing.dto.SyncResult.ProviderSummary;
import io.github.samzhu.billing.dto.SyncState;
import io.github.samzhu.billing.dto.ValidationResult;

class AlertServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String WEBHOOK = "https://hooks.slack.example.com/services/T000/B000/XXX";

    private AlertChannel primary;
    private AlertChannel secondary;
    private SyncReportFormatter formatter;
    private AlertService alertService;

    @BeforeEach
    void setUp() {
        primary = mock(AlertChannel.class);
        secondary = mock(AlertChannel.class);
        when(primary.name()).thenReturn("primary");
        when(secondary.name()).thenReturn("secondary");
        formatter = new SyncReportFormatter(new BillingProperties(null, null, null, null,
            new AlertConfig(null, "https://billing.example.com"), null));
        alertService = new AlertService(List.of(primary, secondary), formatter);
    }

    @Test
    void shouldSkipDryRunsAndSyncsWithoutAppliedChanges() {
        // When
        boolean dryRunSent = alertService.notify(result(true, true, 2));
        boolean nothingSent = alertService.notify(result(true, false, 0));

        // Then
        assertThat(dryRunSent).isFalse();
        assertThat(nothingSent).isFalse();
        verify(primary, never()).send(anyString(), anyString());
    }

    @Test
    void shouldKeepDispatchingWhenOneChannelFails() {
        // Given
        doThrow(new IllegalStateException("webhook down")).when(primary).send(anyString(), anyString());

        // When
        boolean sent = alertService.notify(result(true, false, 1));

        // Then
        assertThat(sent).isTrue();
        verify(secondary).send(eq("Pricing Sync Completed Successfully"), startsWith("*Sync:* sync-1"));
    }

    @Test
    void shouldPrefixCriticalAlerts() {
        // When
        alertService.critical("Usage record write failed after debit", "requestId=req-1");

        // Then
        verify(primary).send("[CRITICAL] Usage record write failed after debit", "requestId=req-1");
        verify(secondary).send("[CRITICAL] Usage record write failed after debit", "requestId=req-1");
    }

    @Test
    void shouldDetectExternalChannels() {
        // Given
        when(secondary.external()).thenReturn(true);

        // Then
        assertThat(alertService.hasExternalChannel()).isTrue();
        assertThat(new AlertService(List.of(new LoggingAlertChannel()), formatter).hasExternalChannel()).isFalse();
    }

    @Test
    void shouldFormatNotableChangesAndHealth() {
        // When
        String message = formatter.formatSyncMessage(result(true, false, 1));

        // Then
        assertThat(message)
            .contains("• Applied: 1")
            .contains("• openai:gpt-4o: Input +4.0%, Output -5.0%")
            .contains("*Health:* HEALTHY (90/100)")
            .contains("<https://billing.example.com/api/v1/pricing/status|View sync status>")
            .doesNotContain("*Errors:*");
        assertThat(SyncReportFormatter.formatPercent(null)).isEqualTo("n/a");
        assertThat(SyncReportFormatter.formatPercent(new BigDecimal("12.3456"))).isEqualTo("+12.3%");
    }

    @Test
    void shouldPostMarkdownPayloadToSlack() {
        // Given
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        server.expect(requestTo(WEBHOOK))
            .andExpect(method(HttpMethod.POST))
            .andExpect(content().contentType(MediaType.APPLICATION_JSON))
            .andExpect(jsonPath("$.text").value("*Pricing Sync Failed*\ndetails"))
            .andExpect(jsonPath("$.mrkdwn").value(true))
            .andRespond(withSuccess());
        SlackAlertChannel slack = new SlackAlertChannel(new BillingProperties(null, null, null, null,
            new AlertConfig(WEBHOOK, null), null), builder);

        // When
        slack.send("Pricing Sync Failed", "details");

        // Then
        server.verify();
        assertThat(slack.external()).isTrue();
    }

    private static SyncResult result(boolean success, boolean dryRun, int applied) {
        DetectedChange update = new DetectedChange(ChangeType.UPDATED, "gpt-4o", "openai",
            new BigDecimal("0.0025"), new BigDecimal("0.01"), new BigDecimal("0.0026"), new BigDecimal("0.0095"),
            new BigDecimal("4.0000"), new BigDecimal("-5.0000"), true, false, ValidationResult.ok(), List.of());
        ChangeSet changeSet = new ChangeSet(1, 0, 1, 0, 0, List.of(update), List.of(), List.of(), "1 models");
        return new SyncResult("sync-1", success, dryRun, dryRun ? SyncState.DRY_RUN_DONE : SyncState.APPLIED,
            List.of(SyncState.IDLE), new ProviderSummary(1, 1, 0, Map.of()),
            new ChangeSummary(1, applied, 1 - applied, 0, 0, 1, 0, 0), changeSet, List.of(),
            List.of(), List.of(), new HealthReport(90, HealthStatus.HEALTHY, List.of(), 1, 0, 0, 0, 0),
            Map.of(), NOW, NOW, 12);
    }
}
