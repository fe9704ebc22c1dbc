package uk.gegc.costcentre.features.billing.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.costcentre.features.billing.api.dto.BackfillResult;
import uk.gegc.costcentre.features.billing.application.BillingMetricsService;
import uk.gegc.costcentre.features.billing.application.UsageReportingClient;
import uk.gegc.costcentre.features.billing.domain.exception.BillingValidationException;
import uk.gegc.costcentre.features.billing.domain.exception.UsageDispatchException;
import uk.gegc.costcentre.features.billing.domain.model.MeteredItem;
import uk.gegc.costcentre.features.billing.domain.model.Subscription;
import uk.gegc.costcentre.features.billing.infra.repository.SubscriptionRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("UsageBackfillServiceImpl")
class UsageBackfillServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-06-15T10:00:00Z");

    @Mock
    private SubscriptionRepository subscriptionRepository;
    @Mock
    private UsageReportingClient reportingClient;
    @Mock
    private BillingMetricsService metricsService;

    private UsageBackfillServiceImpl service;
    private Subscription subscription;

    @BeforeEach
    void setUp() {
        service = new UsageBackfillServiceImpl(subscriptionRepository, reportingClient, metricsService,
                Clock.fixed(NOW, ZoneOffset.UTC));
        subscription = new Subscription();
        subscription.setId(UUID.randomUUID());
        subscription.setUserId(UUID.randomUUID());
        subscription.setTenantId(UUID.randomUUID());
        subscription.setPlanCode("pro");
        subscription.setTokensItemId("si_tokens");
        subscription.setPagesItemId("si_pages");
        when(subscriptionRepository.findById(subscription.getId())).thenReturn(Optional.of(subscription));
        when(reportingClient.isEnabled()).thenReturn(true);
    }

    @Test
    @DisplayName("reports both quantities under one batch key")
    void reportsBoth() {
        BackfillResult result = service.backfillUsage(subscription.getId(), 10_000, 40);

        assertThat(result.tokensReported()).isEqualTo(10_000);
        assertThat(result.pagesReported()).isEqualTo(40);

        ArgumentCaptor<String> tokenKey = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> pageKey = ArgumentCaptor.forClass(String.class);
        verify(reportingClient).reportUsage(eq("si_tokens"), eq(10_000L), eq(NOW), tokenKey.capture());
        verify(reportingClient).reportUsage(eq("si_pages"), eq(40L), eq(NOW), pageKey.capture());
        assertThat(tokenKey.getValue()).startsWith("backfill_").endsWith(":tokens");
        assertThat(pageKey.getValue()).endsWith(":pages");
        assertThat(tokenKey.getValue().replace(":tokens", "")).isEqualTo(pageKey.getValue().replace(":pages", ""));
        verify(metricsService).incrementDispatchOk(MeteredItem.TOKENS);
        verify(metricsService).incrementDispatchOk(MeteredItem.PAGES);
    }

    @Test
    @DisplayName("zero deltas are skipped")
    void zeroSkipped() {
        BackfillResult result = service.backfillUsage(subscription.getId(), 0, 5);

        assertThat(result.tokensReported()).isZero();
        verify(reportingClient, never()).reportUsage(eq("si_tokens"), anyLong(), any(), anyString());
    }

    @Test
    @DisplayName("negative deltas are rejected")
    void negative() {
        assertThatThrownBy(() -> service.backfillUsage(subscription.getId(), -1, 0))
                .isInstanceOf(BillingValidationException.class);
    }

    @Test
    @DisplayName("unknown subscription is rejected")
    void unknownSubscription() {
        UUID unknown = UUID.randomUUID();
        when(subscriptionRepository.findById(unknown)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.backfillUsage(unknown, 1, 0))
                .isInstanceOf(BillingValidationException.class)
                .hasMessageContaining("Unknown subscription");
    }

    @Test
    @DisplayName("fails when the provider is not configured")
    void providerDisabled() {
        when(reportingClient.isEnabled()).thenReturn(false);

        assertThatThrownBy(() -> service.backfillUsage(subscription.getId(), 1, 0))
                .isInstanceOf(UsageDispatchException.class);
    }

    @Test
    @DisplayName("a missing item is a validation error")
    void missingItem() {
        subscription.setPagesItemId(null);

        assertThatThrownBy(() -> service.backfillUsage(subscription.getId(), 0, 3))
                .isInstanceOf(BillingValidationException.class);
    }

    @Test
    @DisplayName("provider errors propagate and are counted")
    void providerError() {
        doThrow(new UsageDispatchException("rejected"))
                .when(reportingClient).reportUsage(eq("si_tokens"), anyLong(), any(), anyString());

        assertThatThrownBy(() -> service.backfillUsage(subscription.getId(), 5, 0))
                .isInstanceOf(UsageDispatchException.class);
        verify(metricsService).incrementDispatchFailed(MeteredItem.TOKENS);
    }

    @Test
    @DisplayName("a retry with the caller's batch key resends identical provider keys")
    void retryReusesBatchKey() {
        doThrow(new UsageDispatchException("pages rejected"))
                .doNothing()
                .when(reportingClient).reportUsage(eq("si_pages"), anyLong(), any(), anyString());

        assertThatThrownBy(() -> service.backfillUsage(subscription.getId(), 10_000, 40, "backfill-june"))
                .isInstanceOf(UsageDispatchException.class);
        BackfillResult retried = service.backfillUsage(subscription.getId(), 10_000, 40, "backfill-june");

        assertThat(retried.pagesReported()).isEqualTo(40);
        verify(reportingClient, times(2)).reportUsage("si_tokens", 10_000L, NOW, "backfill-june:tokens");
        verify(reportingClient, times(2)).reportUsage("si_pages", 40L, NOW, "backfill-june:pages");
    }

    @Test
    @DisplayName("an oversized batch key is rejected before any report")
    void batchKeyTooLong() {
        assertThatThrownBy(() -> service.backfillUsage(subscription.getId(), 1, 0, "k".repeat(81)))
                .isInstanceOf(BillingValidationException.class);
        verify(reportingClient, never()).reportUsage(anyString(), anyLong(), any(), anyString());
    }

    @Test
    @DisplayName("provider calls run outside a database transaction")
    void notTransactional() throws Exception {
        assertThat(UsageBackfillServiceImpl.class
                .getMethod("backfillUsage", UUID.class, long.class, long.class, String.class)
                .isAnnotationPresent(Transactional.class)).isFalse();
        assertThat(UsageBackfillServiceImpl.class.isAnnotationPresent(Transactional.class)).isFalse();
    }
}
