package uk.gegc.costcentre.features.billing.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.costcentre.shared.config.FeatureFlags;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Best-effort, bounded, asynchronous delivery of usage reports.
 *
 * <p>The returned future always completes normally: provider errors and timeouts are logged,
 * counted and dropped. Callers never need to wait on it.
 */
@Slf4j
@Component
public class UsageDispatcher {

    private final UsageReportingClient reportingClient;
    private final Executor executor;
    private final BillingProperties billingProperties;
    private final BillingMetricsService metricsService;
    private final FeatureFlags featureFlags;
    private final Clock clock;

    public UsageDispatcher(UsageReportingClient reportingClient,
                           @Qualifier("usageDispatchExecutor") Executor executor,
                           BillingProperties billingProperties,
                           BillingMetricsService metricsService,
                           FeatureFlags featureFlags,
                           Clock clock) {
        this.reportingClient = reportingClient;
        this.executor = executor;
        this.billingProperties = billingProperties;
        this.metricsService = metricsService;
        this.featureFlags = featureFlags;
        this.clock = clock;
    }

    public CompletableFuture<Void> dispatch(UsageDispatch usage) {
        if (usage.quantity() <= 0 || !StringUtils.hasText(usage.itemId())) {
            return CompletableFuture.completedFuture(null);
        }
        if (!featureFlags.isUsageDispatch() || !reportingClient.isEnabled()) {
            log.debug("Usage dispatch disabled, skipping {} x{} for user {}", usage.item(), usage.quantity(), usage.userId());
            return CompletableFuture.completedFuture(null);
        }

        Instant timestamp = clock.instant();
        long timeoutMs = billingProperties.getDispatch().getTimeout().toMillis();

        CompletableFuture<Void> report;
        try {
            report = CompletableFuture.runAsync(
                    () -> reportingClient.reportUsage(usage.itemId(), usage.quantity(), timestamp, usage.idempotencyKey()),
                    executor);
        } catch (RejectedExecutionException ex) {
            metricsService.incrementDispatchFailed(usage.item());
            BillingStructuredLogger.logDispatch(log, "error", "Usage report for {} dropped: dispatch pool saturated",
                    usage.userId(), usage.tenantId(), usage.item().name(), usage.itemId(), usage.quantity(),
                    usage.item());
            return CompletableFuture.completedFuture(null);
        }

        return report
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((ignored, ex) -> {
                    if (ex == null) {
                        metricsService.incrementDispatchOk(usage.item());
                        BillingStructuredLogger.logDispatch(log, "info", "Reported {} {} usage to billing provider",
                                usage.userId(), usage.tenantId(), usage.item().name(), usage.itemId(), usage.quantity(),
                                usage.quantity(), usage.item());
                    } else {
                        metricsService.incrementDispatchFailed(usage.item());
                        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                        BillingStructuredLogger.logDispatch(log, "error", "Usage report for {} dropped: {}",
                                usage.userId(), usage.tenantId(), usage.item().name(), usage.itemId(), usage.quantity(),
                                usage.item(), cause.toString());
                    }
                    return null;
                });
    }
}
