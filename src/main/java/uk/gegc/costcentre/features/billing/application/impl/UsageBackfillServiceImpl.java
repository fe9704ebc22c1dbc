package uk.gegc.costcentre.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.costcentre.features.billing.api.dto.BackfillResult;
import uk.gegc.costcentre.features.billing.application.BillingMetricsService;
import uk.gegc.costcentre.features.billing.application.BillingStructuredLogger;
import uk.gegc.costcentre.features.billing.application.IdempotencyKeys;
import uk.gegc.costcentre.features.billing.application.UsageBackfillService;
import uk.gegc.costcentre.features.billing.application.UsageReportingClient;
import uk.gegc.costcentre.features.billing.domain.exception.BillingValidationException;
import uk.gegc.costcentre.features.billing.domain.exception.UsageDispatchException;
import uk.gegc.costcentre.features.billing.domain.model.MeteredItem;
import uk.gegc.costcentre.features.billing.domain.model.Subscription;
import uk.gegc.costcentre.features.billing.infra.repository.SubscriptionRepository;

import java.time.Clock;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UsageBackfillServiceImpl implements UsageBackfillService {

    private final SubscriptionRepository subscriptionRepository;
    private final UsageReportingClient reportingClient;
    private final BillingMetricsService metricsService;
    private final Clock clock;

    // No surrounding transaction: the provider calls must not hold a connection open
    @Override
    public BackfillResult backfillUsage(UUID subscriptionId, long tokensDelta, long pagesDelta, String batchKey) {
        if (tokensDelta < 0 || pagesDelta < 0) {
            throw new BillingValidationException("Backfill quantities must be >= 0");
        }
        if (batchKey != null && batchKey.length() > IdempotencyKeys.MAX_LENGTH) {
            throw new BillingValidationException("Idempotency key must be at most " + IdempotencyKeys.MAX_LENGTH + " characters");
        }
        Subscription subscription = subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new BillingValidationException("Unknown subscription " + subscriptionId));
        if (!reportingClient.isEnabled()) {
            throw new UsageDispatchException("Billing provider is not configured");
        }

        String key = StringUtils.hasText(batchKey) ? batchKey : IdempotencyKeys.generate("backfill", clock);
        long tokens = report(subscription, MeteredItem.TOKENS, tokensDelta, key);
        long pages = report(subscription, MeteredItem.PAGES, pagesDelta, key);
        return new BackfillResult(subscriptionId, tokens, pages);
    }

    private long report(Subscription subscription, MeteredItem item, long quantity, String batchKey) {
        if (quantity <= 0) {
            return 0L;
        }
        String itemId = subscription.itemIdFor(item);
        if (!StringUtils.hasText(itemId)) {
            throw new BillingValidationException("Subscription " + subscription.getId() + " has no " + item + " item");
        }
        try {
            reportingClient.reportUsage(itemId, quantity, clock.instant(),
                    batchKey + ":" + item.name().toLowerCase(Locale.ROOT));
        } catch (UsageDispatchException e) {
            metricsService.incrementDispatchFailed(item);
            throw e;
        }
        metricsService.incrementDispatchOk(item);
        BillingStructuredLogger.logDispatch(log, "info", "Backfilled {} {} for subscription {}",
                subscription.getUserId(), subscription.getTenantId(), item.name(), itemId, quantity,
                quantity, item, subscription.getId());
        return quantity;
    }
}
