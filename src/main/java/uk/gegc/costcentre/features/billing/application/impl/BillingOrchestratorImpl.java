package uk.gegc.costcentre.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.costcentre.features.billing.api.dto.BillingSummary;
import uk.gegc.costcentre.features.billing.api.dto.UsageSummary;
import uk.gegc.costcentre.features.billing.application.BillingOrchestrator;
import uk.gegc.costcentre.features.billing.application.CycleUsageAssembler;
import uk.gegc.costcentre.features.billing.application.PlanEntitlement;
import uk.gegc.costcentre.features.billing.application.PlanResolver;
import uk.gegc.costcentre.features.billing.application.RecordedUsage;
import uk.gegc.costcentre.features.billing.application.ServiceDefinition;
import uk.gegc.costcentre.features.billing.application.ServiceRegistry;
import uk.gegc.costcentre.features.billing.application.UsageDispatch;
import uk.gegc.costcentre.features.billing.application.UsageDispatcher;
import uk.gegc.costcentre.features.billing.application.UsageRecorder;
import uk.gegc.costcentre.features.billing.domain.model.MeteredItem;
import uk.gegc.costcentre.features.billing.domain.model.Subscription;
import uk.gegc.costcentre.features.billing.domain.model.UsageEvent;
import uk.gegc.costcentre.features.tenancy.application.TenantResolver;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class BillingOrchestratorImpl implements BillingOrchestrator {

    private final TenantResolver tenantResolver;
    private final ServiceRegistry serviceRegistry;
    private final UsageRecorder usageRecorder;
    private final PlanResolver planResolver;
    private final CycleUsageAssembler cycleUsageAssembler;
    private final UsageDispatcher usageDispatcher;

    @Override
    public BillingSummary finalizeUsage(UUID userId, String serviceCode, long actualTokens, long actualPages,
                                        Map<String, Object> metadata, String idempotencyKey) {
        UUID tenantId = tenantResolver.tenantFor(userId);
        ServiceDefinition service = serviceRegistry.require(serviceCode);

        RecordedUsage recorded = usageRecorder.record(userId, tenantId, serviceCode, actualTokens, actualPages,
                metadata, idempotencyKey);
        UsageEvent event = recorded.event();

        PlanEntitlement plan = planResolver.resolve(userId, tenantId);
        UsageSummary usage = cycleUsageAssembler.assemble(userId, tenantId, plan);

        // Replays re-send too; the provider deduplicates on the derived key.
        planResolver.activeSubscription(userId, tenantId)
                .ifPresent(subscription -> dispatch(subscription, service, event));

        log.debug("Finalized {} for user {} event {} replayed={}", serviceCode, userId, event.getId(), recorded.replayed());
        return new BillingSummary(event.getId(), event.getIdempotencyKey(), recorded.replayed(), usage);
    }

    private void dispatch(Subscription subscription, ServiceDefinition service, UsageEvent event) {
        if (event.getTokensUsed() > 0) {
            MeteredItem tokenItem = tokenItemFor(subscription, service);
            send(subscription, tokenItem, event.getTokensUsed(), event);
        }
        if (event.getPagesProcessed() > 0) {
            send(subscription, MeteredItem.PAGES, event.getPagesProcessed(), event);
        }
    }

    /**
     * A service with its own item on the subscription is billed there; otherwise tokens go to the shared tokens item.
     */
    private MeteredItem tokenItemFor(Subscription subscription, ServiceDefinition service) {
        return Optional.ofNullable(service.meteredItem())
                .filter(item -> subscription.itemIdFor(item) != null && !subscription.itemIdFor(item).isBlank())
                .orElse(MeteredItem.TOKENS);
    }

    private void send(Subscription subscription, MeteredItem item, long quantity, UsageEvent event) {
        String itemId = subscription.itemIdFor(item);
        if (itemId == null || itemId.isBlank()) {
            return;
        }
        String providerKey = event.getIdempotencyKey() + ":" + item.name().toLowerCase(Locale.ROOT);
        usageDispatcher.dispatch(new UsageDispatch(
                event.getUserId(), event.getTenantId(), item, itemId, quantity, providerKey));
    }
}
