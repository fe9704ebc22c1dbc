package uk.gegc.costcentre.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.costcentre.features.billing.application.BillingCycle;
import uk.gegc.costcentre.features.billing.application.BillingMetricsService;
import uk.gegc.costcentre.features.billing.application.BillingStructuredLogger;
import uk.gegc.costcentre.features.billing.application.EntitlementCheck;
import uk.gegc.costcentre.features.billing.application.EntitlementEnforcer;
import uk.gegc.costcentre.features.billing.application.PlanEntitlement;
import uk.gegc.costcentre.features.billing.application.PlanResolver;
import uk.gegc.costcentre.features.billing.application.ServiceRegistry;
import uk.gegc.costcentre.features.billing.application.UsageAggregator;
import uk.gegc.costcentre.features.billing.domain.exception.EntitlementDeniedException;
import uk.gegc.costcentre.features.tenancy.application.TenantResolver;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class EntitlementEnforcerImpl implements EntitlementEnforcer {

    private final TenantResolver tenantResolver;
    private final ServiceRegistry serviceRegistry;
    private final PlanResolver planResolver;
    private final UsageAggregator usageAggregator;
    private final BillingMetricsService metricsService;

    @Override
    public EntitlementCheck enforce(UUID userId, String serviceCode, long estimatedTokens, long estimatedPages) {
        UUID tenantId = tenantResolver.tenantFor(userId);
        serviceRegistry.require(serviceCode);
        PlanEntitlement plan = planResolver.resolve(userId, tenantId);

        long tokens = Math.max(estimatedTokens, 0L);
        long pages = Math.max(estimatedPages, 0L);

        if (tokens > 0 && plan.tokensDisabled()) {
            metricsService.incrementEntitlementDenied(plan.code(), serviceCode);
            BillingStructuredLogger.logEntitlement(log, "warn",
                    "Plan {} does not include tokens, denying {} estimated tokens",
                    userId, tenantId, serviceCode, plan.code(), "tokens", plan.code(), tokens);
            throw new EntitlementDeniedException(plan.code(), serviceCode, tokens);
        }

        BillingCycle cycle = usageAggregator.currentCycle();
        List<String> overage = new ArrayList<>();

        if (plan.hasTokenQuota()) {
            long used = usageAggregator.tokensInWindow(userId, tenantId, cycle.start(), cycle.end());
            if (used + tokens > plan.tokensIncluded()) {
                overage.add("tokens");
                warnOverage(userId, tenantId, serviceCode, plan, "tokens",
                        "Token usage will exceed included quota ({} + {} > {}); overage will apply",
                        used, tokens, plan.tokensIncluded());
            }
        }

        long usedPages = usageAggregator.pagesInWindow(userId, tenantId, cycle.start(), cycle.end());
        if (usedPages + pages > plan.pagesIncluded()) {
            overage.add("pages");
            warnOverage(userId, tenantId, serviceCode, plan, "pages",
                    "Page processing will exceed included quota ({} + {} > {}); overage will apply",
                    usedPages, pages, plan.pagesIncluded());
        }

        // Storage is a standing quantity: compare the snapshot, no estimate
        BigDecimal storageGb = usageAggregator.storageGb(tenantId);
        if (storageGb.compareTo(BigDecimal.valueOf(plan.storageGbIncluded())) > 0) {
            overage.add("storage");
            warnOverage(userId, tenantId, serviceCode, plan, "storage",
                    "Storage exceeds included quota ({} GB > {} GB); storage overage will apply",
                    storageGb, plan.storageGbIncluded());
        }

        return new EntitlementCheck(tenantId, plan.code(), serviceCode, List.copyOf(overage));
    }

    private void warnOverage(UUID userId, UUID tenantId, String serviceCode, PlanEntitlement plan,
                             String category, String message, Object... args) {
        metricsService.incrementOverageWarning(category);
        BillingStructuredLogger.logEntitlement(log, "warn", message,
                userId, tenantId, serviceCode, plan.code(), category, args);
    }
}
