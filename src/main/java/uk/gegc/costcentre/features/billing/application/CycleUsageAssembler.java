package uk.gegc.costcentre.features.billing.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.costcentre.features.billing.api.dto.OverageDto;
import uk.gegc.costcentre.features.billing.api.dto.PlanQuotaDto;
import uk.gegc.costcentre.features.billing.api.dto.UsageSummary;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Builds the cycle-to-date usage and overage snapshot for a user against a resolved plan.
 */
@Component
@RequiredArgsConstructor
public class CycleUsageAssembler {

    private final UsageAggregator usageAggregator;
    private final OverageCalculator overageCalculator;

    public UsageSummary assemble(UUID userId, UUID tenantId, PlanEntitlement plan) {
        BillingCycle cycle = usageAggregator.currentCycle();
        long tokens = usageAggregator.tokensInWindow(userId, tenantId, cycle.start(), cycle.end());
        long pages = usageAggregator.pagesInWindow(userId, tenantId, cycle.start(), cycle.end());
        BigDecimal storageGb = usageAggregator.storageGb(tenantId);

        OverageDto overage = overageCalculator.overage(plan, tokens, pages, storageGb);
        return new UsageSummary(cycle.start(), cycle.end(), tokens, pages, storageGb, overage, toQuota(plan));
    }

    public static PlanQuotaDto toQuota(PlanEntitlement plan) {
        return new PlanQuotaDto(plan.code(), plan.name(), plan.tokensIncluded(), plan.pagesIncluded(), plan.storageGbIncluded());
    }
}
