package uk.gegc.costcentre.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.costcentre.features.billing.api.dto.TenantSummaryDto;
import uk.gegc.costcentre.features.billing.api.dto.UsageSummary;
import uk.gegc.costcentre.features.billing.application.BillingCycle;
import uk.gegc.costcentre.features.billing.application.CycleUsageAssembler;
import uk.gegc.costcentre.features.billing.application.PlanResolver;
import uk.gegc.costcentre.features.billing.application.UsageAggregator;
import uk.gegc.costcentre.features.billing.application.UsageSummaryService;
import uk.gegc.costcentre.features.billing.infra.repository.BudgetRepository;
import uk.gegc.costcentre.features.tenancy.application.TenantResolver;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UsageSummaryServiceImpl implements UsageSummaryService {

    private final TenantResolver tenantResolver;
    private final PlanResolver planResolver;
    private final CycleUsageAssembler cycleUsageAssembler;
    private final UsageAggregator usageAggregator;
    private final BudgetRepository budgetRepository;

    @Override
    public UsageSummary summarize(UUID userId) {
        UUID tenantId = tenantResolver.tenantFor(userId);
        return cycleUsageAssembler.assemble(userId, tenantId, planResolver.resolve(userId, tenantId));
    }

    @Override
    public TenantSummaryDto tenantSummary(UUID userId) {
        UUID tenantId = tenantResolver.tenantFor(userId);
        BillingCycle cycle = usageAggregator.currentCycle();
        return new TenantSummaryDto(
                tenantId,
                cycle.start(),
                cycle.end(),
                usageAggregator.tenantTokensInWindow(tenantId, cycle.start(), cycle.end()),
                usageAggregator.tenantPagesInWindow(tenantId, cycle.start(), cycle.end()),
                usageAggregator.storageGb(tenantId),
                budgetRepository.countByTenantId(tenantId)
        );
    }
}
