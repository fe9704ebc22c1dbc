package uk.gegc.costcentre.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.costcentre.features.billing.application.BillingCycle;
import uk.gegc.costcentre.features.billing.application.BillingMetricsService;
import uk.gegc.costcentre.features.billing.application.BillingProperties;
import uk.gegc.costcentre.features.billing.application.BudgetAlertService;
import uk.gegc.costcentre.features.billing.application.UsageAggregator;
import uk.gegc.costcentre.features.billing.domain.model.Budget;
import uk.gegc.costcentre.features.billing.infra.repository.BudgetRepository;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class BudgetAlertServiceImpl implements BudgetAlertService {

    private final BudgetRepository budgetRepository;
    private final UsageAggregator usageAggregator;
    private final BillingMetricsService metricsService;
    private final BillingProperties billingProperties;

    @Override
    public int scanBudgets() {
        BillingCycle cycle = usageAggregator.currentCycle();
        int thresholdPct = billingProperties.getAlerts().getThresholdPct();
        List<Budget> budgets = budgetRepository.findByTokenLimitGreaterThan(0L);

        int alerts = 0;
        for (Budget budget : budgets) {
            try {
                long used = usageAggregator.tokensInWindow(budget.getUserId(), budget.getTenantId(), cycle.start(), cycle.end());
                // used / limit >= pct / 100, in integer arithmetic
                if (used * 100 >= budget.getTokenLimit() * thresholdPct) {
                    alerts++;
                    metricsService.incrementBudgetAlert();
                    log.warn("Budget alert: user {} tenant {} used {} of {} tokens ({}% threshold)",
                            budget.getUserId(), budget.getTenantId(), used, budget.getTokenLimit(), thresholdPct);
                }
            } catch (Exception e) {
                log.error("Budget check failed for user {} tenant {}: {}",
                        budget.getUserId(), budget.getTenantId(), e.getMessage(), e);
            }
        }
        log.debug("Budget scan complete: {} budgets, {} alerts", budgets.size(), alerts);
        return alerts;
    }
}
