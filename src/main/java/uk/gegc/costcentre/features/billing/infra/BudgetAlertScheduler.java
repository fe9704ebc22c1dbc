package uk.gegc.costcentre.features.billing.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.costcentre.features.billing.application.BudgetAlertService;
import uk.gegc.costcentre.shared.config.FeatureFlags;

/**
 * Periodically checks budgets against cycle-to-date token usage.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "billing.alerts.enabled", havingValue = "true", matchIfMissing = true)
public class BudgetAlertScheduler {

    private final BudgetAlertService budgetAlertService;
    private final FeatureFlags featureFlags;

    @Scheduled(cron = "${billing.alerts.cron:0 0 * * * *}")
    public void scanBudgets() {
        if (!featureFlags.isBudgetAlerts()) {
            return;
        }
        try {
            budgetAlertService.scanBudgets();
        } catch (Exception e) {
            log.warn("BudgetAlertScheduler: error during budget scan", e);
        }
    }
}
