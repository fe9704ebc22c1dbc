package uk.gegc.costcentre.shared.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Switches for the parts of billing that talk to the outside world.
 */
@Component
@ConfigurationProperties(prefix = "costcentre.features")
public class FeatureFlags {

    private boolean usageDispatch = true;
    private boolean budgetAlerts = true;

    public boolean isUsageDispatch() {
        return usageDispatch;
    }

    public void setUsageDispatch(boolean usageDispatch) {
        this.usageDispatch = usageDispatch;
    }

    public boolean isBudgetAlerts() {
        return budgetAlerts;
    }

    public void setBudgetAlerts(boolean budgetAlerts) {
        this.budgetAlerts = budgetAlerts;
    }
}
