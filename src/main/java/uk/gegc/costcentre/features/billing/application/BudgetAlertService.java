package uk.gegc.costcentre.features.billing.application;

public interface BudgetAlertService {

    /**
     * Check every budget with a token limit against the current cycle's usage.
     *
     * @return number of budgets at or above the alert threshold
     */
    int scanBudgets();
}
