package uk.gegc.costcentre.features.billing.application;

import uk.gegc.costcentre.features.billing.domain.model.MeteredItem;

/**
 * Counters for the metering pipeline.
 */
public interface BillingMetricsService {

    void incrementEventRecorded(String serviceCode);

    void incrementEventReplayed(String serviceCode);

    void incrementTokensRecorded(String serviceCode, long tokens);

    void incrementPagesRecorded(String serviceCode, long pages);

    void incrementEntitlementDenied(String planCode, String serviceCode);

    /**
     * @param category one of {@code tokens}, {@code pages}, {@code storage}
     */
    void incrementOverageWarning(String category);

    void incrementDispatchOk(MeteredItem item);

    void incrementDispatchFailed(MeteredItem item);

    void incrementBudgetAlert();
}
