package uk.gegc.costcentre.features.billing.application;

import uk.gegc.costcentre.features.billing.domain.exception.UsageDispatchException;

/**
 * Reads subscription state from the external billing provider.
 */
public interface SubscriptionStatusClient {

    /**
     * @return the provider's raw status string, e.g. {@code active} or {@code past_due}
     * @throws UsageDispatchException if the provider cannot be reached
     */
    String fetchStatus(String providerSubscriptionId);
}
