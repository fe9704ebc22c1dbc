package uk.gegc.costcentre.features.billing.application;

import uk.gegc.costcentre.features.billing.domain.exception.UsageDispatchException;

import java.time.Instant;

/**
 * Pushes incremental usage to the external billing provider.
 */
public interface UsageReportingClient {

    /**
     * Whether the provider is configured. Reports are skipped when it is not.
     */
    boolean isEnabled();

    /**
     * Increment the usage of a metered subscription item.
     *
     * @param idempotencyKey key the provider deduplicates repeated reports on
     * @throws UsageDispatchException if the provider is unreachable or rejects the report
     */
    void reportUsage(String itemId, long quantity, Instant timestamp, String idempotencyKey);
}
