package uk.gegc.costcentre.features.billing.application;

import uk.gegc.costcentre.features.billing.api.dto.BillingSummary;

import java.util.Map;
import java.util.UUID;

/**
 * Settles a completed metered operation.
 */
public interface BillingOrchestrator {

    /**
     * Record the actual usage (idempotently), recompute the cycle snapshot against the resolved plan
     * and hand incremental usage to the billing provider without waiting for it.
     *
     * @param idempotencyKey optional; a replay with the same key returns the original event
     */
    BillingSummary finalizeUsage(UUID userId, String serviceCode, long actualTokens, long actualPages,
                                 Map<String, Object> metadata, String idempotencyKey);
}
