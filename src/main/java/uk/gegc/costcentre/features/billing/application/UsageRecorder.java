package uk.gegc.costcentre.features.billing.application;

import java.util.Map;
import java.util.UUID;

/**
 * Writes usage events at most once per {@code (user, tenant, idempotencyKey)}.
 */
public interface UsageRecorder {

    /**
     * Record an event and, when {@code tokensUsed > 0}, its linked usage record.
     *
     * <p>A call carrying a key that was already recorded returns the stored event and record without
     * writing. Without a key a fresh one is generated, so the call always writes.
     *
     * @throws uk.gegc.costcentre.features.billing.domain.exception.UnknownServiceException for an unregistered service code
     * @throws uk.gegc.costcentre.features.billing.domain.exception.BillingValidationException for tokens on a non-payable service
     */
    default RecordedUsage record(UUID userId, UUID tenantId, String serviceCode, long tokensUsed,
                                 Map<String, Object> metadata, String idempotencyKey) {
        return record(userId, tenantId, serviceCode, tokensUsed, 0L, metadata, idempotencyKey);
    }

    RecordedUsage record(UUID userId, UUID tenantId, String serviceCode, long tokensUsed, long pagesProcessed,
                         Map<String, Object> metadata, String idempotencyKey);
}
