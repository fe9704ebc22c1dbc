package uk.gegc.costcentre.features.billing.application;

import uk.gegc.costcentre.features.billing.api.dto.BackfillResult;

import java.util.UUID;

/**
 * Pushes usage that never reached the billing provider. Runs synchronously and surfaces provider errors.
 */
public interface UsageBackfillService {

    /**
     * @param batchKey provider idempotency key shared by the token and page reports, suffixed per item.
     *                 Retrying with the same key never double-reports an item the provider already accepted.
     *                 {@code null} or blank generates a fresh key.
     */
    BackfillResult backfillUsage(UUID subscriptionId, long tokensDelta, long pagesDelta, String batchKey);

    default BackfillResult backfillUsage(UUID subscriptionId, long tokensDelta, long pagesDelta) {
        return backfillUsage(subscriptionId, tokensDelta, pagesDelta, null);
    }
}
