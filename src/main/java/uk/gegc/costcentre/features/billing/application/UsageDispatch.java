package uk.gegc.costcentre.features.billing.application;

import uk.gegc.costcentre.features.billing.domain.model.MeteredItem;

import java.util.UUID;

/**
 * One incremental usage report bound for the billing provider.
 */
public record UsageDispatch(
        UUID userId,
        UUID tenantId,
        MeteredItem item,
        String itemId,
        long quantity,
        String idempotencyKey
) {
}
