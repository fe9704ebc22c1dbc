package uk.gegc.costcentre.features.billing.application;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Read-only sums over the committed ledger.
 *
 * <p>Tokens and pages are flows summed over {@code [start, end)}; storage is a standing quantity
 * read as the tenant's current snapshot.
 */
public interface UsageAggregator {

    long tokensInWindow(UUID userId, UUID tenantId, LocalDateTime start, LocalDateTime end);

    long pagesInWindow(UUID userId, UUID tenantId, LocalDateTime start, LocalDateTime end);

    BigDecimal storageGb(UUID tenantId);

    long tenantTokensInWindow(UUID tenantId, LocalDateTime start, LocalDateTime end);

    long tenantPagesInWindow(UUID tenantId, LocalDateTime start, LocalDateTime end);

    /**
     * The billing cycle containing the current instant of the service clock.
     */
    BillingCycle currentCycle();
}
