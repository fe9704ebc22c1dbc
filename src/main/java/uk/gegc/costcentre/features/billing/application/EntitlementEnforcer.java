package uk.gegc.costcentre.features.billing.application;

import java.util.UUID;

/**
 * Pre-flight gate evaluated before a metered operation starts. Never writes.
 */
public interface EntitlementEnforcer {

    /**
     * Allows the operation, possibly flagging expected overage, or refuses it outright.
     *
     * @throws uk.gegc.costcentre.features.billing.domain.exception.EntitlementDeniedException when tokens are
     *         estimated and the resolved plan has no token features
     * @throws uk.gegc.costcentre.features.billing.domain.exception.UnknownServiceException for an unregistered service
     * @throws uk.gegc.costcentre.features.tenancy.domain.exception.TenantNotResolvedException when the user has no tenant
     */
    EntitlementCheck enforce(UUID userId, String serviceCode, long estimatedTokens, long estimatedPages);
}
