package uk.gegc.costcentre.features.tenancy.application;

import uk.gegc.costcentre.features.tenancy.domain.exception.TenantNotResolvedException;

import java.util.UUID;

/**
 * Resolves the tenant a user's usage is billed under.
 */
public interface TenantResolver {

    /**
     * @throws TenantNotResolvedException if the user has no tenant
     */
    UUID tenantFor(UUID userId);
}
