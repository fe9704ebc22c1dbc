package uk.gegc.costcentre.features.tenancy.domain.exception;

import java.util.UUID;

public class TenantNotResolvedException extends RuntimeException {

    private final UUID userId;

    public TenantNotResolvedException(UUID userId) {
        super("User " + userId + " does not belong to any tenant");
        this.userId = userId;
    }

    public UUID getUserId() {
        return userId;
    }
}
