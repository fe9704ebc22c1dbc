package uk.gegc.costcentre.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Current storage footprint of a tenant. Maintained by the document store.
 */
@Entity
@Table(name = "storage_usage")
@Getter
@Setter
public class StorageUsage {

    @Id
    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "used_gb", nullable = false, precision = 12, scale = 3)
    private BigDecimal usedGb = BigDecimal.ZERO;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
