package uk.gegc.costcentre.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Check;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One billable or non-payable action. Written once by the usage recorder and never updated.
 */
@Entity
@Table(
        name = "usage_events",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_usage_events_user_tenant_key",
                columnNames = {"user_id", "tenant_id", "idempotency_key"}
        ),
        indexes = {
                @Index(name = "idx_usage_events_user_tenant_created", columnList = "user_id, tenant_id, created_at"),
                @Index(name = "idx_usage_events_tenant_created", columnList = "tenant_id, created_at")
        }
)
@Check(constraints = "tokens_used = 0 OR service_type = 'PAYABLE'")
@Getter
@Setter
public class UsageEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "event_type", nullable = false, updatable = false, length = 64)
    private String eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "service_type", nullable = false, updatable = false, length = 16)
    private ServiceType serviceType;

    @Column(name = "idempotency_key", updatable = false, length = 80)
    private String idempotencyKey;

    @Column(name = "metadata", updatable = false, columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "tokens_used", nullable = false, updatable = false)
    private long tokensUsed;

    @Column(name = "pages_processed", nullable = false, updatable = false)
    private long pagesProcessed;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (tokensUsed > 0 && serviceType != ServiceType.PAYABLE) {
            throw new IllegalStateException("Non-payable event " + eventType + " cannot carry token usage");
        }
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
