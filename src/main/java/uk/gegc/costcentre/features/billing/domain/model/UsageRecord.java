package uk.gegc.costcentre.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Atomic token consumption unit. Survives the purge of its event; the link is nulled by the database.
 */
@Entity
@Table(
        name = "usage_records",
        indexes = {
                @Index(name = "idx_usage_records_user_tenant_created", columnList = "user_id, tenant_id, created_at"),
                @Index(name = "idx_usage_records_event", columnList = "event_id")
        }
)
@Getter
@Setter
public class UsageRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "tokens_used", nullable = false, updatable = false)
    private long tokensUsed;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "event_id", updatable = false)
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private UsageEvent event;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (tokensUsed <= 0) {
            throw new IllegalStateException("Usage record must carry a positive token count");
        }
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
