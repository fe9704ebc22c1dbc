package uk.gegc.costcentre.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Plan state of a user within a tenant, mirrored from the billing provider.
 */
@Entity
@Table(
        name = "subscriptions",
        indexes = @Index(name = "idx_subscriptions_user_tenant_updated", columnList = "user_id, tenant_id, updated_at")
)
@Getter
@Setter
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "provider_subscription_id", unique = true, length = 255)
    private String providerSubscriptionId;

    @Column(name = "provider_payment_method_id", length = 255)
    private String providerPaymentMethodId;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider_status", nullable = false, length = 16)
    private ProviderStatus providerStatus = ProviderStatus.INACTIVE;

    @Column(name = "plan_code", nullable = false, length = 32)
    private String planCode;

    @Column(name = "seat_count", nullable = false)
    private int seatCount = 1;

    @Column(name = "annual_prepay", nullable = false)
    private boolean annualPrepay;

    @Column(name = "amount_billed", precision = 12, scale = 2)
    private BigDecimal amountBilled;

    @Column(name = "billing_cycle_start")
    private LocalDateTime billingCycleStart;

    @Column(name = "billing_cycle_end")
    private LocalDateTime billingCycleEnd;

    @Column(name = "tokens_item_id", length = 255)
    private String tokensItemId;

    @Column(name = "pages_item_id", length = 255)
    private String pagesItemId;

    @Column(name = "translation_item_id", length = 255)
    private String translationItemId;

    @Column(name = "redact_item_id", length = 255)
    private String redactItemId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Provider item id for the given metered sub-service, or {@code null} when none is attached.
     */
    public String itemIdFor(MeteredItem item) {
        return switch (item) {
            case TOKENS -> tokensItemId;
            case PAGES -> pagesItemId;
            case TRANSLATION -> translationItemId;
            case REDACT -> redactItemId;
        };
    }
}
