package uk.gegc.costcentre.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(
        name = "payments",
        indexes = @Index(name = "idx_payments_user_tenant_date", columnList = "user_id, tenant_id, payment_date")
)
@Getter
@Setter
public class Payment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "amount_paid", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal amountPaid;

    @Column(name = "currency", nullable = false, updatable = false, length = 10)
    private String currency = "USD";

    @Column(name = "payment_date", nullable = false, updatable = false)
    private LocalDateTime paymentDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, updatable = false, length = 16)
    private PaymentMethod paymentMethod = PaymentMethod.CARD;

    @Column(name = "provider_payment_intent", updatable = false, length = 255)
    private String providerPaymentIntent;
}
