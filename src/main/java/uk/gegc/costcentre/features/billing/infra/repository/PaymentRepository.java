package uk.gegc.costcentre.features.billing.infra.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.costcentre.features.billing.domain.model.Payment;

import java.util.UUID;

public interface PaymentRepository extends JpaRepository<Payment, UUID> {

    Page<Payment> findByUserIdAndTenantIdOrderByPaymentDateDesc(UUID userId, UUID tenantId, Pageable pageable);
}
