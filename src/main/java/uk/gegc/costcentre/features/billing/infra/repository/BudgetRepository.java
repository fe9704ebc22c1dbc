package uk.gegc.costcentre.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.costcentre.features.billing.domain.model.Budget;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface BudgetRepository extends JpaRepository<Budget, UUID> {

    Optional<Budget> findByUserIdAndTenantId(UUID userId, UUID tenantId);

    List<Budget> findByTokenLimitGreaterThan(long tokenLimit);

    long countByTenantId(UUID tenantId);
}
