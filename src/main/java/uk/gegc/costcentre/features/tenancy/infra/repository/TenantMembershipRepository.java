package uk.gegc.costcentre.features.tenancy.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.costcentre.features.tenancy.domain.model.TenantMembership;

import java.util.Optional;
import java.util.UUID;

public interface TenantMembershipRepository extends JpaRepository<TenantMembership, UUID> {

    Optional<TenantMembership> findByUserId(UUID userId);
}
