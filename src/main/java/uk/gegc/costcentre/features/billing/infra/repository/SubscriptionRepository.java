package uk.gegc.costcentre.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.costcentre.features.billing.domain.model.ProviderStatus;
import uk.gegc.costcentre.features.billing.domain.model.Subscription;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

    Optional<Subscription> findFirstByUserIdAndTenantIdAndProviderStatusInOrderByUpdatedAtDesc(
            UUID userId, UUID tenantId, Collection<ProviderStatus> statuses);

    Optional<Subscription> findFirstByUserIdAndTenantIdOrderByUpdatedAtDesc(UUID userId, UUID tenantId);
}
