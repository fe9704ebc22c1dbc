package uk.gegc.costcentre.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.costcentre.features.billing.domain.model.StorageUsage;

import java.util.UUID;

public interface StorageUsageRepository extends JpaRepository<StorageUsage, UUID> {
}
