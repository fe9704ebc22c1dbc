package uk.gegc.costcentre.features.billing.infra.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.costcentre.features.billing.domain.model.UsageRecord;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

public interface UsageRecordRepository extends JpaRepository<UsageRecord, UUID> {

    Optional<UsageRecord> findFirstByEvent_Id(UUID eventId);

    long countByEvent_Id(UUID eventId);

    @Query("""
        select coalesce(sum(r.tokensUsed), 0) from UsageRecord r
        where r.userId = :userId
          and r.tenantId = :tenantId
          and r.createdAt >= :start
          and r.createdAt < :end
    """)
    long sumTokensInWindow(
            @Param("userId") UUID userId,
            @Param("tenantId") UUID tenantId,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end
    );

    @Query("""
        select coalesce(sum(r.tokensUsed), 0) from UsageRecord r
        where r.tenantId = :tenantId
          and r.createdAt >= :start
          and r.createdAt < :end
    """)
    long sumTenantTokensInWindow(
            @Param("tenantId") UUID tenantId,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end
    );

    @Query("""
        select r from UsageRecord r
        where r.userId = :userId
          and r.tenantId = :tenantId
          and (:dateFrom is null or r.createdAt >= :dateFrom)
          and (:dateTo is null or r.createdAt < :dateTo)
        order by r.createdAt desc
    """)
    Page<UsageRecord> findByFilters(
            @Param("userId") UUID userId,
            @Param("tenantId") UUID tenantId,
            @Param("dateFrom") LocalDateTime dateFrom,
            @Param("dateTo") LocalDateTime dateTo,
            Pageable pageable
    );
}
