package uk.gegc.costcentre.features.billing.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.costcentre.features.billing.domain.model.UsageEvent;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

public interface UsageEventRepository extends JpaRepository<UsageEvent, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        select e from UsageEvent e
        where e.userId = :userId
          and e.tenantId = :tenantId
          and e.idempotencyKey = :idempotencyKey
    """)
    Optional<UsageEvent> findByIdempotencyKeyForUpdate(
            @Param("userId") UUID userId,
            @Param("tenantId") UUID tenantId,
            @Param("idempotencyKey") String idempotencyKey
    );

    Optional<UsageEvent> findByUserIdAndTenantIdAndIdempotencyKey(UUID userId, UUID tenantId, String idempotencyKey);

    Optional<UsageEvent> findByIdAndUserIdAndTenantId(UUID id, UUID userId, UUID tenantId);

    @Query("""
        select coalesce(sum(e.pagesProcessed), 0) from UsageEvent e
        where e.userId = :userId
          and e.tenantId = :tenantId
          and e.createdAt >= :start
          and e.createdAt < :end
    """)
    long sumPagesInWindow(
            @Param("userId") UUID userId,
            @Param("tenantId") UUID tenantId,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end
    );

    @Query("""
        select coalesce(sum(e.pagesProcessed), 0) from UsageEvent e
        where e.tenantId = :tenantId
          and e.createdAt >= :start
          and e.createdAt < :end
    """)
    long sumTenantPagesInWindow(
            @Param("tenantId") UUID tenantId,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end
    );

    @Query("""
        select e from UsageEvent e
        where e.userId = :userId
          and e.tenantId = :tenantId
          and (:eventType is null or e.eventType = :eventType)
          and (:dateFrom is null or e.createdAt >= :dateFrom)
          and (:dateTo is null or e.createdAt < :dateTo)
        order by e.createdAt desc
    """)
    Page<UsageEvent> findByFilters(
            @Param("userId") UUID userId,
            @Param("tenantId") UUID tenantId,
            @Param("eventType") String eventType,
            @Param("dateFrom") LocalDateTime dateFrom,
            @Param("dateTo") LocalDateTime dateTo,
            Pageable pageable
    );

    long countByUserIdAndTenantIdAndIdempotencyKey(UUID userId, UUID tenantId, String idempotencyKey);
}
