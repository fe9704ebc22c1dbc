package uk.gegc.costcentre.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.costcentre.features.billing.application.BillingCycle;
import uk.gegc.costcentre.features.billing.application.UsageAggregator;
import uk.gegc.costcentre.features.billing.domain.model.StorageUsage;
import uk.gegc.costcentre.features.billing.infra.repository.StorageUsageRepository;
import uk.gegc.costcentre.features.billing.infra.repository.UsageEventRepository;
import uk.gegc.costcentre.features.billing.infra.repository.UsageRecordRepository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true, isolation = Isolation.READ_COMMITTED)
public class UsageAggregatorImpl implements UsageAggregator {

    private final UsageRecordRepository usageRecordRepository;
    private final UsageEventRepository usageEventRepository;
    private final StorageUsageRepository storageUsageRepository;
    private final Clock clock;

    @Override
    public long tokensInWindow(UUID userId, UUID tenantId, LocalDateTime start, LocalDateTime end) {
        return usageRecordRepository.sumTokensInWindow(userId, tenantId, start, end);
    }

    @Override
    public long pagesInWindow(UUID userId, UUID tenantId, LocalDateTime start, LocalDateTime end) {
        return usageEventRepository.sumPagesInWindow(userId, tenantId, start, end);
    }

    @Override
    public BigDecimal storageGb(UUID tenantId) {
        return storageUsageRepository.findById(tenantId)
                .map(StorageUsage::getUsedGb)
                .orElse(BigDecimal.ZERO);
    }

    @Override
    public long tenantTokensInWindow(UUID tenantId, LocalDateTime start, LocalDateTime end) {
        return usageRecordRepository.sumTenantTokensInWindow(tenantId, start, end);
    }

    @Override
    public long tenantPagesInWindow(UUID tenantId, LocalDateTime start, LocalDateTime end) {
        return usageEventRepository.sumTenantPagesInWindow(tenantId, start, end);
    }

    @Override
    @Transactional(propagation = Propagation.SUPPORTS)
    public BillingCycle currentCycle() {
        return BillingCycle.containing(LocalDateTime.now(clock));
    }
}
