package uk.gegc.costcentre.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.costcentre.features.billing.api.dto.PaymentDto;
import uk.gegc.costcentre.features.billing.api.dto.RecordUsageRequest;
import uk.gegc.costcentre.features.billing.api.dto.RecordedUsageDto;
import uk.gegc.costcentre.features.billing.api.dto.UsageEventDto;
import uk.gegc.costcentre.features.billing.api.dto.UsageRecordDto;
import uk.gegc.costcentre.features.billing.application.UsageLedgerService;
import uk.gegc.costcentre.features.billing.application.UsageRecorder;
import uk.gegc.costcentre.features.billing.infra.mapping.PaymentMapper;
import uk.gegc.costcentre.features.billing.infra.mapping.UsageLedgerMapper;
import uk.gegc.costcentre.features.billing.infra.repository.PaymentRepository;
import uk.gegc.costcentre.features.billing.infra.repository.UsageEventRepository;
import uk.gegc.costcentre.features.billing.infra.repository.UsageRecordRepository;
import uk.gegc.costcentre.features.tenancy.application.TenantResolver;
import uk.gegc.costcentre.shared.exception.ResourceNotFoundException;

import java.time.LocalDateTime;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class UsageLedgerServiceImpl implements UsageLedgerService {

    private final TenantResolver tenantResolver;
    private final UsageRecorder usageRecorder;
    private final UsageEventRepository usageEventRepository;
    private final UsageRecordRepository usageRecordRepository;
    private final PaymentRepository paymentRepository;
    private final UsageLedgerMapper ledgerMapper;
    private final PaymentMapper paymentMapper;

    @Override
    public RecordedUsageDto record(UUID userId, RecordUsageRequest request) {
        UUID tenantId = tenantResolver.tenantFor(userId);
        return ledgerMapper.toDto(usageRecorder.record(userId, tenantId, request.serviceCode(),
                request.tokensUsed(), request.pagesProcessed(), request.metadata(), request.idempotencyKey()));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<UsageEventDto> listEvents(UUID userId, String eventType, LocalDateTime from, LocalDateTime to,
                                          Pageable pageable) {
        UUID tenantId = tenantResolver.tenantFor(userId);
        return usageEventRepository.findByFilters(userId, tenantId, eventType, from, to, pageable)
                .map(ledgerMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public UsageEventDto getEvent(UUID userId, UUID eventId) {
        UUID tenantId = tenantResolver.tenantFor(userId);
        return usageEventRepository.findByIdAndUserIdAndTenantId(eventId, userId, tenantId)
                .map(ledgerMapper::toDto)
                .orElseThrow(() -> new ResourceNotFoundException("Usage event " + eventId + " not found"));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<UsageRecordDto> listUsageRecords(UUID userId, LocalDateTime from, LocalDateTime to, Pageable pageable) {
        UUID tenantId = tenantResolver.tenantFor(userId);
        return usageRecordRepository.findByFilters(userId, tenantId, from, to, pageable)
                .map(ledgerMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<PaymentDto> listPayments(UUID userId, Pageable pageable) {
        UUID tenantId = tenantResolver.tenantFor(userId);
        return paymentRepository.findByUserIdAndTenantIdOrderByPaymentDateDesc(userId, tenantId, pageable)
                .map(paymentMapper::toDto);
    }
}
