package uk.gegc.costcentre.features.billing.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.costcentre.features.billing.api.dto.PaymentDto;
import uk.gegc.costcentre.features.billing.api.dto.RecordUsageRequest;
import uk.gegc.costcentre.features.billing.api.dto.RecordedUsageDto;
import uk.gegc.costcentre.features.billing.api.dto.UsageEventDto;
import uk.gegc.costcentre.features.billing.api.dto.UsageRecordDto;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Caller-scoped access to the usage ledger and payment history.
 */
public interface UsageLedgerService {

    /**
     * Write a raw ledger entry without plan resolution or provider dispatch.
     */
    RecordedUsageDto record(UUID userId, RecordUsageRequest request);

    Page<UsageEventDto> listEvents(UUID userId, String eventType, LocalDateTime from, LocalDateTime to, Pageable pageable);

    UsageEventDto getEvent(UUID userId, UUID eventId);

    Page<UsageRecordDto> listUsageRecords(UUID userId, LocalDateTime from, LocalDateTime to, Pageable pageable);

    Page<PaymentDto> listPayments(UUID userId, Pageable pageable);
}
