package uk.gegc.costcentre.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.costcentre.features.billing.api.dto.RecordedUsageDto;
import uk.gegc.costcentre.features.billing.api.dto.UsageEventDto;
import uk.gegc.costcentre.features.billing.api.dto.UsageRecordDto;
import uk.gegc.costcentre.features.billing.application.RecordedUsage;
import uk.gegc.costcentre.features.billing.domain.model.UsageEvent;
import uk.gegc.costcentre.features.billing.domain.model.UsageRecord;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface UsageLedgerMapper {

    UsageEventDto toDto(UsageEvent event);

    @Mapping(target = "eventId", source = "event.id")
    UsageRecordDto toDto(UsageRecord record);

    RecordedUsageDto toDto(RecordedUsage recorded);
}
