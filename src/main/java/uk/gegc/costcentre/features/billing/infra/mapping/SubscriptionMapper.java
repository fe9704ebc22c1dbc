package uk.gegc.costcentre.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.costcentre.features.billing.api.dto.SubscriptionDto;
import uk.gegc.costcentre.features.billing.domain.model.Subscription;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface SubscriptionMapper {

    SubscriptionDto toDto(Subscription subscription);
}
