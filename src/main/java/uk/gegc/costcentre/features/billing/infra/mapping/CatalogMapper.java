package uk.gegc.costcentre.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.costcentre.features.billing.api.dto.EntitlementCheckDto;
import uk.gegc.costcentre.features.billing.api.dto.OverageRatesDto;
import uk.gegc.costcentre.features.billing.api.dto.PlanDto;
import uk.gegc.costcentre.features.billing.api.dto.ServiceDto;
import uk.gegc.costcentre.features.billing.application.BillingProperties;
import uk.gegc.costcentre.features.billing.application.EntitlementCheck;
import uk.gegc.costcentre.features.billing.application.PlanEntitlement;
import uk.gegc.costcentre.features.billing.application.ServiceDefinition;

import java.util.Collection;
import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface CatalogMapper {

    PlanDto toDto(PlanEntitlement plan);

    List<PlanDto> toPlanDtos(Collection<PlanEntitlement> plans);

    ServiceDto toDto(ServiceDefinition service);

    List<ServiceDto> toServiceDtos(Collection<ServiceDefinition> services);

    OverageRatesDto toDto(BillingProperties.Overage overage);

    @Mapping(target = "overageExpected", expression = "java(check.overageExpected())")
    EntitlementCheckDto toDto(EntitlementCheck check);
}
