package uk.gegc.costcentre.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.costcentre.features.billing.api.dto.BudgetDto;
import uk.gegc.costcentre.features.billing.domain.model.Budget;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface BudgetMapper {

    BudgetDto toDto(Budget budget);
}
