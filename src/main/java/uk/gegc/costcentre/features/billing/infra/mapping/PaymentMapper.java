package uk.gegc.costcentre.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.costcentre.features.billing.api.dto.PaymentDto;
import uk.gegc.costcentre.features.billing.domain.model.Payment;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface PaymentMapper {

    PaymentDto toDto(Payment payment);
}
