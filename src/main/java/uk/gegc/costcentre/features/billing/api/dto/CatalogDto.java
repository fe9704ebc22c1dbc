package uk.gegc.costcentre.features.billing.api.dto;

import java.util.List;

public record CatalogDto(
        String currency,
        List<PlanDto> plans,
        List<ServiceDto> services,
        OverageRatesDto overageRates
) {}
