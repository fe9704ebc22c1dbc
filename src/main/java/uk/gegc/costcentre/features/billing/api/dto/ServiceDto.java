package uk.gegc.costcentre.features.billing.api.dto;

import uk.gegc.costcentre.features.billing.domain.model.MeteredItem;

public record ServiceDto(
        String code,
        String name,
        boolean payable,
        MeteredItem meteredItem
) {}
