package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;

@Schema(name = "UpdateSubscriptionRequest", description = "Fields left null are not changed")
public record UpdateSubscriptionRequest(
        @Schema(description = "Plan code from the catalog", example = "business")
        String planCode,

        @Schema(description = "Number of seats", example = "12")
        @Min(value = 1, message = "seatCount must be at least 1")
        Integer seatCount,

        @Schema(description = "Pay a year up front")
        Boolean annualPrepay
) {}
