package uk.gegc.costcentre.features.billing.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record QuoteRequest(
        @NotBlank(message = "planCode must not be blank")
        String planCode,

        @Min(value = 1, message = "seatCount must be at least 1")
        int seatCount,

        boolean annualPrepay
) {}
