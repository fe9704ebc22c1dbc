package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

@Schema(name = "Overage", description = "Overage charges accrued in the current billing cycle")
public record OverageDto(
        @Schema(description = "Token overage", example = "0.30")
        BigDecimal tokens,

        @Schema(description = "Page overage", example = "0.00")
        BigDecimal pages,

        @Schema(description = "Storage overage", example = "0.00")
        BigDecimal storage,

        @Schema(description = "Sum of all categories", example = "0.30")
        BigDecimal total,

        @Schema(description = "Currency code", example = "USD")
        String currency
) {
}
