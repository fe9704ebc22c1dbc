package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

@Schema(name = "PriceQuote", description = "Monthly price preview for a plan, seat count and term")
public record PriceQuote(
        @Schema(description = "Plan code", example = "business")
        String planCode,

        @Schema(description = "Plan display name", example = "Business")
        String planName,

        @Schema(description = "Number of seats", example = "11")
        int seatCount,

        @Schema(description = "Discounted price per seat per month", example = "107.10")
        BigDecimal seatPrice,

        @Schema(description = "Monthly total for all seats", example = "1178.10")
        BigDecimal monthlyAmount,

        @Schema(description = "Volume discount in percent", example = "10")
        int volumeDiscountPct,

        @Schema(description = "Annual prepay discount in percent", example = "0")
        int termDiscountPct,

        @Schema(description = "Currency code", example = "USD")
        String currency
) {
}
