package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

@Schema(name = "OverageRates", description = "Unit prices charged beyond a plan's included quantities")
public record OverageRatesDto(
        @Schema(example = "6.00") BigDecimal tokensPerMillion,
        @Schema(example = "2.00") BigDecimal pagesPerThousand,
        @Schema(example = "0.10") BigDecimal storagePerGbMonth
) {}
