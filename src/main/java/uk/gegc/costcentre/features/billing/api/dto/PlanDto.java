package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

@Schema(name = "Plan", description = "Catalog entry for a subscription plan")
public record PlanDto(
        @Schema(description = "Plan code", example = "business")
        String code,

        @Schema(description = "Display name", example = "Business")
        String name,

        @Schema(description = "List price per seat per month", example = "119.00")
        BigDecimal pricePerSeat,

        @Schema(description = "Included tokens; null when the plan has no token features, -1 when unlimited", example = "1000000", nullable = true)
        Long tokensIncluded,

        long pagesIncluded,
        long storageGbIncluded,
        String highlights
) {}
