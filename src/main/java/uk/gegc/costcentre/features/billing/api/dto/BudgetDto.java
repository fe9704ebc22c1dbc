package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Schema(name = "Budget", description = "Spending limits of the caller within their tenant")
public record BudgetDto(
        @Schema(description = "Token limit per billing cycle; 0 means no limit", example = "500000")
        long tokenLimit,

        @Schema(description = "Financial limit per billing cycle; 0 means no limit", example = "100.00")
        BigDecimal financialLimit,

        LocalDateTime updatedAt
) {}
