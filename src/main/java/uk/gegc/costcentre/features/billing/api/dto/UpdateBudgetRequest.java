package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

@Schema(name = "UpdateBudgetRequest", description = "Fields left null are not changed")
public record UpdateBudgetRequest(
        @Schema(description = "Token limit per cycle; 0 disables the limit", example = "500000")
        @PositiveOrZero(message = "tokenLimit must be >= 0")
        Long tokenLimit,

        @Schema(description = "Financial limit per cycle", example = "100.00")
        @DecimalMin(value = "0.00", message = "financialLimit must be >= 0")
        @Digits(integer = 10, fraction = 2, message = "financialLimit must have at most 2 decimals")
        BigDecimal financialLimit
) {}
