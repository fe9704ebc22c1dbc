package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

@Schema(name = "PreflightRequest", description = "Estimated cost of an operation about to run")
public record PreflightRequest(
        @Schema(description = "Service code", example = "translation", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "serviceCode must not be blank")
        String serviceCode,

        @Schema(description = "Estimated tokens", example = "12000")
        @PositiveOrZero(message = "estimatedTokens must be >= 0")
        long estimatedTokens,

        @Schema(description = "Estimated pages", example = "3")
        @PositiveOrZero(message = "estimatedPages must be >= 0")
        long estimatedPages
) {}
