package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "EntitlementCheck", description = "Outcome of an allowed pre-flight check")
public record EntitlementCheckDto(
        UUID tenantId,

        @Schema(description = "Plan the usage is measured against", example = "pro")
        String planCode,

        @Schema(description = "Service that was checked", example = "translation")
        String serviceCode,

        @Schema(description = "True when the estimate pushes at least one category beyond the plan")
        boolean overageExpected,

        @Schema(description = "Categories expected to go into overage", example = "[\"tokens\"]")
        List<String> overageCategories
) {}
