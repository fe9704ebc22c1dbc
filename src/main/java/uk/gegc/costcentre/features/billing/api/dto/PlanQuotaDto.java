package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "PlanQuota", description = "Resolved plan and the quotas it includes")
public record PlanQuotaDto(
        @Schema(description = "Plan code", example = "pro")
        String code,

        @Schema(description = "Plan display name", example = "Pro")
        String name,

        @Schema(description = "Included tokens; null when the plan has no token features, -1 when unlimited", example = "250000", nullable = true)
        Long tokensIncluded,

        @Schema(description = "Included pages per cycle", example = "5000")
        long pagesIncluded,

        @Schema(description = "Included storage in GB", example = "10")
        long storageGbIncluded
) {
}
