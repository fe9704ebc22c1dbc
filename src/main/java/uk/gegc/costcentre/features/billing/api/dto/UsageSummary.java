package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Schema(name = "UsageSummary", description = "Cycle-to-date usage of a user within their tenant")
public record UsageSummary(
        @Schema(description = "First instant of the billing cycle (inclusive)")
        LocalDateTime cycleStart,

        @Schema(description = "First instant of the next billing cycle (exclusive)")
        LocalDateTime cycleEnd,

        @Schema(description = "Tokens recorded this cycle", example = "300000")
        long tokensUsedCycle,

        @Schema(description = "Pages processed this cycle", example = "120")
        long pagesProcessedCycle,

        @Schema(description = "Current storage footprint of the tenant in GB", example = "2.500")
        BigDecimal storageGbCurrent,

        OverageDto overage,

        PlanQuotaDto plan
) {
}
