package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "TenantSummary", description = "Cycle-to-date totals across every user of a tenant")
public record TenantSummaryDto(
        UUID tenantId,
        LocalDateTime cycleStart,
        LocalDateTime cycleEnd,

        @Schema(description = "Tokens recorded by all users this cycle", example = "1250000")
        long tokensUsedCycle,

        @Schema(description = "Pages processed by all users this cycle", example = "4200")
        long pagesProcessedCycle,

        @Schema(description = "Current storage footprint in GB", example = "12.250")
        BigDecimal storageGbCurrent,

        @Schema(description = "Number of users holding a budget in the tenant", example = "14")
        long usersCount
) {}
