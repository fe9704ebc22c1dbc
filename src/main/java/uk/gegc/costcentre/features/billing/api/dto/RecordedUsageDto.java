package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "RecordedUsage", description = "Ledger rows written (or found) for one usage call")
public record RecordedUsageDto(
        UsageEventDto event,

        @Schema(description = "Token record linked to the event; absent when no tokens were used", nullable = true)
        UsageRecordDto usageRecord,

        @Schema(description = "True when the idempotency key had already been recorded")
        boolean replayed
) {}
