package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "BillingSummary", description = "Result of finalizing one metered operation")
public record BillingSummary(
        @Schema(description = "Ledger event written (or found) for this operation")
        UUID eventId,

        @Schema(description = "Idempotency key the event is stored under")
        String idempotencyKey,

        @Schema(description = "True when the event had already been recorded by an earlier call")
        boolean replayed,

        @Schema(description = "Cycle-to-date usage after this operation")
        UsageSummary usage
) {
}
