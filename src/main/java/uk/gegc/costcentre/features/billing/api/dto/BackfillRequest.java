package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

@Schema(name = "BackfillRequest", description = "Usage to push to the billing provider that was never reported")
public record BackfillRequest(
        @Schema(description = "Tokens to report", example = "25000")
        @PositiveOrZero(message = "tokens must be >= 0")
        long tokens,

        @Schema(description = "Pages to report", example = "0")
        @PositiveOrZero(message = "pages must be >= 0")
        long pages,

        @Schema(description = "Batch key; resend the same key when retrying a failed backfill", example = "backfill-2024-06-acme")
        @Size(max = 80, message = "idempotencyKey must be at most 80 characters")
        String idempotencyKey
) {}
