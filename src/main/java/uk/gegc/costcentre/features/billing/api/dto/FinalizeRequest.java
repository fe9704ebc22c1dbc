package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

@Schema(name = "FinalizeRequest", description = "Actual cost of a completed operation. Negative counts are recorded as zero.")
public record FinalizeRequest(
        @Schema(description = "Service code", example = "translation", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "serviceCode must not be blank")
        String serviceCode,

        @Schema(description = "Tokens actually consumed", example = "11890")
        long actualTokens,

        @Schema(description = "Pages actually processed", example = "3")
        long actualPages,

        @Schema(description = "Free-form context stored with the event")
        Map<String, Object> metadata,

        @Schema(description = "Idempotency key; the Idempotency-Key header takes precedence", example = "translation_3f2a..._1718000000000")
        @Size(max = 80, message = "idempotencyKey must be at most 80 characters")
        String idempotencyKey
) {}
