package uk.gegc.costcentre.features.billing.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record RecordUsageRequest(
        @NotBlank(message = "serviceCode must not be blank")
        String serviceCode,

        long tokensUsed,

        long pagesProcessed,

        Map<String, Object> metadata,

        @Size(max = 80, message = "idempotencyKey must be at most 80 characters")
        String idempotencyKey
) {}
