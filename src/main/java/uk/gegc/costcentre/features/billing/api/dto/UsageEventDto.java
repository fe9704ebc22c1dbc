package uk.gegc.costcentre.features.billing.api.dto;

import uk.gegc.costcentre.features.billing.domain.model.ServiceType;

import java.time.LocalDateTime;
import java.util.UUID;

public record UsageEventDto(
        UUID id,
        String eventType,
        ServiceType serviceType,
        String idempotencyKey,
        String metadata,
        long tokensUsed,
        long pagesProcessed,
        LocalDateTime createdAt
) {}
