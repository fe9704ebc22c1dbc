package uk.gegc.costcentre.features.billing.api.dto;

import java.time.LocalDateTime;
import java.util.UUID;

public record UsageRecordDto(
        UUID id,
        UUID eventId,
        long tokensUsed,
        LocalDateTime createdAt
) {}
