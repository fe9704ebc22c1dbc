package uk.gegc.costcentre.features.billing.api.dto;

import java.util.UUID;

public record BackfillResult(
        UUID subscriptionId,
        long tokensReported,
        long pagesReported
) {}
