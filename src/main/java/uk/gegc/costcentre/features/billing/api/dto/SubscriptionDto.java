package uk.gegc.costcentre.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.costcentre.features.billing.domain.model.ProviderStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "Subscription", description = "Plan state of the caller as mirrored from the billing provider")
public record SubscriptionDto(
        UUID id,

        @Schema(description = "Plan code", example = "pro")
        String planCode,

        @Schema(description = "Number of seats", example = "1")
        int seatCount,

        boolean annualPrepay,

        @Schema(description = "Status reported by the billing provider", example = "ACTIVE")
        ProviderStatus providerStatus,

        String providerSubscriptionId,
        LocalDateTime billingCycleStart,
        LocalDateTime billingCycleEnd,
        BigDecimal amountBilled,
        LocalDateTime updatedAt
) {}
