package uk.gegc.costcentre.features.billing.application;

import uk.gegc.costcentre.features.billing.api.dto.PriceQuote;
import uk.gegc.costcentre.features.billing.api.dto.QuoteRequest;
import uk.gegc.costcentre.features.billing.api.dto.SubscriptionDto;
import uk.gegc.costcentre.features.billing.api.dto.UpdateSubscriptionRequest;

import java.util.UUID;

public interface SubscriptionService {

    /**
     * The caller's latest subscription, created as an inactive fallback-plan subscription on first access.
     */
    SubscriptionDto getOrCreate(UUID userId);

    SubscriptionDto update(UUID userId, UpdateSubscriptionRequest request);

    PriceQuote quote(QuoteRequest request);

    /**
     * Copy the billing provider's status of the caller's subscription into the local mirror.
     *
     * @throws uk.gegc.costcentre.features.billing.domain.exception.BillingValidationException when there is
     *         no subscription linked to the provider
     * @throws uk.gegc.costcentre.features.billing.domain.exception.UsageDispatchException when the provider call fails
     */
    SubscriptionDto syncStatus(UUID userId);
}
