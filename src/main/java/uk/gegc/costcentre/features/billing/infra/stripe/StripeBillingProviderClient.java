package uk.gegc.costcentre.features.billing.infra.stripe;

import com.stripe.StripeClient;
import com.stripe.exception.StripeException;
import com.stripe.model.Subscription;
import com.stripe.model.UsageRecord;
import com.stripe.net.RequestOptions;
import com.stripe.param.UsageRecordCreateOnSubscriptionItemParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.costcentre.features.billing.application.BillingProperties;
import uk.gegc.costcentre.features.billing.application.StripeProperties;
import uk.gegc.costcentre.features.billing.application.SubscriptionStatusClient;
import uk.gegc.costcentre.features.billing.application.UsageReportingClient;
import uk.gegc.costcentre.features.billing.domain.exception.UsageDispatchException;

import java.time.Instant;

/**
 * Stripe adapter for metered usage and subscription status.
 */
@Slf4j
@Component
public class StripeBillingProviderClient implements UsageReportingClient, SubscriptionStatusClient {

    private final StripeProperties stripeProperties;
    private final BillingProperties billingProperties;

    @Autowired(required = false)
    private StripeClient stripeClient;

    public StripeBillingProviderClient(StripeProperties stripeProperties, BillingProperties billingProperties) {
        this.stripeProperties = stripeProperties;
        this.billingProperties = billingProperties;
    }

    @Override
    public boolean isEnabled() {
        return StringUtils.hasText(stripeProperties.getSecretKey());
    }

    @Override
    public void reportUsage(String itemId, long quantity, Instant timestamp, String idempotencyKey) {
        UsageRecordCreateOnSubscriptionItemParams params = UsageRecordCreateOnSubscriptionItemParams.builder()
                .setQuantity(quantity)
                .setTimestamp(timestamp.getEpochSecond())
                .setAction(UsageRecordCreateOnSubscriptionItemParams.Action.INCREMENT)
                .build();
        try {
            UsageRecord record = UsageRecord.createOnSubscriptionItem(itemId, params, requestOptions(idempotencyKey));
            log.debug("Stripe usage record {} created for item {}", record.getId(), itemId);
        } catch (StripeException e) {
            throw new UsageDispatchException("Stripe rejected usage for item " + itemId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String fetchStatus(String providerSubscriptionId) {
        if (!isEnabled()) {
            throw new UsageDispatchException("Billing provider is not configured");
        }
        try {
            Subscription subscription = (stripeClient != null)
                    ? stripeClient.subscriptions().retrieve(providerSubscriptionId)
                    : Subscription.retrieve(providerSubscriptionId);
            return subscription.getStatus();
        } catch (StripeException e) {
            throw new UsageDispatchException("Failed to retrieve Stripe subscription " + providerSubscriptionId + ": " + e.getMessage(), e);
        }
    }

    private RequestOptions requestOptions(String idempotencyKey) {
        int timeoutMs = (int) billingProperties.getDispatch().getTimeout().toMillis();
        RequestOptions.RequestOptionsBuilder builder = RequestOptions.builder()
                .setApiKey(stripeProperties.getSecretKey())
                .setConnectTimeout(timeoutMs)
                .setReadTimeout(timeoutMs);
        if (StringUtils.hasText(idempotencyKey)) {
            builder.setIdempotencyKey(idempotencyKey);
        }
        return builder.build();
    }
}
