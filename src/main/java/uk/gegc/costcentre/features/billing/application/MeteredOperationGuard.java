package uk.gegc.costcentre.features.billing.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.costcentre.features.billing.api.BillingSecurityUtils;
import uk.gegc.costcentre.features.billing.api.dto.BillingSummary;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs an operation between an entitlement check and a usage finalize.
 *
 * <p>One idempotency key is generated per guarded call and handed to the operation, so a caller
 * that retries the finalize for the same work is never double-charged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MeteredOperationGuard {

    private final EntitlementEnforcer entitlementEnforcer;
    private final BillingOrchestrator billingOrchestrator;
    private final Clock clock;

    /**
     * Guard on behalf of the authenticated user.
     */
    public <R extends MeteredResult> Metered<R> guard(String serviceCode,
                                                      Supplier<UsageEstimate> estimator,
                                                      Function<String, R> operation) {
        return guard(BillingSecurityUtils.getCurrentUserId(), serviceCode, estimator, operation, Map.of());
    }

    /**
     * @param estimator  may fail; a failing estimator counts as zero estimated usage
     * @param operation  receives the idempotency key of this call; its exceptions propagate unchanged
     *                   and nothing is recorded
     */
    public <R extends MeteredResult> Metered<R> guard(UUID userId,
                                                      String serviceCode,
                                                      Supplier<UsageEstimate> estimator,
                                                      Function<String, R> operation,
                                                      Map<String, Object> metadata) {
        UsageEstimate estimate = estimate(serviceCode, estimator);
        entitlementEnforcer.enforce(userId, serviceCode, estimate.tokens(), estimate.pages());

        String idempotencyKey = IdempotencyKeys.generate(serviceCode, clock);
        R result = operation.apply(idempotencyKey);

        BillingSummary billing = null;
        try {
            billing = billingOrchestrator.finalizeUsage(userId, serviceCode,
                    result.tokensUsed(), result.pagesProcessed(), metadata, idempotencyKey);
        } catch (RuntimeException ex) {
            log.error("Failed to finalize {} usage for user {} (key {})", serviceCode, userId, idempotencyKey, ex);
        }
        return new Metered<>(result, billing);
    }

    private UsageEstimate estimate(String serviceCode, Supplier<UsageEstimate> estimator) {
        if (estimator == null) {
            return UsageEstimate.NONE;
        }
        try {
            UsageEstimate estimate = estimator.get();
            if (estimate == null) {
                return UsageEstimate.NONE;
            }
            return new UsageEstimate(Math.max(0L, estimate.tokens()), Math.max(0L, estimate.pages()));
        } catch (RuntimeException ex) {
            log.warn("Usage estimator for {} failed, assuming zero: {}", serviceCode, ex.getMessage());
            return UsageEstimate.NONE;
        }
    }
}
