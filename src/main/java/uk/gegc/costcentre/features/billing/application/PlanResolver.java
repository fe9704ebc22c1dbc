package uk.gegc.costcentre.features.billing.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.costcentre.features.billing.domain.model.ProviderStatus;
import uk.gegc.costcentre.features.billing.domain.model.Subscription;
import uk.gegc.costcentre.features.billing.infra.repository.SubscriptionRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the plan a user's usage is measured against within a tenant.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlanResolver {

    private final SubscriptionRepository subscriptionRepository;
    private final PlanCatalog planCatalog;

    /**
     * Most recently updated subscription whose provider status grants entitlements.
     */
    @Transactional(readOnly = true)
    public Optional<Subscription> activeSubscription(UUID userId, UUID tenantId) {
        return subscriptionRepository.findFirstByUserIdAndTenantIdAndProviderStatusInOrderByUpdatedAtDesc(
                userId, tenantId, ProviderStatus.ENTITLED);
    }

    /**
     * Plan of the active subscription, or the fallback plan when there is none or its code is unknown.
     */
    @Transactional(readOnly = true)
    public PlanEntitlement resolve(UUID userId, UUID tenantId) {
        return activeSubscription(userId, tenantId)
                .map(Subscription::getPlanCode)
                .flatMap(code -> {
                    Optional<PlanEntitlement> plan = planCatalog.find(code);
                    if (plan.isEmpty()) {
                        log.warn("Subscription of user {} references unknown plan '{}', using fallback", userId, code);
                    }
                    return plan;
                })
                .orElseGet(planCatalog::fallback);
    }
}
