package uk.gegc.costcentre.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import uk.gegc.costcentre.features.billing.api.dto.PriceQuote;
import uk.gegc.costcentre.features.billing.api.dto.QuoteRequest;
import uk.gegc.costcentre.features.billing.api.dto.SubscriptionDto;
import uk.gegc.costcentre.features.billing.api.dto.UpdateSubscriptionRequest;
import uk.gegc.costcentre.features.billing.application.OverageCalculator;
import uk.gegc.costcentre.features.billing.application.PlanCatalog;
import uk.gegc.costcentre.features.billing.application.SubscriptionService;
import uk.gegc.costcentre.features.billing.application.SubscriptionStatusClient;
import uk.gegc.costcentre.features.billing.domain.exception.BillingValidationException;
import uk.gegc.costcentre.features.billing.domain.model.ProviderStatus;
import uk.gegc.costcentre.features.billing.domain.model.Subscription;
import uk.gegc.costcentre.features.billing.infra.mapping.SubscriptionMapper;
import uk.gegc.costcentre.features.billing.infra.repository.SubscriptionRepository;
import uk.gegc.costcentre.features.tenancy.application.TenantResolver;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionServiceImpl implements SubscriptionService {

    private final TenantResolver tenantResolver;
    private final SubscriptionRepository subscriptionRepository;
    private final PlanCatalog planCatalog;
    private final OverageCalculator overageCalculator;
    private final SubscriptionStatusClient statusClient;
    private final SubscriptionMapper subscriptionMapper;

    @Override
    @Transactional
    public SubscriptionDto getOrCreate(UUID userId) {
        return subscriptionMapper.toDto(load(userId));
    }

    @Override
    @Transactional
    public SubscriptionDto update(UUID userId, UpdateSubscriptionRequest request) {
        Subscription subscription = load(userId);
        if (request.planCode() != null) {
            subscription.setPlanCode(planCatalog.require(request.planCode()).code());
        }
        if (request.seatCount() != null) {
            if (request.seatCount() < 1) {
                throw new BillingValidationException("seatCount must be at least 1");
            }
            subscription.setSeatCount(request.seatCount());
        }
        if (request.annualPrepay() != null) {
            subscription.setAnnualPrepay(request.annualPrepay());
        }
        Subscription saved = subscriptionRepository.saveAndFlush(subscription);
        log.info("Subscription {} of user {} updated: plan={} seats={} annual={}",
                saved.getId(), userId, saved.getPlanCode(), saved.getSeatCount(), saved.isAnnualPrepay());
        return subscriptionMapper.toDto(saved);
    }

    @Override
    public PriceQuote quote(QuoteRequest request) {
        return overageCalculator.quote(request.planCode(), request.seatCount(), request.annualPrepay());
    }

    @Override
    @Transactional
    public SubscriptionDto syncStatus(UUID userId) {
        UUID tenantId = tenantResolver.tenantFor(userId);
        Subscription subscription = subscriptionRepository.findFirstByUserIdAndTenantIdOrderByUpdatedAtDesc(userId, tenantId)
                .orElseThrow(() -> new BillingValidationException("No subscription found for user " + userId));
        if (!StringUtils.hasText(subscription.getProviderSubscriptionId())) {
            throw new BillingValidationException("Subscription " + subscription.getId() + " is not linked to the billing provider");
        }

        String providerValue = statusClient.fetchStatus(subscription.getProviderSubscriptionId());
        ProviderStatus previous = subscription.getProviderStatus();
        ProviderStatus current = ProviderStatus.fromProviderValue(providerValue);
        subscription.setProviderStatus(current);
        Subscription saved = subscriptionRepository.saveAndFlush(subscription);

        if (previous != current) {
            log.info("Subscription {} status {} -> {} (provider: {})", saved.getId(), previous, current, providerValue);
        }
        return subscriptionMapper.toDto(saved);
    }

    private Subscription load(UUID userId) {
        UUID tenantId = tenantResolver.tenantFor(userId);
        return subscriptionRepository.findFirstByUserIdAndTenantIdOrderByUpdatedAtDesc(userId, tenantId)
                .orElseGet(() -> {
                    Subscription subscription = new Subscription();
                    subscription.setUserId(userId);
                    subscription.setTenantId(tenantId);
                    subscription.setPlanCode(planCatalog.fallback().code());
                    subscription.setProviderStatus(ProviderStatus.INACTIVE);
                    return subscriptionRepository.saveAndFlush(subscription);
                });
    }
}
