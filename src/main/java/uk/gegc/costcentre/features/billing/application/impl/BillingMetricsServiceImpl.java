package uk.gegc.costcentre.features.billing.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.costcentre.features.billing.application.BillingMetricsService;
import uk.gegc.costcentre.features.billing.domain.model.MeteredItem;

/**
 * Micrometer-backed billing counters.
 */
@Slf4j
@Service
public class BillingMetricsServiceImpl implements BillingMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter budgetAlertCounter;

    public BillingMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.budgetAlertCounter = Counter.builder("billing.budget.alerts")
                .description("Number of budget limit alerts raised")
                .register(meterRegistry);
    }

    @Override
    public void incrementEventRecorded(String serviceCode) {
        counter("billing.events.recorded", "Usage events written to the ledger", "service", serviceCode).increment();
        log.debug("METRIC: billing.events.recorded service={}", serviceCode);
    }

    @Override
    public void incrementEventReplayed(String serviceCode) {
        counter("billing.events.replayed", "Recorder calls answered from an existing event", "service", serviceCode).increment();
        log.debug("METRIC: billing.events.replayed service={}", serviceCode);
    }

    @Override
    public void incrementTokensRecorded(String serviceCode, long tokens) {
        counter("billing.tokens.recorded", "Tokens written to the ledger", "service", serviceCode).increment(tokens);
        log.debug("METRIC: billing.tokens.recorded service={} tokens={}", serviceCode, tokens);
    }

    @Override
    public void incrementPagesRecorded(String serviceCode, long pages) {
        counter("billing.pages.recorded", "Pages written to the ledger", "service", serviceCode).increment(pages);
        log.debug("METRIC: billing.pages.recorded service={} pages={}", serviceCode, pages);
    }

    @Override
    public void incrementEntitlementDenied(String planCode, String serviceCode) {
        Counter.builder("billing.entitlement.denied")
                .description("Pre-flight checks hard-denied by the plan")
                .tag("plan", planCode)
                .tag("service", serviceCode)
                .register(meterRegistry)
                .increment();
        log.info("METRIC: billing.entitlement.denied plan={} service={}", planCode, serviceCode);
    }

    @Override
    public void incrementOverageWarning(String category) {
        counter("billing.overage.warnings", "Pre-flight checks that will incur overage", "category", category).increment();
        log.debug("METRIC: billing.overage.warnings category={}", category);
    }

    @Override
    public void incrementDispatchOk(MeteredItem item) {
        counter("billing.dispatch.ok", "Usage reports accepted by the billing provider", "item", item.name()).increment();
    }

    @Override
    public void incrementDispatchFailed(MeteredItem item) {
        counter("billing.dispatch.failed", "Usage reports dropped after a provider error or timeout", "item", item.name()).increment();
        log.info("METRIC: billing.dispatch.failed item={}", item);
    }

    @Override
    public void incrementBudgetAlert() {
        budgetAlertCounter.increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return Counter.builder(name)
                .description(description)
                .tag(tagKey, tagValue != null ? tagValue : "unknown")
                .register(meterRegistry);
    }
}
