package uk.gegc.costcentre.features.billing.application;

import org.springframework.stereotype.Component;
import uk.gegc.costcentre.features.billing.domain.exception.UnknownPlanException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the configured plans, built once at startup.
 */
@Component
public class PlanCatalog {

    private final Map<String, PlanEntitlement> plans;
    private final PlanEntitlement fallback;

    public PlanCatalog(BillingProperties properties) {
        Map<String, PlanEntitlement> byCode = new LinkedHashMap<>();
        properties.getPlans().forEach((code, plan) -> byCode.put(code, new PlanEntitlement(
                code,
                plan.getName(),
                plan.getPricePerSeat(),
                plan.getTokensIncluded(),
                plan.getPagesIncluded(),
                plan.getStorageGbIncluded(),
                plan.getHighlights()
        )));
        this.plans = Collections.unmodifiableMap(byCode);
        this.fallback = plans.get(properties.getFallbackPlan());
        if (fallback == null) {
            throw new IllegalStateException("Fallback plan '" + properties.getFallbackPlan() + "' is not in the plan catalog");
        }
    }

    public Optional<PlanEntitlement> find(String code) {
        return code == null ? Optional.empty() : Optional.ofNullable(plans.get(code));
    }

    public PlanEntitlement require(String code) {
        return find(code).orElseThrow(() -> new UnknownPlanException(code));
    }

    /**
     * The lowest plan, applied whenever no entitled plan can be resolved.
     */
    public PlanEntitlement fallback() {
        return fallback;
    }

    public Collection<PlanEntitlement> all() {
        return plans.values();
    }
}
