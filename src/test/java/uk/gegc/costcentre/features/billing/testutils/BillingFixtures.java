package uk.gegc.costcentre.features.billing.testutils;

import uk.gegc.costcentre.features.billing.application.BillingProperties;
import uk.gegc.costcentre.features.billing.application.PlanCatalog;
import uk.gegc.costcentre.features.billing.application.ServiceRegistry;
import uk.gegc.costcentre.features.billing.domain.model.MeteredItem;

import java.math.BigDecimal;

/**
 * The default catalog as shipped in application.yml, built without a Spring context.
 */
public final class BillingFixtures {

    private BillingFixtures() {
    }

    public static BillingProperties billingProperties() {
        BillingProperties properties = new BillingProperties();
        properties.getPlans().put("starter", plan("Starter", "0", null, 100, 1));
        properties.getPlans().put("pro", plan("Pro", "49", 250_000L, 5_000, 10));
        properties.getPlans().put("business", plan("Business", "119", 1_000_000L, 50_000, 50));
        properties.getPlans().put("enterprise", plan("Enterprise", "259", 5_000_000L, 1_000_000_000L, 200));
        properties.getPlans().put("elite", plan("Elite", "499", -1L, 1_000_000_000L, 500));

        properties.getServices().put("translation", service("Translation", true, MeteredItem.TRANSLATION));
        properties.getServices().put("redact", service("Redaction", true, MeteredItem.REDACT));
        properties.getServices().put("open_document", service("Open document", false, null));
        properties.getServices().put("write_document", service("Write document", false, null));
        return properties;
    }

    public static PlanCatalog planCatalog() {
        return new PlanCatalog(billingProperties());
    }

    public static ServiceRegistry serviceRegistry() {
        return new ServiceRegistry(billingProperties());
    }

    private static BillingProperties.Plan plan(String name, String price, Long tokens, long pages, long storageGb) {
        BillingProperties.Plan plan = new BillingProperties.Plan();
        plan.setName(name);
        plan.setPricePerSeat(new BigDecimal(price));
        plan.setTokensIncluded(tokens);
        plan.setPagesIncluded(pages);
        plan.setStorageGbIncluded(storageGb);
        return plan;
    }

    private static BillingProperties.Service service(String name, boolean payable, MeteredItem item) {
        BillingProperties.Service service = new BillingProperties.Service();
        service.setName(name);
        service.setPayable(payable);
        service.setMeteredItem(item);
        return service;
    }
}
