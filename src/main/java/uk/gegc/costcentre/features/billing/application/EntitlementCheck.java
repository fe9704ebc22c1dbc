package uk.gegc.costcentre.features.billing.application;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of an allowed pre-flight check.
 *
 * @param overageCategories categories ({@code tokens}, {@code pages}, {@code storage}) that will incur overage
 */
public record EntitlementCheck(UUID tenantId, String planCode, String serviceCode, List<String> overageCategories) {

    public boolean overageExpected() {
        return !overageCategories.isEmpty();
    }
}
