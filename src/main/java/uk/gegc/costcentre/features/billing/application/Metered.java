package uk.gegc.costcentre.features.billing.application;

import uk.gegc.costcentre.features.billing.api.dto.BillingSummary;

/**
 * Result of a guarded operation together with its billing snapshot.
 *
 * @param billing {@code null} when the usage could not be finalized
 */
public record Metered<R>(R result, BillingSummary billing) {

    public boolean billed() {
        return billing != null;
    }
}
