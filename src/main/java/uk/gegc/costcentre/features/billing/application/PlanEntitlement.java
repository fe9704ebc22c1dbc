package uk.gegc.costcentre.features.billing.application;

import java.math.BigDecimal;

/**
 * Entry of the plan catalog.
 *
 * @param tokensIncluded {@code null} when the plan has no token features,
 *                       {@link #UNLIMITED} for no cap, otherwise the monthly quota
 */
public record PlanEntitlement(
        String code,
        String name,
        BigDecimal pricePerSeat,
        Long tokensIncluded,
        long pagesIncluded,
        long storageGbIncluded,
        String highlights
) {

    public static final long UNLIMITED = -1L;

    public boolean tokensDisabled() {
        return tokensIncluded == null;
    }

    public boolean tokensUnlimited() {
        return tokensIncluded != null && tokensIncluded == UNLIMITED;
    }

    public boolean hasTokenQuota() {
        return tokensIncluded != null && tokensIncluded >= 0;
    }
}
