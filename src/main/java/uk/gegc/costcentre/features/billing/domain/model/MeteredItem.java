package uk.gegc.costcentre.features.billing.domain.model;

/**
 * Chargeable sub-services that can carry their own metered item on the billing provider.
 */
public enum MeteredItem {
    TOKENS,
    PAGES,
    TRANSLATION,
    REDACT
}
