package uk.gegc.costcentre.features.billing.domain.model;

public enum PaymentMethod {
    CARD,
    BANK,
    PAYPAL,
    OTHER
}
