package uk.gegc.costcentre.features.billing.domain.model;

public enum ServiceType {
    PAYABLE,
    NON_PAYABLE
}
