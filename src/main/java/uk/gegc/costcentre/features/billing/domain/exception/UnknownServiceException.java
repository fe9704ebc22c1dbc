package uk.gegc.costcentre.features.billing.domain.exception;

public class UnknownServiceException extends BillingValidationException {

    private final String serviceCode;

    public UnknownServiceException(String serviceCode) {
        super("Unknown service code: " + serviceCode);
        this.serviceCode = serviceCode;
    }

    public String getServiceCode() {
        return serviceCode;
    }
}
