package uk.gegc.costcentre.features.billing.domain.exception;

/**
 * The resolved plan does not include the requested feature at all, so overage billing cannot apply.
 */
public class EntitlementDeniedException extends RuntimeException {

    private final String planCode;
    private final String serviceCode;
    private final long estimatedTokens;

    public EntitlementDeniedException(String planCode, String serviceCode, long estimatedTokens) {
        super("Plan '" + planCode + "' does not include token usage for service '" + serviceCode + "'");
        this.planCode = planCode;
        this.serviceCode = serviceCode;
        this.estimatedTokens = estimatedTokens;
    }

    public String getPlanCode() {
        return planCode;
    }

    public String getServiceCode() {
        return serviceCode;
    }

    public long getEstimatedTokens() {
        return estimatedTokens;
    }
}
