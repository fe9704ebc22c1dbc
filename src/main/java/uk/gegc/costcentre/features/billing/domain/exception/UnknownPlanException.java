package uk.gegc.costcentre.features.billing.domain.exception;

public class UnknownPlanException extends BillingValidationException {

    private final String planCode;

    public UnknownPlanException(String planCode) {
        super("Unknown plan code: " + planCode);
        this.planCode = planCode;
    }

    public String getPlanCode() {
        return planCode;
    }
}
