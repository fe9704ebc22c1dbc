package uk.gegc.costcentre.features.billing.domain.exception;

/**
 * Input the billing engine refuses before touching the ledger.
 */
public class BillingValidationException extends RuntimeException {

    public BillingValidationException(String message) {
        super(message);
    }
}
