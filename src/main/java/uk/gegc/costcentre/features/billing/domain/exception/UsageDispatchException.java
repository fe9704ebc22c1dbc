package uk.gegc.costcentre.features.billing.domain.exception;

public class UsageDispatchException extends RuntimeException {

    public UsageDispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public UsageDispatchException(String message) {
        super(message);
    }
}
