package uk.gegc.costcentre.features.billing.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import uk.gegc.costcentre.features.billing.domain.exception.BillingValidationException;
import uk.gegc.costcentre.features.billing.domain.exception.EntitlementDeniedException;
import uk.gegc.costcentre.features.billing.domain.exception.UnknownPlanException;
import uk.gegc.costcentre.features.billing.domain.exception.UnknownServiceException;
import uk.gegc.costcentre.features.billing.domain.exception.UsageDispatchException;
import uk.gegc.costcentre.features.tenancy.domain.exception.TenantNotResolvedException;
import uk.gegc.costcentre.shared.api.problem.ErrorTypes;
import uk.gegc.costcentre.shared.api.problem.ProblemDetailBuilder;

/**
 * Maps metering and billing exceptions to RFC 7807 Problem Detail responses.
 * Anything not handled here falls through to the global handler.
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice(basePackages = "uk.gegc.costcentre.features.billing.api")
public class BillingErrorHandler {

    @ExceptionHandler(UnknownServiceException.class)
    public ResponseEntity<ProblemDetail> handleUnknownService(UnknownServiceException ex, HttpServletRequest request) {
        log.warn("Unknown service: {}", ex.getServiceCode());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.UNKNOWN_SERVICE,
                "Unknown Service",
                ex.getMessage(),
                request
        );
        problem.setProperty("serviceCode", ex.getServiceCode());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(UnknownPlanException.class)
    public ResponseEntity<ProblemDetail> handleUnknownPlan(UnknownPlanException ex, HttpServletRequest request) {
        log.warn("Unknown plan: {}", ex.getPlanCode());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.UNKNOWN_PLAN,
                "Unknown Plan",
                ex.getMessage(),
                request
        );
        problem.setProperty("planCode", ex.getPlanCode());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(BillingValidationException.class)
    public ResponseEntity<ProblemDetail> handleBillingValidation(BillingValidationException ex, HttpServletRequest request) {
        log.warn("Billing validation failed: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.BILLING_VALIDATION,
                "Invalid Billing Request",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(TenantNotResolvedException.class)
    public ResponseEntity<ProblemDetail> handleTenantNotResolved(TenantNotResolvedException ex, HttpServletRequest request) {
        log.warn("Tenant not resolved for user {}", ex.getUserId());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.TENANT_NOT_RESOLVED,
                "Tenant Not Resolved",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(EntitlementDeniedException.class)
    public ResponseEntity<ProblemDetail> handleEntitlementDenied(EntitlementDeniedException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.FORBIDDEN,
                ErrorTypes.ENTITLEMENT_DENIED,
                "Entitlement Denied",
                ex.getMessage(),
                request
        );
        problem.setProperty("planCode", ex.getPlanCode());
        problem.setProperty("serviceCode", ex.getServiceCode());
        problem.setProperty("estimatedTokens", ex.getEstimatedTokens());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
    }

    @ExceptionHandler(UsageDispatchException.class)
    public ResponseEntity<ProblemDetail> handleUsageDispatch(UsageDispatchException ex, HttpServletRequest request) {
        log.error("Billing provider call failed: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_GATEWAY,
                ErrorTypes.PROVIDER_UNAVAILABLE,
                "Billing Provider Unavailable",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
    }
}
