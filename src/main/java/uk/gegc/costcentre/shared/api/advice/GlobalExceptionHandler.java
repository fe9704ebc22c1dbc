package uk.gegc.costcentre.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.costcentre.shared.api.problem.ErrorTypes;
import uk.gegc.costcentre.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.costcentre.shared.exception.ResourceNotFoundException;

import java.net.URI;
import java.util.List;

/**
 * Framework and cross-cutting errors. Billing domain exceptions are mapped first by
 * {@code BillingErrorHandler}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleResourceNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, ErrorTypes.RESOURCE_NOT_FOUND, "Resource Not Found", ex.getMessage(), request);
    }

    // Thrown by @PreAuthorize once the caller is authenticated but lacks the billing authority
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemDetail> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        logger.debug("Access denied on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, ErrorTypes.ACCESS_DENIED, "Access Denied",
                "You do not have permission to access this resource", request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        List<FieldViolation> violations = ex.getConstraintViolations().stream()
                .map(v -> new FieldViolation(v.getPropertyPath().toString(), v.getMessage(), v.getInvalidValue()))
                .toList();
        ProblemDetail problem = ProblemDetailBuilder.create(HttpStatus.BAD_REQUEST, ErrorTypes.VALIDATION_FAILED,
                "Constraint Violation", "One or more validation constraints were violated", request);
        problem.setProperty("violations", violations);
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String expected = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";
        ProblemDetail problem = ProblemDetailBuilder.create(HttpStatus.BAD_REQUEST, ErrorTypes.TYPE_MISMATCH,
                "Type Mismatch", "Parameter '" + ex.getName() + "' must be a " + expected, request);
        problem.setProperty("parameter", ex.getName());
        problem.setProperty("expectedType", expected);
        return ResponseEntity.badRequest().body(problem);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(@NonNull HttpMessageNotReadableException ex,
                                                                  @NonNull HttpHeaders headers,
                                                                  @NonNull HttpStatusCode status,
                                                                  @NonNull WebRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(HttpStatus.BAD_REQUEST, ErrorTypes.MALFORMED_JSON,
                "Malformed JSON", "Request body is malformed or cannot be read", request);
        problem.setProperty("parseError", ex.getMostSpecificCause().getMessage());
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(@NonNull MethodArgumentNotValidException ex,
                                                                  @NonNull HttpHeaders headers,
                                                                  @NonNull HttpStatusCode status,
                                                                  @NonNull WebRequest request) {
        List<FieldViolation> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> new FieldViolation(error.getField(), error.getDefaultMessage(), error.getRejectedValue()))
                .toList();
        ProblemDetail problem = ProblemDetailBuilder.create(HttpStatus.BAD_REQUEST, ErrorTypes.VALIDATION_FAILED,
                "Validation Failed", "Validation failed for one or more fields", request);
        problem.setProperty("fieldErrors", fieldErrors);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleServletRequestBindingException(@NonNull ServletRequestBindingException ex,
                                                                          @NonNull HttpHeaders headers,
                                                                          @NonNull HttpStatusCode status,
                                                                          @NonNull WebRequest request) {
        String detail = ex instanceof MissingRequestHeaderException missing
                ? "Required header '" + missing.getHeaderName() + "' is missing"
                : ex.getMessage();
        ProblemDetail problem = ProblemDetailBuilder.create(HttpStatus.BAD_REQUEST, ErrorTypes.VALIDATION_FAILED,
                "Bad Request", detail, request);
        return new ResponseEntity<>(problem, headers, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleAllOthers(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled exception on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", request);
    }

    private ResponseEntity<ProblemDetail> respond(HttpStatus status, URI type, String title, String detail,
                                                  HttpServletRequest request) {
        return ResponseEntity.status(status).body(ProblemDetailBuilder.create(status, type, title, detail, request));
    }

    private record FieldViolation(String field, String message, Object rejectedValue) {
    }
}
