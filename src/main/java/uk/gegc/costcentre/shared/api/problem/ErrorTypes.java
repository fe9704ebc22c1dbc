package uk.gegc.costcentre.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://costcentre.gegc.uk/docs/errors";

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI UNKNOWN_SERVICE = URI.create(BASE_URL + "/unknown-service");
    public static final URI UNKNOWN_PLAN = URI.create(BASE_URL + "/unknown-plan");
    public static final URI TENANT_NOT_RESOLVED = URI.create(BASE_URL + "/tenant-not-resolved");
    public static final URI BILLING_VALIDATION = URI.create(BASE_URL + "/billing-validation");

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");
    public static final URI ENTITLEMENT_DENIED = URI.create(BASE_URL + "/entitlement-denied");

    // ==================== Billing Provider Errors ====================
    public static final URI PROVIDER_UNAVAILABLE = URI.create(BASE_URL + "/provider-unavailable");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
