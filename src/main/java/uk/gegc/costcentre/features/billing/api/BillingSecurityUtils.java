package uk.gegc.costcentre.features.billing.api;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.UUID;

/**
 * Reads the caller identity established by the gateway authentication filter.
 */
public final class BillingSecurityUtils {

    public static final String BILLING_READ = "BILLING_READ";
    public static final String BILLING_WRITE = "BILLING_WRITE";
    public static final String BILLING_ADMIN = "BILLING_ADMIN";

    private BillingSecurityUtils() {
    }

    /**
     * @throws IllegalStateException if there is no authenticated caller or its name is not a UUID
     */
    public static UUID getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new IllegalStateException("No authenticated user found");
        }

        String userIdStr = authentication.getName();
        if (userIdStr == null || userIdStr.isEmpty()) {
            throw new IllegalStateException("User ID not found in authentication");
        }

        try {
            return UUID.fromString(userIdStr);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid user ID format in authentication: " + userIdStr);
        }
    }

    public static boolean hasAuthority(String authority) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return false;
        }
        return authentication.getAuthorities().stream()
                .anyMatch(granted -> granted.getAuthority().equals(authority));
    }
}
