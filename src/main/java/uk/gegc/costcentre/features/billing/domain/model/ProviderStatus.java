package uk.gegc.costcentre.features.billing.domain.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Subscription status as reported by the billing provider.
 */
public enum ProviderStatus {
    INACTIVE,
    ACTIVE,
    TRIALING,
    PAST_DUE,
    CANCELED;

    /** Statuses under which the subscribed plan grants its entitlements. */
    public static final Set<ProviderStatus> ENTITLED = EnumSet.of(ACTIVE, TRIALING);

    /**
     * Maps a provider status string (e.g. {@code past_due}) onto the local set.
     * Provider states with no local counterpart ({@code incomplete}, {@code unpaid}, {@code paused})
     * are treated as not entitled.
     */
    public static ProviderStatus fromProviderValue(String value) {
        if (value == null || value.isBlank()) {
            return INACTIVE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "active" -> ACTIVE;
            case "trialing" -> TRIALING;
            case "past_due" -> PAST_DUE;
            case "canceled", "incomplete_expired" -> CANCELED;
            default -> INACTIVE;
        };
    }
}
