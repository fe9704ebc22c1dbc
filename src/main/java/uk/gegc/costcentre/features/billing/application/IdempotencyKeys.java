package uk.gegc.costcentre.features.billing.application;

import java.time.Clock;
import java.util.UUID;

/**
 * Generates idempotency keys of the form {@code <prefix>_<uuid hex>_<epoch millis>}.
 */
public final class IdempotencyKeys {

    public static final int MAX_LENGTH = 80;

    /** Longest prefix whose generated key still fits {@link #MAX_LENGTH}: 1 + 32 hex + 1 + 13 millis digits. */
    public static final int MAX_PREFIX_LENGTH = MAX_LENGTH - 47;

    private IdempotencyKeys() {
    }

    public static String generate(String prefix, Clock clock) {
        String hex = UUID.randomUUID().toString().replace("-", "");
        return prefix + "_" + hex + "_" + clock.millis();
    }
}
