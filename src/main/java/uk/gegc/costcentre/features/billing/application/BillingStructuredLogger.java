package uk.gegc.costcentre.features.billing.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging utility for billing operations.
 * Sets the {@code billing.*} MDC keys around a single log line and always clears them.
 */
public final class BillingStructuredLogger {

    private BillingStructuredLogger() {
    }

    /**
     * Log a ledger write (new event or idempotent replay).
     */
    public static void logLedgerWrite(Logger logger, String level, String message,
            UUID userId, UUID tenantId, String serviceCode, String idempotencyKey,
            UUID eventId, long tokensUsed, long pagesProcessed, Object... additionalArgs) {

        MDC.put("billing.userId", userId != null ? userId.toString() : null);
        MDC.put("billing.tenantId", tenantId != null ? tenantId.toString() : null);
        MDC.put("billing.serviceCode", serviceCode);
        MDC.put("billing.idempotencyKey", idempotencyKey);
        MDC.put("billing.eventId", eventId != null ? eventId.toString() : null);
        MDC.put("billing.tokensUsed", String.valueOf(tokensUsed));
        MDC.put("billing.pagesProcessed", String.valueOf(pagesProcessed));

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearBillingMDC();
        }
    }

    /**
     * Log a usage report to the billing provider.
     */
    public static void logDispatch(Logger logger, String level, String message,
            UUID userId, UUID tenantId, String meteredItem, String itemId, long quantity,
            Object... additionalArgs) {

        MDC.put("billing.userId", userId != null ? userId.toString() : null);
        MDC.put("billing.tenantId", tenantId != null ? tenantId.toString() : null);
        MDC.put("billing.meteredItem", meteredItem);
        MDC.put("billing.itemId", itemId);
        MDC.put("billing.quantity", String.valueOf(quantity));

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearBillingMDC();
        }
    }

    /**
     * Log an entitlement decision (denial or overage warning).
     */
    public static void logEntitlement(Logger logger, String level, String message,
            UUID userId, UUID tenantId, String serviceCode, String planCode, String category,
            Object... additionalArgs) {

        MDC.put("billing.userId", userId != null ? userId.toString() : null);
        MDC.put("billing.tenantId", tenantId != null ? tenantId.toString() : null);
        MDC.put("billing.serviceCode", serviceCode);
        MDC.put("billing.planCode", planCode);
        MDC.put("billing.category", category);

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearBillingMDC();
        }
    }

    private static void log(Logger logger, String level, String message, Object... args) {
        switch (level.toLowerCase()) {
            case "warn" -> logger.warn(message, args);
            case "error" -> logger.error(message, args);
            case "debug" -> logger.debug(message, args);
            default -> logger.info(message, args);
        }
    }

    /**
     * Clear billing-specific MDC context.
     */
    public static void clearBillingMDC() {
        MDC.remove("billing.userId");
        MDC.remove("billing.tenantId");
        MDC.remove("billing.serviceCode");
        MDC.remove("billing.idempotencyKey");
        MDC.remove("billing.eventId");
        MDC.remove("billing.tokensUsed");
        MDC.remove("billing.pagesProcessed");
        MDC.remove("billing.meteredItem");
        MDC.remove("billing.itemId");
        MDC.remove("billing.quantity");
        MDC.remove("billing.planCode");
        MDC.remove("billing.category");
    }
}
