package uk.gegc.costcentre.features.billing.application;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Calendar-month window {@code [start, end)} that flow quantities are summed over.
 */
public record BillingCycle(LocalDateTime start, LocalDateTime end) {

    public static BillingCycle containing(LocalDateTime instant) {
        LocalDate firstOfMonth = instant.toLocalDate().withDayOfMonth(1);
        LocalDateTime start = firstOfMonth.atStartOfDay();
        return new BillingCycle(start, start.plusMonths(1));
    }

    public boolean contains(LocalDateTime instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
