package uk.gegc.costcentre.features.billing.application;

import uk.gegc.costcentre.features.billing.domain.model.UsageEvent;
import uk.gegc.costcentre.features.billing.domain.model.UsageRecord;

/**
 * Outcome of a recorder call.
 *
 * @param usageRecord {@code null} when the event carried no tokens
 * @param replayed    {@code true} when an earlier call with the same key had already written the event
 */
public record RecordedUsage(UsageEvent event, UsageRecord usageRecord, boolean replayed) {
}
