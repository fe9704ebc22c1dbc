package uk.gegc.costcentre.features.billing.application;

import uk.gegc.costcentre.features.billing.api.dto.TenantSummaryDto;
import uk.gegc.costcentre.features.billing.api.dto.UsageSummary;

import java.util.UUID;

public interface UsageSummaryService {

    UsageSummary summarize(UUID userId);

    /**
     * Totals across every user of the caller's tenant for the current cycle.
     */
    TenantSummaryDto tenantSummary(UUID userId);
}
