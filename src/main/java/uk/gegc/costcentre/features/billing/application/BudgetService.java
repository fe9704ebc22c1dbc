package uk.gegc.costcentre.features.billing.application;

import uk.gegc.costcentre.features.billing.api.dto.BudgetDto;
import uk.gegc.costcentre.features.billing.api.dto.UpdateBudgetRequest;

import java.util.UUID;

public interface BudgetService {

    /**
     * The caller's budget, created with zero limits on first access.
     */
    BudgetDto getOrCreate(UUID userId);

    BudgetDto update(UUID userId, UpdateBudgetRequest request);
}
