package uk.gegc.costcentre.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.costcentre.features.billing.api.dto.BudgetDto;
import uk.gegc.costcentre.features.billing.api.dto.UpdateBudgetRequest;
import uk.gegc.costcentre.features.billing.application.BudgetService;

@RestController
@RequestMapping("/api/v1/cost/budgets")
@RequiredArgsConstructor
@Tag(name = "Budgets", description = "Per-user spending limits")
@SecurityRequirement(name = "Gateway Authentication")
public class BudgetController {

    private final BudgetService budgetService;

    @Operation(summary = "Get my budget", description = "Created with zero limits on first access")
    @GetMapping("/me")
    @PreAuthorize("hasAuthority('BILLING_READ')")
    public ResponseEntity<BudgetDto> getMyBudget() {
        return ResponseEntity.ok(budgetService.getOrCreate(BillingSecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Update my budget")
    @PatchMapping("/me")
    @PreAuthorize("hasAuthority('BILLING_WRITE')")
    public ResponseEntity<BudgetDto> updateMyBudget(@Valid @RequestBody UpdateBudgetRequest request) {
        return ResponseEntity.ok(budgetService.update(BillingSecurityUtils.getCurrentUserId(), request));
    }
}
