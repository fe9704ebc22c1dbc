package uk.gegc.costcentre.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.costcentre.features.billing.api.dto.BackfillRequest;
import uk.gegc.costcentre.features.billing.api.dto.BackfillResult;
import uk.gegc.costcentre.features.billing.api.dto.TenantSummaryDto;
import uk.gegc.costcentre.features.billing.application.UsageBackfillService;
import uk.gegc.costcentre.features.billing.application.UsageSummaryService;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/cost/admin")
@RequiredArgsConstructor
@Tag(name = "Cost Admin", description = "Tenant-wide reporting and usage repair")
@SecurityRequirement(name = "Gateway Authentication")
public class TenantAdminController {

    private final UsageSummaryService usageSummaryService;
    private final UsageBackfillService usageBackfillService;

    @Operation(summary = "Get tenant usage for the current cycle", description = "Requires BILLING_ADMIN")
    @GetMapping("/tenant/summary")
    @PreAuthorize("hasAuthority('BILLING_ADMIN')")
    public ResponseEntity<TenantSummaryDto> getTenantSummary() {
        return ResponseEntity.ok(usageSummaryService.tenantSummary(BillingSecurityUtils.getCurrentUserId()));
    }

    @Operation(
            summary = "Backfill usage to the billing provider",
            description = "Reports usage that was recorded locally but never reached the provider. Requires BILLING_ADMIN."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Usage reported",
                    content = @Content(schema = @Schema(implementation = BackfillResult.class))),
            @ApiResponse(responseCode = "400", description = "Unknown subscription or missing metered item",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Billing provider rejected the report",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/subscriptions/{subscriptionId}/backfill")
    @PreAuthorize("hasAuthority('BILLING_ADMIN')")
    public ResponseEntity<BackfillResult> backfill(@PathVariable UUID subscriptionId,
                                                   @Valid @RequestBody BackfillRequest request) {
        log.info("Admin {} backfilling subscription {}: tokens={} pages={} key={}",
                BillingSecurityUtils.getCurrentUserId(), subscriptionId, request.tokens(), request.pages(),
                request.idempotencyKey());
        return ResponseEntity.ok(usageBackfillService.backfillUsage(subscriptionId, request.tokens(), request.pages(),
                request.idempotencyKey()));
    }
}
