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
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.costcentre.features.billing.api.dto.PriceQuote;
import uk.gegc.costcentre.features.billing.api.dto.QuoteRequest;
import uk.gegc.costcentre.features.billing.api.dto.SubscriptionDto;
import uk.gegc.costcentre.features.billing.api.dto.UpdateSubscriptionRequest;
import uk.gegc.costcentre.features.billing.application.SubscriptionService;

@RestController
@RequestMapping("/api/v1/cost/subscriptions")
@RequiredArgsConstructor
@Tag(name = "Subscriptions", description = "Plan selection, seat pricing and provider status")
@SecurityRequirement(name = "Gateway Authentication")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @Operation(summary = "Get my subscription", description = "Created as an inactive starter subscription on first access")
    @GetMapping("/me")
    @PreAuthorize("hasAuthority('BILLING_READ')")
    public ResponseEntity<SubscriptionDto> getMySubscription() {
        return ResponseEntity.ok(subscriptionService.getOrCreate(BillingSecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Change plan, seats or term")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subscription updated",
                    content = @Content(schema = @Schema(implementation = SubscriptionDto.class))),
            @ApiResponse(responseCode = "400", description = "Unknown plan or invalid seat count",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PatchMapping("/me")
    @PreAuthorize("hasAuthority('BILLING_WRITE')")
    public ResponseEntity<SubscriptionDto> updateMySubscription(@Valid @RequestBody UpdateSubscriptionRequest request) {
        return ResponseEntity.ok(subscriptionService.update(BillingSecurityUtils.getCurrentUserId(), request));
    }

    @Operation(summary = "Preview the monthly price", description = "Applies volume and annual prepay discounts")
    @PostMapping("/me/quote")
    @PreAuthorize("hasAuthority('BILLING_READ')")
    public ResponseEntity<PriceQuote> quote(@Valid @RequestBody QuoteRequest request) {
        return ResponseEntity.ok(subscriptionService.quote(request));
    }

    @Operation(summary = "Refresh status from the billing provider")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status synchronized",
                    content = @Content(schema = @Schema(implementation = SubscriptionDto.class))),
            @ApiResponse(responseCode = "400", description = "No subscription linked to the provider",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Billing provider unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/me/sync")
    @PreAuthorize("hasAuthority('BILLING_WRITE')")
    public ResponseEntity<SubscriptionDto> syncMySubscription() {
        return ResponseEntity.ok(subscriptionService.syncStatus(BillingSecurityUtils.getCurrentUserId()));
    }
}
