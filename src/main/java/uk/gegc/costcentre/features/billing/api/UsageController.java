package uk.gegc.costcentre.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.costcentre.features.billing.api.dto.BillingSummary;
import uk.gegc.costcentre.features.billing.api.dto.EntitlementCheckDto;
import uk.gegc.costcentre.features.billing.api.dto.FinalizeRequest;
import uk.gegc.costcentre.features.billing.api.dto.PreflightRequest;
import uk.gegc.costcentre.features.billing.api.dto.RecordUsageRequest;
import uk.gegc.costcentre.features.billing.api.dto.RecordedUsageDto;
import uk.gegc.costcentre.features.billing.api.dto.UsageEventDto;
import uk.gegc.costcentre.features.billing.api.dto.UsageRecordDto;
import uk.gegc.costcentre.features.billing.api.dto.UsageSummary;
import uk.gegc.costcentre.features.billing.application.BillingOrchestrator;
import uk.gegc.costcentre.features.billing.application.EntitlementCheck;
import uk.gegc.costcentre.features.billing.application.EntitlementEnforcer;
import uk.gegc.costcentre.features.billing.application.UsageLedgerService;
import uk.gegc.costcentre.features.billing.application.UsageSummaryService;
import uk.gegc.costcentre.features.billing.infra.mapping.CatalogMapper;

import java.time.LocalDateTime;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/cost")
@RequiredArgsConstructor
@Validated
@Tag(name = "Usage", description = "Pre-flight checks, usage finalization and the usage ledger")
@SecurityRequirement(name = "Gateway Authentication")
public class UsageController {

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final EntitlementEnforcer entitlementEnforcer;
    private final BillingOrchestrator billingOrchestrator;
    private final UsageSummaryService usageSummaryService;
    private final UsageLedgerService usageLedgerService;
    private final CatalogMapper catalogMapper;

    @Operation(summary = "Get cycle-to-date usage", description = "Usage, overage and resolved plan for the current billing cycle")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Summary computed",
                    content = @Content(schema = @Schema(implementation = UsageSummary.class))),
            @ApiResponse(responseCode = "400", description = "Caller does not belong to a tenant",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/summary")
    @PreAuthorize("hasAuthority('BILLING_READ')")
    public ResponseEntity<UsageSummary> getSummary() {
        return ResponseEntity.ok(usageSummaryService.summarize(BillingSecurityUtils.getCurrentUserId()));
    }

    @Operation(
            summary = "Check entitlement before running an operation",
            description = "Denies only when the plan excludes the feature. Expected overage is reported, not denied."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Operation allowed",
                    content = @Content(schema = @Schema(implementation = EntitlementCheckDto.class))),
            @ApiResponse(responseCode = "400", description = "Unknown service or invalid request",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Plan does not include the feature",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/preflight")
    @PreAuthorize("hasAuthority('BILLING_WRITE')")
    public ResponseEntity<EntitlementCheckDto> preflight(@Valid @RequestBody PreflightRequest request) {
        EntitlementCheck check = entitlementEnforcer.enforce(
                BillingSecurityUtils.getCurrentUserId(),
                request.serviceCode(),
                request.estimatedTokens(),
                request.estimatedPages());
        return ResponseEntity.ok(catalogMapper.toDto(check));
    }

    @Operation(
            summary = "Finalize a completed operation",
            description = "Records actual usage once per idempotency key and returns the refreshed cycle summary. "
                    + "The Idempotency-Key header takes precedence over the body field."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Usage recorded or replayed",
                    content = @Content(schema = @Schema(implementation = BillingSummary.class))),
            @ApiResponse(responseCode = "400", description = "Unknown service, tokens on a non-payable service or invalid request",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/finalize")
    @PreAuthorize("hasAuthority('BILLING_WRITE')")
    public ResponseEntity<BillingSummary> finalizeUsage(
            @Parameter(description = "Idempotency key for this operation")
            @RequestHeader(name = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKeyHeader,
            @Valid @RequestBody FinalizeRequest request) {
        String idempotencyKey = StringUtils.hasText(idempotencyKeyHeader) ? idempotencyKeyHeader : request.idempotencyKey();
        BillingSummary summary = billingOrchestrator.finalizeUsage(
                BillingSecurityUtils.getCurrentUserId(),
                request.serviceCode(),
                request.actualTokens(),
                request.actualPages(),
                request.metadata(),
                idempotencyKey);
        return ResponseEntity.ok(summary);
    }

    @Operation(summary = "Record a raw usage event", description = "Ledger write only: no plan resolution and no provider report")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event recorded or replayed",
                    content = @Content(schema = @Schema(implementation = RecordedUsageDto.class))),
            @ApiResponse(responseCode = "400", description = "Unknown service or tokens on a non-payable service",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/events/record")
    @PreAuthorize("hasAuthority('BILLING_WRITE')")
    public ResponseEntity<RecordedUsageDto> recordEvent(@Valid @RequestBody RecordUsageRequest request) {
        return ResponseEntity.ok(usageLedgerService.record(BillingSecurityUtils.getCurrentUserId(), request));
    }

    @Operation(summary = "List usage events", description = "Newest first, optionally filtered by service and time range")
    @GetMapping("/events")
    @PreAuthorize("hasAuthority('BILLING_READ')")
    public ResponseEntity<Page<UsageEventDto>> listEvents(
            @Parameter(description = "Pagination parameters") @PageableDefault(size = 20) Pageable pageable,
            @Parameter(description = "Filter by service code") @RequestParam(required = false) String eventType,
            @Parameter(description = "Filter from date (inclusive)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime dateFrom,
            @Parameter(description = "Filter to date (exclusive)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime dateTo) {
        return ResponseEntity.ok(usageLedgerService.listEvents(
                BillingSecurityUtils.getCurrentUserId(), eventType, dateFrom, dateTo, pageable));
    }

    @Operation(summary = "Get a usage event")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event found",
                    content = @Content(schema = @Schema(implementation = UsageEventDto.class))),
            @ApiResponse(responseCode = "404", description = "No such event for the caller",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/events/{eventId}")
    @PreAuthorize("hasAuthority('BILLING_READ')")
    public ResponseEntity<UsageEventDto> getEvent(@PathVariable UUID eventId) {
        return ResponseEntity.ok(usageLedgerService.getEvent(BillingSecurityUtils.getCurrentUserId(), eventId));
    }

    @Operation(summary = "List token usage records", description = "Newest first, optionally filtered by time range")
    @GetMapping("/usage")
    @PreAuthorize("hasAuthority('BILLING_READ')")
    public ResponseEntity<Page<UsageRecordDto>> listUsage(
            @PageableDefault(size = 20) Pageable pageable,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime dateTo) {
        return ResponseEntity.ok(usageLedgerService.listUsageRecords(
                BillingSecurityUtils.getCurrentUserId(), dateFrom, dateTo, pageable));
    }
}
