package uk.gegc.costcentre.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.costcentre.features.billing.api.dto.PaymentDto;
import uk.gegc.costcentre.features.billing.application.UsageLedgerService;

@RestController
@RequestMapping("/api/v1/cost/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Payment history")
@SecurityRequirement(name = "Gateway Authentication")
public class PaymentController {

    private final UsageLedgerService usageLedgerService;

    @Operation(summary = "List my payments", description = "Newest first")
    @GetMapping
    @PreAuthorize("hasAuthority('BILLING_READ')")
    public ResponseEntity<Page<PaymentDto>> listPayments(@PageableDefault(size = 20) Pageable pageable) {
        return ResponseEntity.ok(usageLedgerService.listPayments(BillingSecurityUtils.getCurrentUserId(), pageable));
    }
}
