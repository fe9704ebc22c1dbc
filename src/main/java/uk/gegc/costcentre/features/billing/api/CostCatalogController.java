package uk.gegc.costcentre.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.costcentre.features.billing.api.dto.CatalogDto;
import uk.gegc.costcentre.features.billing.application.BillingProperties;
import uk.gegc.costcentre.features.billing.application.PlanCatalog;
import uk.gegc.costcentre.features.billing.application.ServiceRegistry;
import uk.gegc.costcentre.features.billing.infra.mapping.CatalogMapper;

@RestController
@RequestMapping("/api/v1/cost/catalog")
@RequiredArgsConstructor
@Tag(name = "Cost Catalog", description = "Plans, metered services and overage rates")
public class CostCatalogController {

    private final PlanCatalog planCatalog;
    private final ServiceRegistry serviceRegistry;
    private final BillingProperties billingProperties;
    private final CatalogMapper catalogMapper;

    @Operation(summary = "Get the plan and service catalog", description = "Public; no authentication required")
    @ApiResponse(responseCode = "200", description = "Catalog retrieved",
            content = @Content(schema = @Schema(implementation = CatalogDto.class)))
    @GetMapping
    public ResponseEntity<CatalogDto> getCatalog() {
        return ResponseEntity.ok(new CatalogDto(
                billingProperties.getCurrency(),
                catalogMapper.toPlanDtos(planCatalog.all()),
                catalogMapper.toServiceDtos(serviceRegistry.all()),
                catalogMapper.toDto(billingProperties.getOverage())
        ));
    }
}
