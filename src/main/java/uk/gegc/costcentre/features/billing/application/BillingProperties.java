package uk.gegc.costcentre.features.billing.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;
import uk.gegc.costcentre.features.billing.domain.model.MeteredItem;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Billing configuration: plan catalog, service registry, overage prices and dispatch settings.
 */
@Configuration
@ConfigurationProperties(prefix = "billing")
@Validated
@Data
public class BillingProperties {

    /**
     * Currency every price and overage amount is expressed in.
     */
    @NotBlank
    private String currency = "USD";

    /**
     * Plan applied when a user has no entitled subscription or its plan code is not in the catalog.
     */
    @NotBlank
    private String fallbackPlan = "starter";

    @Valid
    @NotNull
    private Overage overage = new Overage();

    /**
     * Plan catalog keyed by plan code.
     */
    @Valid
    private Map<String, Plan> plans = new LinkedHashMap<>();

    /**
     * Service registry keyed by service code.
     */
    @Valid
    private Map<String, Service> services = new LinkedHashMap<>();

    @Valid
    @NotNull
    private Dispatch dispatch = new Dispatch();

    @Valid
    @NotNull
    private Alerts alerts = new Alerts();

    /**
     * Service codes prefix generated idempotency keys, so they must leave room for the random suffix.
     */
    @AssertTrue(message = "service codes must be at most " + IdempotencyKeys.MAX_PREFIX_LENGTH + " characters")
    public boolean isServiceCodesWithinKeyLimit() {
        return services.keySet().stream()
                .allMatch(code -> code != null && code.length() <= IdempotencyKeys.MAX_PREFIX_LENGTH);
    }

    @Data
    public static class Overage {
        @NotNull
        @DecimalMin("0.00")
        private BigDecimal tokensPerMillion = new BigDecimal("6.00");

        @NotNull
        @DecimalMin("0.00")
        private BigDecimal pagesPerThousand = new BigDecimal("2.00");

        @NotNull
        @DecimalMin("0.00")
        private BigDecimal storagePerGbMonth = new BigDecimal("0.10");
    }

    @Data
    public static class Plan {
        @NotBlank
        private String name;

        /** List price per seat per month. */
        @NotNull
        @DecimalMin("0.00")
        private BigDecimal pricePerSeat;

        /** Absent: token features disabled. -1: unlimited. Otherwise the monthly quota. */
        @Min(-1)
        private Long tokensIncluded;

        @PositiveOrZero
        private long pagesIncluded;

        @PositiveOrZero
        private long storageGbIncluded;

        private String highlights;
    }

    @Data
    public static class Service {
        @NotBlank
        private String name;

        private boolean payable;

        /** Item on the subscription that usage of this service is reported against, if any. */
        private MeteredItem meteredItem;
    }

    @Data
    public static class Dispatch {
        /** Upper bound for a single usage report to the billing provider. */
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Alerts {
        private boolean enabled = true;

        /** Spring cron expression for the budget scan. */
        @NotBlank
        private String cron = "0 0 * * * *";

        /** Share of the token limit at which a budget alert fires. */
        @Min(1)
        @Max(100)
        private int thresholdPct = 90;
    }
}
