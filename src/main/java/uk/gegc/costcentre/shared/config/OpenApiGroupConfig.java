package uk.gegc.costcentre.shared.config;

import io.swagger.v3.oas.annotations.enums.SecuritySchemeIn;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.costcentre.shared.security.GatewayAuthenticationFilter;

/**
 * API documentation groups for the cost centre endpoints.
 */
@Configuration
@SecurityScheme(
        name = "Gateway Authentication",
        type = SecuritySchemeType.APIKEY,
        in = SecuritySchemeIn.HEADER,
        paramName = GatewayAuthenticationFilter.USER_HEADER,
        description = "User id asserted by the API gateway"
)
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi usageGroup() {
        return GroupedOpenApi.builder()
                .group("usage")
                .displayName("Usage Metering")
                .pathsToMatch(
                    "/api/v1/cost/summary",
                    "/api/v1/cost/preflight",
                    "/api/v1/cost/finalize",
                    "/api/v1/cost/events/**",
                    "/api/v1/cost/usage"
                )
                .build();
    }

    @Bean
    public GroupedOpenApi accountGroup() {
        return GroupedOpenApi.builder()
                .group("account")
                .displayName("Plans, Budgets & Payments")
                .pathsToMatch(
                    "/api/v1/cost/catalog",
                    "/api/v1/cost/budgets/**",
                    "/api/v1/cost/subscriptions/**",
                    "/api/v1/cost/payments"
                )
                .build();
    }

    @Bean
    public GroupedOpenApi adminGroup() {
        return GroupedOpenApi.builder()
                .group("admin")
                .displayName("Cost Admin")
                .pathsToMatch("/api/v1/cost/admin/**")
                .build();
    }
}
