package uk.gegc.costcentre.features.billing.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import uk.gegc.costcentre.features.billing.application.BillingCycle;
import uk.gegc.costcentre.features.billing.application.BillingMetricsService;
import uk.gegc.costcentre.features.billing.application.EntitlementCheck;
import uk.gegc.costcentre.features.billing.application.PlanCatalog;
import uk.gegc.costcentre.features.billing.application.PlanResolver;
import uk.gegc.costcentre.features.billing.application.UsageAggregator;
import uk.gegc.costcentre.features.billing.domain.exception.EntitlementDeniedException;
import uk.gegc.costcentre.features.billing.domain.exception.UnknownServiceException;
import uk.gegc.costcentre.features.billing.testutils.BillingFixtures;
import uk.gegc.costcentre.features.tenancy.application.TenantResolver;
import uk.gegc.costcentre.features.tenancy.domain.exception.TenantNotResolvedException;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("EntitlementEnforcerImpl")
class EntitlementEnforcerImplTest {

    private static final BillingCycle CYCLE = BillingCycle.containing(LocalDateTime.of(2024, 6, 15, 10, 0));

    @Mock
    private TenantResolver tenantResolver;
    @Mock
    private PlanResolver planResolver;
    @Mock
    private UsageAggregator usageAggregator;
    @Mock
    private BillingMetricsService metricsService;

    private final PlanCatalog planCatalog = BillingFixtures.planCatalog();
    private EntitlementEnforcerImpl enforcer;

    private UUID userId;
    private UUID tenantId;

    @BeforeEach
    void setUp() {
        enforcer = new EntitlementEnforcerImpl(tenantResolver, BillingFixtures.serviceRegistry(), planResolver,
                usageAggregator, metricsService);
        userId = UUID.randomUUID();
        tenantId = UUID.randomUUID();
        when(tenantResolver.tenantFor(userId)).thenReturn(tenantId);
        when(usageAggregator.currentCycle()).thenReturn(CYCLE);
        when(usageAggregator.storageGb(tenantId)).thenReturn(BigDecimal.ZERO);
    }

    private void onPlan(String code) {
        when(planResolver.resolve(userId, tenantId)).thenReturn(planCatalog.require(code));
    }

    @Nested
    @DisplayName("Hard denial")
    class Denial {

        @Test
        @DisplayName("starter plan denies any estimated tokens")
        void starterDeniesTokens() {
            onPlan("starter");

            assertThatThrownBy(() -> enforcer.enforce(userId, "translation", 1, 0))
                    .isInstanceOf(EntitlementDeniedException.class)
                    .satisfies(ex -> {
                        EntitlementDeniedException denied = (EntitlementDeniedException) ex;
                        assertThat(denied.getPlanCode()).isEqualTo("starter");
                        assertThat(denied.getServiceCode()).isEqualTo("translation");
                        assertThat(denied.getEstimatedTokens()).isEqualTo(1);
                    });

            verify(metricsService).incrementEntitlementDenied("starter", "translation");
            verify(usageAggregator, never()).tokensInWindow(any(), any(), any(), any());
        }

        @Test
        @DisplayName("starter plan allows non-token work")
        void starterAllowsZeroTokens() {
            onPlan("starter");

            EntitlementCheck check = enforcer.enforce(userId, "open_document", 0, 1);

            assertThat(check.planCode()).isEqualTo("starter");
            assertThat(check.overageExpected()).isFalse();
        }

        @Test
        @DisplayName("unknown service fails before plan resolution")
        void unknownService() {
            assertThatThrownBy(() -> enforcer.enforce(userId, "summarize", 10, 0))
                    .isInstanceOf(UnknownServiceException.class);

            verifyNoInteractions(planResolver);
        }

        @Test
        @DisplayName("tenant resolution failure propagates")
        void tenantNotResolved() {
            UUID stranger = UUID.randomUUID();
            when(tenantResolver.tenantFor(stranger)).thenThrow(new TenantNotResolvedException(stranger));

            assertThatThrownBy(() -> enforcer.enforce(stranger, "translation", 10, 0))
                    .isInstanceOf(TenantNotResolvedException.class);
        }
    }

    @Nested
    @DisplayName("Soft overage warnings")
    class Warnings {

        @Test
        @DisplayName("exceeding the token quota is allowed and flagged")
        void tokenOverageAllowed() {
            onPlan("pro");
            when(usageAggregator.tokensInWindow(userId, tenantId, CYCLE.start(), CYCLE.end())).thenReturn(240_000L);

            EntitlementCheck check = enforcer.enforce(userId, "translation", 20_000, 0);

            assertThat(check.overageCategories()).containsExactly("tokens");
            assertThat(check.tenantId()).isEqualTo(tenantId);
            verify(metricsService).incrementOverageWarning("tokens");
        }

        @Test
        @DisplayName("unlimited plan never warns on tokens")
        void unlimitedTokens() {
            onPlan("elite");

            EntitlementCheck check = enforcer.enforce(userId, "redact", 50_000_000, 0);

            assertThat(check.overageExpected()).isFalse();
            verify(usageAggregator, never()).tokensInWindow(any(), any(), any(), any());
        }

        @Test
        @DisplayName("pages and storage are checked independently")
        void pagesAndStorage() {
            onPlan("pro");
            when(usageAggregator.pagesInWindow(userId, tenantId, CYCLE.start(), CYCLE.end())).thenReturn(4_999L);
            when(usageAggregator.storageGb(tenantId)).thenReturn(new BigDecimal("10.5"));

            EntitlementCheck check = enforcer.enforce(userId, "open_document", 0, 2);

            assertThat(check.overageCategories()).containsExactly("pages", "storage");
        }

        @Test
        @DisplayName("negative estimates are treated as zero")
        void negativeEstimates() {
            onPlan("starter");

            EntitlementCheck check = enforcer.enforce(userId, "translation", -5, -5);

            assertThat(check.overageExpected()).isFalse();
        }
    }
}
