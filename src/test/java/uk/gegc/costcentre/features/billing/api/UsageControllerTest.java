package uk.gegc.costcentre.features.billing.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.costcentre.features.billing.api.dto.BillingSummary;
import uk.gegc.costcentre.features.billing.api.dto.EntitlementCheckDto;
import uk.gegc.costcentre.features.billing.api.dto.UsageEventDto;
import uk.gegc.costcentre.features.billing.application.BillingOrchestrator;
import uk.gegc.costcentre.features.billing.application.EntitlementCheck;
import uk.gegc.costcentre.features.billing.application.EntitlementEnforcer;
import uk.gegc.costcentre.features.billing.application.UsageLedgerService;
import uk.gegc.costcentre.features.billing.application.UsageSummaryService;
import uk.gegc.costcentre.features.billing.domain.exception.EntitlementDeniedException;
import uk.gegc.costcentre.features.billing.domain.exception.UnknownServiceException;
import uk.gegc.costcentre.features.billing.infra.mapping.CatalogMapper;
import uk.gegc.costcentre.features.tenancy.domain.exception.TenantNotResolvedException;
import uk.gegc.costcentre.shared.config.SecurityConfig;
import uk.gegc.costcentre.shared.exception.ResourceNotFoundException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(UsageController.class)
@Import(SecurityConfig.class)
class UsageControllerTest {

    private static final String USER_ID = "3f1c9a52-7d1e-4b8a-9c2f-5e6d7a8b9c0d";
    private static final UUID USER = UUID.fromString(USER_ID);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private EntitlementEnforcer entitlementEnforcer;
    @MockitoBean
    private BillingOrchestrator billingOrchestrator;
    @MockitoBean
    private UsageSummaryService usageSummaryService;
    @MockitoBean
    private UsageLedgerService usageLedgerService;
    @MockitoBean
    private CatalogMapper catalogMapper;

    @Nested
    @DisplayName("POST /api/v1/cost/preflight")
    class Preflight {

        @Test
        @WithMockUser(username = USER_ID, authorities = "BILLING_WRITE")
        @DisplayName("allowed operation returns the check")
        void allowed() throws Exception {
            EntitlementCheck check = new EntitlementCheck(UUID.randomUUID(), "pro", "translation", List.of("tokens"));
            when(entitlementEnforcer.enforce(USER, "translation", 5_000, 0)).thenReturn(check);
            when(catalogMapper.toDto(check)).thenReturn(new EntitlementCheckDto(
                    check.tenantId(), "pro", "translation", true, List.of("tokens")));

            mockMvc.perform(post("/api/v1/cost/preflight")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"serviceCode\":\"translation\",\"estimatedTokens\":5000}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.planCode").value("pro"))
                    .andExpect(jsonPath("$.overageExpected").value(true))
                    .andExpect(jsonPath("$.overageCategories[0]").value("tokens"));
        }

        @Test
        @WithMockUser(username = USER_ID, authorities = "BILLING_WRITE")
        @DisplayName("plan without the feature is 403 with entitlement details")
        void denied() throws Exception {
            when(entitlementEnforcer.enforce(USER, "translation", 100, 0))
                    .thenThrow(new EntitlementDeniedException("starter", "translation", 100));

            mockMvc.perform(post("/api/v1/cost/preflight")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"serviceCode\":\"translation\",\"estimatedTokens\":100}"))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.title").value("Entitlement Denied"))
                    .andExpect(jsonPath("$.planCode").value("starter"))
                    .andExpect(jsonPath("$.estimatedTokens").value(100));
        }

        @Test
        @WithMockUser(username = USER_ID, authorities = "BILLING_WRITE")
        @DisplayName("unknown service is 400")
        void unknownService() throws Exception {
            when(entitlementEnforcer.enforce(USER, "ocr", 0, 0)).thenThrow(new UnknownServiceException("ocr"));

            mockMvc.perform(post("/api/v1/cost/preflight")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"serviceCode\":\"ocr\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.serviceCode").value("ocr"));
        }

        @Test
        @WithMockUser(username = USER_ID, authorities = "BILLING_WRITE")
        @DisplayName("caller without tenant is 400")
        void noTenant() throws Exception {
            when(entitlementEnforcer.enforce(any(), anyString(), anyLong(), anyLong()))
                    .thenThrow(new TenantNotResolvedException(USER));

            mockMvc.perform(post("/api/v1/cost/preflight")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"serviceCode\":\"translation\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title").value("Tenant Not Resolved"));
        }

        @Test
        @WithMockUser(username = USER_ID, authorities = "BILLING_WRITE")
        @DisplayName("negative estimate fails validation")
        void negativeEstimate() throws Exception {
            mockMvc.perform(post("/api/v1/cost/preflight")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"serviceCode\":\"translation\",\"estimatedTokens\":-1}"))
                    .andExpect(status().isBadRequest());

            verify(entitlementEnforcer, never()).enforce(any(), anyString(), anyLong(), anyLong());
        }

        @Test
        @WithMockUser(username = USER_ID, authorities = "BILLING_READ")
        @DisplayName("read-only caller is 403")
        void readOnlyCaller() throws Exception {
            mockMvc.perform(post("/api/v1/cost/preflight")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"serviceCode\":\"translation\"}"))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("anonymous caller is 401")
        void anonymous() throws Exception {
            mockMvc.perform(post("/api/v1/cost/preflight")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"serviceCode\":\"translation\"}"))
                    .andExpect(status().isUnauthorized());
        }
    }

    @Nested
    @DisplayName("POST /api/v1/cost/finalize")
    class Finalize {

        @Test
        @WithMockUser(username = USER_ID, authorities = "BILLING_WRITE")
        @DisplayName("header key takes precedence over the body key")
        void headerWins() throws Exception {
            when(billingOrchestrator.finalizeUsage(eq(USER), eq("translation"), eq(1200L), eq(0L), any(), eq("from-header")))
                    .thenReturn(new BillingSummary(UUID.randomUUID(), "from-header", false, null));

            mockMvc.perform(post("/api/v1/cost/finalize")
                            .header(UsageController.IDEMPOTENCY_KEY_HEADER, "from-header")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"serviceCode\":\"translation\",\"actualTokens\":1200,\"idempotencyKey\":\"from-body\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.idempotencyKey").value("from-header"))
                    .andExpect(jsonPath("$.replayed").value(false));
        }

        @Test
        @WithMockUser(username = USER_ID, authorities = "BILLING_WRITE")
        @DisplayName("body key is used without a header")
        void bodyKey() throws Exception {
            when(billingOrchestrator.finalizeUsage(eq(USER), eq("redact"), eq(50L), eq(0L), anyMap(), eq("from-body")))
                    .thenReturn(new BillingSummary(UUID.randomUUID(), "from-body", true, null));

            mockMvc.perform(post("/api/v1/cost/finalize")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"serviceCode\":\"redact\",\"actualTokens\":50,\"metadata\":{\"doc\":\"d1\"},"
                                    + "\"idempotencyKey\":\"from-body\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.replayed").value(true));

            verify(billingOrchestrator).finalizeUsage(USER, "redact", 50, 0, Map.of("doc", "d1"), "from-body");
        }

        @Test
        @WithMockUser(username = USER_ID, authorities = "BILLING_WRITE")
        @DisplayName("no key at all passes null")
        void noKey() throws Exception {
            when(billingOrchestrator.finalizeUsage(eq(USER), eq("open_document"), eq(0L), eq(2L), any(), isNull()))
                    .thenReturn(new BillingSummary(UUID.randomUUID(), "open_document_x", false, null));

            mockMvc.perform(post("/api/v1/cost/finalize")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"serviceCode\":\"open_document\",\"actualPages\":2}"))
                    .andExpect(status().isOk());
        }

        @Test
        @WithMockUser(username = USER_ID, authorities = "BILLING_WRITE")
        @DisplayName("blank service code fails validation")
        void blankService() throws Exception {
            mockMvc.perform(post("/api/v1/cost/finalize")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"serviceCode\":\"\",\"actualTokens\":1}"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("Ledger reads")
    class LedgerReads {

        @Test
        @WithMockUser(username = USER_ID, authorities = "BILLING_READ")
        @DisplayName("events are listed with filters")
        void listEvents() throws Exception {
            UsageEventDto event = new UsageEventDto(UUID.randomUUID(), "translation", null, "k1", "{}", 10, 0,
                    LocalDateTime.of(2024, 6, 2, 9, 0));
            when(usageLedgerService.listEvents(eq(USER), eq("translation"), eq(LocalDateTime.of(2024, 6, 1, 0, 0)),
                    isNull(), any(Pageable.class)))
                    .thenReturn(new PageImpl<>(List.of(event), PageRequest.of(0, 20), 1));

            mockMvc.perform(get("/api/v1/cost/events")
                            .param("eventType", "translation")
                            .param("dateFrom", "2024-06-01T00:00:00"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.content[0].idempotencyKey").value("k1"));
        }

        @Test
        @WithMockUser(username = USER_ID, authorities = "BILLING_READ")
        @DisplayName("another user's event is 404")
        void eventNotFound() throws Exception {
            UUID eventId = UUID.randomUUID();
            when(usageLedgerService.getEvent(USER, eventId))
                    .thenThrow(new ResourceNotFoundException("Usage event " + eventId + " not found"));

            mockMvc.perform(get("/api/v1/cost/events/{eventId}", eventId))
                    .andExpect(status().isNotFound());
        }

        @Test
        @WithMockUser(username = USER_ID, authorities = "BILLING_WRITE")
        @DisplayName("summary requires read authority")
        void summaryNeedsRead() throws Exception {
            mockMvc.perform(get("/api/v1/cost/summary"))
                    .andExpect(status().isForbidden());
        }
    }
}
