package uk.gegc.costcentre.features.billing.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import uk.gegc.costcentre.features.billing.api.dto.BillingSummary;
import uk.gegc.costcentre.features.billing.domain.exception.EntitlementDeniedException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("MeteredOperationGuard")
class MeteredOperationGuardTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-15T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private EntitlementEnforcer entitlementEnforcer;
    @Mock
    private BillingOrchestrator billingOrchestrator;

    private MeteredOperationGuard guard;
    private final UUID userId = UUID.randomUUID();

    record Translation(String text, long tokensUsed) implements MeteredResult {
    }

    @BeforeEach
    void setUp() {
        guard = new MeteredOperationGuard(entitlementEnforcer, billingOrchestrator, CLOCK);
        when(entitlementEnforcer.enforce(any(), anyString(), anyLong(), anyLong()))
                .thenReturn(new EntitlementCheck(UUID.randomUUID(), "pro", "translation", List.of()));
    }

    @Test
    @DisplayName("finalizes actual usage under the key handed to the operation")
    void finalizesWithSameKey() {
        AtomicReference<String> seenKey = new AtomicReference<>();
        BillingSummary summary = new BillingSummary(UUID.randomUUID(), "k", false, null);
        when(billingOrchestrator.finalizeUsage(eq(userId), eq("translation"), eq(1_234L), eq(0L), anyMap(), anyString()))
                .thenReturn(summary);

        Metered<Translation> metered = guard.guard(userId, "translation", () -> UsageEstimate.tokens(1_000),
                key -> {
                    seenKey.set(key);
                    return new Translation("hallo", 1_234);
                }, Map.of("doc", "d1"));

        assertThat(metered.result().text()).isEqualTo("hallo");
        assertThat(metered.billed()).isTrue();
        assertThat(metered.billing()).isSameAs(summary);
        assertThat(seenKey.get()).startsWith("translation_").endsWith("_" + CLOCK.millis());
        verify(entitlementEnforcer).enforce(userId, "translation", 1_000, 0);
        verify(billingOrchestrator).finalizeUsage(userId, "translation", 1_234, 0, Map.of("doc", "d1"), seenKey.get());
    }

    @Test
    @DisplayName("a failing estimator counts as zero")
    void estimatorFailure() {
        guard.guard(userId, "translation", () -> {
            throw new IllegalStateException("tokenizer offline");
        }, key -> new Translation("x", 5), Map.of());

        verify(entitlementEnforcer).enforce(userId, "translation", 0, 0);
    }

    @Test
    @DisplayName("negative estimates are clamped")
    void negativeEstimate() {
        guard.guard(userId, "translation", () -> new UsageEstimate(-5, -2), key -> new Translation("x", 5), Map.of());

        verify(entitlementEnforcer).enforce(userId, "translation", 0, 0);
    }

    @Test
    @DisplayName("a denial stops the operation")
    void denied() {
        when(entitlementEnforcer.enforce(any(), anyString(), anyLong(), anyLong()))
                .thenThrow(new EntitlementDeniedException("starter", "translation", 100));
        AtomicReference<Boolean> ran = new AtomicReference<>(false);

        assertThatThrownBy(() -> guard.guard(userId, "translation", () -> UsageEstimate.tokens(100), key -> {
            ran.set(true);
            return new Translation("x", 5);
        }, Map.of())).isInstanceOf(EntitlementDeniedException.class);

        assertThat(ran.get()).isFalse();
        verify(billingOrchestrator, never()).finalizeUsage(any(), anyString(), anyLong(), anyLong(), anyMap(), anyString());
    }

    @Test
    @DisplayName("an operation failure propagates and records nothing")
    void operationFailure() {
        assertThatThrownBy(() -> guard.guard(userId, "translation", () -> UsageEstimate.NONE, key -> {
            throw new IllegalArgumentException("unsupported language");
        }, Map.of())).isInstanceOf(IllegalArgumentException.class).hasMessage("unsupported language");

        verify(billingOrchestrator, never()).finalizeUsage(any(), anyString(), anyLong(), anyLong(), anyMap(), anyString());
    }

    @Test
    @DisplayName("a finalize failure still returns the operation result")
    void finalizeFailure() {
        when(billingOrchestrator.finalizeUsage(any(), anyString(), anyLong(), anyLong(), anyMap(), anyString()))
                .thenThrow(new IllegalStateException("database down"));

        Metered<Translation> metered = guard.guard(userId, "translation", () -> UsageEstimate.NONE,
                key -> new Translation("ok", 10), Map.of());

        assertThat(metered.result().text()).isEqualTo("ok");
        assertThat(metered.billed()).isFalse();
    }
}
