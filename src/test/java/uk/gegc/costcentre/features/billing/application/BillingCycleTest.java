package uk.gegc.costcentre.features.billing.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class BillingCycleTest {

    @Test
    @DisplayName("cycle spans the calendar month containing the instant")
    void calendarMonth() {
        BillingCycle cycle = BillingCycle.containing(LocalDateTime.of(2024, 2, 29, 23, 59, 59));

        assertThat(cycle.start()).isEqualTo(LocalDateTime.of(2024, 2, 1, 0, 0));
        assertThat(cycle.end()).isEqualTo(LocalDateTime.of(2024, 3, 1, 0, 0));
    }

    @Test
    @DisplayName("December rolls over into January of the next year")
    void decemberRollover() {
        BillingCycle cycle = BillingCycle.containing(LocalDateTime.of(2023, 12, 15, 8, 0));

        assertThat(cycle.start()).isEqualTo(LocalDateTime.of(2023, 12, 1, 0, 0));
        assertThat(cycle.end()).isEqualTo(LocalDateTime.of(2024, 1, 1, 0, 0));
    }

    @Test
    @DisplayName("start is inclusive and end is exclusive")
    void halfOpen() {
        BillingCycle cycle = BillingCycle.containing(LocalDateTime.of(2024, 5, 10, 12, 0));

        assertThat(cycle.contains(cycle.start())).isTrue();
        assertThat(cycle.contains(cycle.end().minusNanos(1))).isTrue();
        assertThat(cycle.contains(cycle.end())).isFalse();
        assertThat(cycle.contains(cycle.start().minusNanos(1))).isFalse();
    }
}
