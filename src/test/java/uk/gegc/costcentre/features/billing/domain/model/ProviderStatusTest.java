package uk.gegc.costcentre.features.billing.domain.model;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderStatusTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "active, ACTIVE",
            "ACTIVE, ACTIVE",
            "trialing, TRIALING",
            "past_due, PAST_DUE",
            "canceled, CANCELED",
            "incomplete_expired, CANCELED",
            "incomplete, INACTIVE",
            "unpaid, INACTIVE",
            "paused, INACTIVE"
    })
    void mapsProviderValues(String value, ProviderStatus expected) {
        assertThat(ProviderStatus.fromProviderValue(value)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    void missingValueIsInactive(String value) {
        assertThat(ProviderStatus.fromProviderValue(value)).isEqualTo(ProviderStatus.INACTIVE);
    }

    @ParameterizedTest
    @CsvSource({"ACTIVE, true", "TRIALING, true", "PAST_DUE, false", "CANCELED, false", "INACTIVE, false"})
    void onlyActiveAndTrialingAreEntitled(ProviderStatus status, boolean entitled) {
        assertThat(ProviderStatus.ENTITLED.contains(status)).isEqualTo(entitled);
    }
}
