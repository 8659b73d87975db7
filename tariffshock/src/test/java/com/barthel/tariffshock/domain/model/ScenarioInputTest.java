package com.barthel.tariffshock.domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScenarioInputTest {

    @Test
    void acceptsTariffWithinRange() {
        ScenarioInput scenario = new ScenarioInput(10, List.of(Partner.US, Partner.CHINA));

        assertThat(scenario.tariffPercent()).isEqualTo(10.0);
        assertThat(scenario.targetPartners()).containsExactly(Partner.US, Partner.CHINA);
        assertThat(scenario.sectorFilter()).isNull();
    }

    @Test
    void acceptsBothRangeEnds() {
        assertThat(new ScenarioInput(0, List.of()).tariffPercent()).isZero();
        assertThat(new ScenarioInput(25, List.of()).tariffPercent()).isEqualTo(25.0);
    }

    @Test
    void rejectsTariffAboveMaximum() {
        assertThatThrownBy(() -> new ScenarioInput(30, List.of(Partner.US)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tariff_percent must be in");
    }

    @Test
    void rejectsNegativeTariff() {
        assertThatThrownBy(() -> new ScenarioInput(-5, List.of(Partner.US)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tariff_percent must be in");
    }

    @Test
    void rejectsNaNTariff() {
        assertThatThrownBy(() -> new ScenarioInput(Double.NaN, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void targetPartnersAreDeduplicatedAndImmutable() {
        ScenarioInput scenario = new ScenarioInput(5, List.of(Partner.EU, Partner.US, Partner.EU));

        assertThat(scenario.targetPartners()).containsExactly(Partner.US, Partner.EU);
        assertThatThrownBy(() -> scenario.targetPartners().add(Partner.CHINA))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void sectorFilterIsCopied() {
        List<String> filter = new ArrayList<>(List.of("87"));
        ScenarioInput scenario = new ScenarioInput(5, null, filter);
        filter.add("30");

        assertThat(scenario.targetPartners()).isEmpty();
        assertThat(scenario.sectorFilter()).containsExactly("87");
    }

    @Test
    void acceptsPartnerListWithSectorFilter() {
        ScenarioInput scenario = new ScenarioInput(10, List.of(Partner.EU, Partner.US, Partner.US), List.of("30"));

        assertThat(scenario.targetPartners()).containsExactly(Partner.US, Partner.EU);
        assertThat(scenario.sectorFilter()).containsExactly("30");
    }

    @Test
    void baselineHasZeroTariffAndNoPartners() {
        ScenarioInput baseline = ScenarioInput.baseline(List.of("87"));

        assertThat(baseline.tariffPercent()).isZero();
        assertThat(baseline.targetPartners()).isEmpty();
        assertThat(baseline.sectorFilter()).containsExactly("87");
    }

    @Test
    void withSectorFilterKeepsTariffAndPartners() {
        ScenarioInput scenario = new ScenarioInput(12.5, List.of(Partner.CHINA)).withSectorFilter(List.of("30"));

        assertThat(scenario.tariffPercent()).isEqualTo(12.5);
        assertThat(scenario.targetPartners()).containsExactly(Partner.CHINA);
        assertThat(scenario.sectorFilter()).containsExactly("30");
    }
}
