package com.barthel.tariffshock.domain.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PartnerTest {

    @Test
    void resolvesSelectableCodes() {
        assertThat(Partner.fromTargetCode("US")).isEqualTo(Partner.US);
        assertThat(Partner.fromTargetCode("China")).isEqualTo(Partner.CHINA);
        assertThat(Partner.fromTargetCode("EU")).isEqualTo(Partner.EU);
    }

    @Test
    void rejectsOtherAsTarget() {
        assertThatThrownBy(() -> Partner.fromTargetCode("Other"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid partner: Other");
    }

    @Test
    void rejectsUnknownAndWrongCase() {
        assertThatThrownBy(() -> Partner.fromTargetCode("MX")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Partner.fromTargetCode("china")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Partner.fromTargetCode(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromCodeKnowsOther() {
        assertThat(Partner.fromCode("Other")).contains(Partner.OTHER);
        assertThat(Partner.fromCode("XX")).isEmpty();
    }

    @Test
    void selectableExcludesOther() {
        assertThat(Partner.selectable()).containsExactly(Partner.US, Partner.CHINA, Partner.EU);
    }
}
