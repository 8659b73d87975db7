package com.barthel.tariffshock.adapter.out.reference;

import com.barthel.tariffshock.domain.model.Partner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class TariffScheduleAdapterTest {

    private TariffScheduleAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new TariffScheduleAdapter(TradeDatasetAdapterTest.fixtureProperties(),
                new ReferenceTableReader(new DefaultResourceLoader()));
        adapter.load();
    }

    @Test
    void looksUpRatePerPartner() {
        assertThat(adapter.rate("72", Partner.US)).isEqualTo(25.0);
        assertThat(adapter.rate("72", Partner.EU)).isEqualTo(5.0);
        assertThat(adapter.rate("30", Partner.CHINA)).isEqualTo(10.0);
    }

    @Test
    void absentRatesDefaultToZero() {
        assertThat(adapter.rate("72", Partner.CHINA)).isZero();
        assertThat(adapter.rate("99", Partner.US)).isZero();
        assertThat(adapter.rate("72", Partner.OTHER)).isZero();
        assertThat(adapter.rate(null, Partner.US)).isZero();
    }

    @Test
    void listsTariffedSectorsWithZeroFilledRates() {
        Map<String, Map<Partner, Double>> sectors = adapter.allTariffedSectors();

        assertThat(sectors.keySet()).containsExactly("30", "72", "87");
        assertThat(sectors.get("72")).containsOnly(
                entry(Partner.US, 25.0), entry(Partner.CHINA, 0.0), entry(Partner.EU, 5.0));
        assertThat(sectors.get("30")).containsEntry(Partner.US, 0.0).containsEntry(Partner.CHINA, 10.0);
    }

    @Test
    @ExtendWith(OutputCaptureExtension.class)
    void loadReportsTariffedSectorCount(CapturedOutput output) {
        TariffScheduleAdapter reloaded = new TariffScheduleAdapter(TradeDatasetAdapterTest.fixtureProperties(),
                new ReferenceTableReader(new DefaultResourceLoader()));
        reloaded.load();

        assertThat(output).contains("for 3 partners covering 3 tariffed sectors");
    }

    @Test
    void bundledScheduleLoads() {
        TariffScheduleAdapter bundled = new TariffScheduleAdapter(new com.barthel.tariffshock.config.TariffShockProperties(),
                new ReferenceTableReader(new DefaultResourceLoader()));
        bundled.load();

        assertThat(bundled.rate("87", Partner.US)).isEqualTo(25.0);
        assertThat(bundled.rate("12", Partner.CHINA)).isEqualTo(25.0);
        assertThat(bundled.rate("76", Partner.EU)).isEqualTo(5.0);
        assertThat(bundled.allTariffedSectors()).hasSize(18);
    }
}
