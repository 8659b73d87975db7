package com.barthel.tariffshock.adapter.out.reference;

import com.barthel.tariffshock.config.TariffShockProperties;
import com.barthel.tariffshock.domain.model.Partner;
import com.barthel.tariffshock.domain.model.SectorSummary;
import com.barthel.tariffshock.domain.service.SectorSummaryAggregator;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TradeDatasetAdapterTest {

    static TariffShockProperties fixtureProperties() {
        TariffShockProperties properties = new TariffShockProperties();
        properties.getData().setPartnerExports("classpath:fixtures/partner-exports.csv");
        properties.getData().setSectorNames("classpath:fixtures/hs2-sectors.yml");
        properties.getData().setPartnerCountries("classpath:fixtures/partner-countries.yml");
        properties.getData().setTariffRates("classpath:fixtures/tariff-rates.yml");
        return properties;
    }

    private static TradeDatasetAdapter adapter(TariffShockProperties properties) {
        return new TradeDatasetAdapter(properties, new ReferenceTableReader(new DefaultResourceLoader()),
                new SectorSummaryAggregator());
    }

    @Test
    void notLoadedBeforeStartup() {
        TradeDatasetAdapter adapter = adapter(fixtureProperties());

        assertThat(adapter.isLoaded()).isFalse();
        assertThat(adapter.allSectors()).isEmpty();
    }

    @Test
    void loadsAndAggregatesFixtureDataset() {
        TradeDatasetAdapter adapter = adapter(fixtureProperties());
        adapter.load();

        assertThat(adapter.isLoaded()).isTrue();
        assertThat(adapter.allSectors().keySet()).containsExactly("09", "30", "72", "87");

        SectorSummary vehicles = adapter.findSector("87").orElseThrow();
        assertThat(vehicles.sectorName()).isEqualTo("Vehicles");
        assertThat(vehicles.totalExports()).isEqualTo(50_000_000_000.0);
        assertThat(vehicles.shareOf(Partner.US)).isEqualTo(0.62);
        assertThat(vehicles.shareOf(Partner.EU)).isEqualTo(0.15);
        assertThat(vehicles.shareOf(Partner.OTHER)).isEqualTo(0.15);
        assertThat(vehicles.topPartner()).isEqualTo(Partner.US);
        assertThat(vehicles.topPartnerShare()).isEqualTo(0.62);
    }

    @Test
    void foldsMemberStatesIntoEu() {
        TradeDatasetAdapter adapter = adapter(fixtureProperties());
        adapter.load();

        SectorSummary pharma = adapter.findSector("30").orElseThrow();
        assertThat(pharma.topPartner()).isEqualTo(Partner.EU);
        assertThat(pharma.topPartnerShare()).isEqualTo(0.4);
        assertThat(pharma.shareOf(Partner.OTHER)).isEqualTo(0.1);
    }

    @Test
    void padsCodesAndNamesUnknownSectors() {
        TradeDatasetAdapter adapter = adapter(fixtureProperties());
        adapter.load();

        SectorSummary padded = adapter.findSector("09").orElseThrow();
        assertThat(padded.sectorName()).isEqualTo("Sector 09");
        assertThat(padded.totalExports()).isZero();
        assertThat(padded.topPartnerShare()).isZero();
    }

    @Test
    void unknownSectorIsEmpty() {
        TradeDatasetAdapter adapter = adapter(fixtureProperties());
        adapter.load();

        assertThat(adapter.findSector("UNKNOWN")).isEmpty();
        assertThat(adapter.findSector(null)).isEmpty();
    }

    @Test
    void missingDatasetFailsLoad() {
        TariffShockProperties properties = fixtureProperties();
        properties.getData().setPartnerExports("classpath:fixtures/does-not-exist.csv");
        TradeDatasetAdapter adapter = adapter(properties);

        assertThatThrownBy(adapter::load)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("does-not-exist.csv");
        assertThat(adapter.isLoaded()).isFalse();
    }

    @Test
    void negativeExportValueFailsLoad() {
        TariffShockProperties properties = fixtureProperties();
        properties.getData().setPartnerExports("classpath:fixtures/negative-exports.csv");

        assertThatThrownBy(adapter(properties)::load)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("export_value must be >= 0");
    }

    @Test
    void otherIsNotAConfigurablePartnerBucket() {
        TariffShockProperties properties = fixtureProperties();
        properties.getData().setPartnerCountries("classpath:fixtures/invalid-partner-countries.yml");

        assertThatThrownBy(adapter(properties)::load)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid partner: Other");
    }

    @Test
    void normalizesSingleDigitCodes() {
        assertThat(TradeDatasetAdapter.normalizeHs2(" 4 ")).isEqualTo("04");
        assertThat(TradeDatasetAdapter.normalizeHs2("87")).isEqualTo("87");
    }
}
