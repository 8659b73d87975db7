package com.barthel.tariffshock.domain.service;

import com.barthel.tariffshock.domain.model.Partner;
import com.barthel.tariffshock.domain.model.SectorPartnerExport;
import com.barthel.tariffshock.domain.model.SectorSummary;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SectorSummaryAggregatorTest {

    private final SectorSummaryAggregator aggregator = new SectorSummaryAggregator();

    @Test
    void computesSharesAndTopPartner() {
        List<SectorPartnerExport> rows = List.of(
                new SectorPartnerExport("87", Partner.US, 31_000_000_000.0),
                new SectorPartnerExport("87", Partner.CHINA, 4_000_000_000.0),
                new SectorPartnerExport("87", Partner.EU, 7_500_000_000.0),
                new SectorPartnerExport("87", Partner.OTHER, 7_500_000_000.0));

        SectorSummary sector = aggregator.aggregate(rows, id -> "Vehicles").get("87");

        assertThat(sector.sectorName()).isEqualTo("Vehicles");
        assertThat(sector.totalExports()).isEqualTo(50_000_000_000.0);
        assertThat(sector.shareOf(Partner.US)).isEqualTo(0.62);
        assertThat(sector.shareOf(Partner.CHINA)).isEqualTo(0.08);
        assertThat(sector.shareOf(Partner.EU)).isEqualTo(0.15);
        assertThat(sector.shareOf(Partner.OTHER)).isEqualTo(0.15);
        assertThat(sector.topPartner()).isEqualTo(Partner.US);
        assertThat(sector.topPartnerShare()).isEqualTo(0.62);
    }

    @Test
    void sumsRepeatedRowsForSamePartner() {
        List<SectorPartnerExport> rows = List.of(
                new SectorPartnerExport("30", Partner.EU, 300),
                new SectorPartnerExport("30", Partner.EU, 100),
                new SectorPartnerExport("30", Partner.US, 600));

        SectorSummary sector = aggregator.aggregate(rows, id -> "Pharma").get("30");

        assertThat(sector.shareOf(Partner.EU)).isEqualTo(0.4);
        assertThat(sector.topPartner()).isEqualTo(Partner.US);
    }

    @Test
    void zeroTotalYieldsZeroShares() {
        SectorSummary sector = aggregator.aggregate(
                List.of(new SectorPartnerExport("09", Partner.US, 0)), id -> "Spices").get("09");

        assertThat(sector.totalExports()).isZero();
        assertThat(sector.topPartnerShare()).isZero();
        assertThat(sector.partnerShares().values()).containsOnly(0.0);
    }

    @Test
    void tiesGoToEarlierPartner() {
        SectorSummary sector = aggregator.aggregate(List.of(
                new SectorPartnerExport("44", Partner.EU, 50),
                new SectorPartnerExport("44", Partner.CHINA, 50)), id -> "Wood").get("44");

        assertThat(sector.topPartner()).isEqualTo(Partner.CHINA);
        assertThat(sector.topPartnerShare()).isEqualTo(0.5);
    }

    @Test
    void sectorsAreOrderedById() {
        Map<String, SectorSummary> sectors = aggregator.aggregate(List.of(
                new SectorPartnerExport("87", Partner.US, 1),
                new SectorPartnerExport("02", Partner.US, 1),
                new SectorPartnerExport("30", Partner.US, 1)), id -> "S" + id);

        assertThat(sectors.keySet()).containsExactly("02", "30", "87");
    }
}
