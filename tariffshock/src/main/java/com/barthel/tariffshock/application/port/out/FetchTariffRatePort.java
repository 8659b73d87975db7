package com.barthel.tariffshock.application.port.out;

import com.barthel.tariffshock.domain.model.Partner;

import java.util.Map;

/**
 * Port for the static tariff schedules partners apply to a sector.
 */
public interface FetchTariffRatePort {
    /**
     * Tariff rate a partner applies to a sector.
     *
     * @param sectorId the HS2 code
     * @param partner the partner imposing the tariff
     * @return the rate in percent, 0 when none is recorded
     */
    double rate(String sectorId, Partner partner);

    /**
     * Every sector with a non-zero rate from at least one partner.
     *
     * @return rates per partner keyed by HS2 code
     */
    Map<String, Map<Partner, Double>> allTariffedSectors();
}
