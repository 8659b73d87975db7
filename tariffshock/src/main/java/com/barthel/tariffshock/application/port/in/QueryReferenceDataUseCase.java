package com.barthel.tariffshock.application.port.in;

import com.barthel.tariffshock.domain.model.Partner;
import com.barthel.tariffshock.domain.model.SectorSummary;

import java.util.List;
import java.util.Map;

/**
 * Read-only access to the loaded sector profiles and tariff schedules.
 */
public interface QueryReferenceDataUseCase {

    List<SectorSummary> listSectors();

    /**
     * @param sectorId the HS2 code
     * @return the sector
     * @throws com.barthel.tariffshock.application.exception.SectorNotFoundException if unknown
     */
    SectorSummary getSector(String sectorId);

    /**
     * Tariffed sectors with their rates, highest maximum rate first.
     */
    List<TariffedSector> tariffedSectors();

    boolean isReady();

    record TariffedSector(String hs2, String sectorName, Map<Partner, Double> tariffRates, double maxTariff) {}
}
