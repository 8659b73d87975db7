package com.barthel.tariffshock.adapter.in.web.dto;

import com.barthel.tariffshock.application.port.in.QueryReferenceDataUseCase.TariffedSector;

import java.util.LinkedHashMap;
import java.util.Map;

public record TariffRateDto(String hs2, String sectorName, Map<String, Double> tariffRates, double maxTariff) {

    public static TariffRateDto from(TariffedSector sector) {
        Map<String, Double> rates = new LinkedHashMap<>();
        sector.tariffRates().forEach((partner, rate) -> rates.put(partner.code(), rate));
        return new TariffRateDto(sector.hs2(), sector.sectorName(), rates, sector.maxTariff());
    }
}
