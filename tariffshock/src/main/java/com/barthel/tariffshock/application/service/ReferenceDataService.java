package com.barthel.tariffshock.application.service;

import com.barthel.tariffshock.application.exception.SectorNotFoundException;
import com.barthel.tariffshock.application.port.in.QueryReferenceDataUseCase;
import com.barthel.tariffshock.application.port.out.FetchTariffRatePort;
import com.barthel.tariffshock.application.port.out.LoadSectorCatalogPort;
import com.barthel.tariffshock.domain.model.Partner;
import com.barthel.tariffshock.domain.model.SectorSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class ReferenceDataService implements QueryReferenceDataUseCase {

    private final LoadSectorCatalogPort sectorCatalogPort;
    private final FetchTariffRatePort tariffRatePort;

    @Override
    public List<SectorSummary> listSectors() {
        return List.copyOf(sectorCatalogPort.allSectors().values());
    }

    @Override
    public SectorSummary getSector(String sectorId) {
        return sectorCatalogPort.findSector(sectorId)
                .orElseThrow(() -> new SectorNotFoundException(sectorId));
    }

    @Override
    public List<TariffedSector> tariffedSectors() {
        List<TariffedSector> result = new ArrayList<>();
        for (Map.Entry<String, Map<Partner, Double>> entry : tariffRatePort.allTariffedSectors().entrySet()) {
            String hs2 = entry.getKey();
            Map<Partner, Double> rates = entry.getValue();
            String name = sectorCatalogPort.findSector(hs2)
                    .map(SectorSummary::sectorName)
                    .orElse("Sector " + hs2);
            double max = rates.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            result.add(new TariffedSector(hs2, name, rates, max));
        }
        result.sort(Comparator.comparingDouble(TariffedSector::maxTariff).reversed());
        return result;
    }

    @Override
    public boolean isReady() {
        return sectorCatalogPort.isLoaded();
    }
}
