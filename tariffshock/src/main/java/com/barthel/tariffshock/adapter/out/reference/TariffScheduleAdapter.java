package com.barthel.tariffshock.adapter.out.reference;

import com.barthel.tariffshock.application.port.out.FetchTariffRatePort;
import com.barthel.tariffshock.config.TariffShockProperties;
import com.barthel.tariffshock.domain.model.Partner;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Tariff rates per partner and HS2 sector, read from a YAML table keyed by partner code.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TariffScheduleAdapter implements FetchTariffRatePort {

    static final double DEFAULT_RATE = 0.0;

    private final TariffShockProperties properties;
    private final ReferenceTableReader reader;

    private volatile Map<Partner, Map<String, Double>> schedules = Map.of();

    @PostConstruct
    public void load() {
        String location = properties.getData().getTariffRates();
        Map<String, Map<String, Double>> table =
                reader.readYaml(location, new TypeReference<Map<String, Map<String, Double>>>() {});

        Map<Partner, Map<String, Double>> loaded = new EnumMap<>(Partner.class);
        table.forEach((partnerCode, rates) -> {
            Partner partner = Partner.fromTargetCode(partnerCode);
            Map<String, Double> byHs2 = new HashMap<>();
            if (rates != null) {
                rates.forEach((hs2, rate) -> {
                    if (rate == null || rate < 0) {
                        throw new IllegalStateException("Tariff rate for " + partnerCode + "/" + hs2 + " must be >= 0");
                    }
                    byHs2.put(TradeDatasetAdapter.normalizeHs2(hs2), rate);
                });
            }
            loaded.put(partner, Collections.unmodifiableMap(byHs2));
        });
        schedules = Collections.unmodifiableMap(loaded);
        log.info("Loaded tariff schedules for {} partners covering {} tariffed sectors from {}",
                schedules.size(), allTariffedSectors().size(), location);
    }

    @Override
    public double rate(String sectorId, Partner partner) {
        if (sectorId == null || partner == null) {
            return DEFAULT_RATE;
        }
        return schedules.getOrDefault(partner, Map.of()).getOrDefault(sectorId, DEFAULT_RATE);
    }

    @Override
    public Map<String, Map<Partner, Double>> allTariffedSectors() {
        Map<String, Map<Partner, Double>> result = new TreeMap<>();
        schedules.forEach((partner, rates) -> rates.forEach((hs2, rate) -> {
            if (rate > 0) {
                result.computeIfAbsent(hs2, id -> emptyRates()).put(partner, rate);
            }
        }));
        return Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    private static Map<Partner, Double> emptyRates() {
        Map<Partner, Double> rates = new EnumMap<>(Partner.class);
        for (Partner partner : Partner.selectable()) {
            rates.put(partner, 0.0);
        }
        return rates;
    }
}
