package com.barthel.tariffshock.adapter.out.reference;

import com.barthel.tariffshock.application.port.out.LoadSectorCatalogPort;
import com.barthel.tariffshock.config.TariffShockProperties;
import com.barthel.tariffshock.domain.model.Partner;
import com.barthel.tariffshock.domain.model.SectorPartnerExport;
import com.barthel.tariffshock.domain.model.SectorSummary;
import com.barthel.tariffshock.domain.service.SectorSummaryAggregator;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the sector catalog from the aggregated per-country export dataset.
 * <p>
 * The dataset is a CSV with header {@code hs2,country,export_value}. Countries are folded into
 * partner buckets through the partner-country table; anything unmapped lands in {@link Partner#OTHER}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TradeDatasetAdapter implements LoadSectorCatalogPort {

    private static final String HEADER = "hs2,country,export_value";

    private final TariffShockProperties properties;
    private final ReferenceTableReader reader;
    private final SectorSummaryAggregator aggregator;

    private volatile Map<String, SectorSummary> sectors = Map.of();
    private volatile boolean loaded;

    @PostConstruct
    public void load() {
        TariffShockProperties.Sources sources = properties.getData();
        Map<String, String> sectorNames = reader.readYaml(sources.getSectorNames(), new TypeReference<Map<String, String>>() {});
        Map<String, Partner> countryPartners = countryPartners(sources.getPartnerCountries());
        List<SectorPartnerExport> rows = parseExports(sources.getPartnerExports(), countryPartners);

        sectors = aggregator.aggregate(rows, id -> sectorNames.getOrDefault(id, "Sector " + id));
        loaded = true;
        log.info("Loaded {} sectors from {} export rows ({} mapped countries)",
                sectors.size(), rows.size(), countryPartners.size());
    }

    @Override
    public Optional<SectorSummary> findSector(String sectorId) {
        if (sectorId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sectors.get(sectorId));
    }

    @Override
    public Map<String, SectorSummary> allSectors() {
        return sectors;
    }

    @Override
    public boolean isLoaded() {
        return loaded;
    }

    private Map<String, Partner> countryPartners(String location) {
        Map<String, List<String>> table = reader.readYaml(location, new TypeReference<Map<String, List<String>>>() {});
        Map<String, Partner> byCountry = new HashMap<>();
        table.forEach((partnerCode, countries) -> {
            Partner partner = Partner.fromTargetCode(partnerCode);
            for (String country : countries) {
                Partner previous = byCountry.put(country.trim().toUpperCase(), partner);
                if (previous != null && previous != partner) {
                    throw new IllegalStateException("Country " + country + " mapped to both "
                            + previous.code() + " and " + partner.code());
                }
            }
        });
        return byCountry;
    }

    List<SectorPartnerExport> parseExports(String location, Map<String, Partner> countryPartners) {
        List<String> lines = reader.readLines(location);
        List<SectorPartnerExport> rows = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || (i == 0 && line.equalsIgnoreCase(HEADER))) {
                continue;
            }
            String[] cols = line.split(",", -1);
            if (cols.length < 3) {
                throw new IllegalStateException("Malformed export row " + (i + 1) + " in " + location + ": " + line);
            }
            String hs2 = normalizeHs2(cols[0]);
            Partner partner = countryPartners.getOrDefault(cols[1].trim().toUpperCase(), Partner.OTHER);
            rows.add(new SectorPartnerExport(hs2, partner, parseValue(cols[2], i + 1)));
        }
        return rows;
    }

    static String normalizeHs2(String raw) {
        String hs2 = raw.trim();
        if (hs2.length() == 1) {
            return "0" + hs2;
        }
        return hs2;
    }

    private static double parseValue(String raw, int lineNumber) {
        String value = raw.trim();
        if (value.isEmpty()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            log.debug("Unparsable export value '{}' on line {}, counting as 0", value, lineNumber);
            return 0.0;
        }
    }
}
