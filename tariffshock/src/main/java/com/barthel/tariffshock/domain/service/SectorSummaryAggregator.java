package com.barthel.tariffshock.domain.service;

import com.barthel.tariffshock.domain.model.Partner;
import com.barthel.tariffshock.domain.model.SectorPartnerExport;
import com.barthel.tariffshock.domain.model.SectorSummary;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Builds {@link SectorSummary} values from per-partner export totals.
 */
public class SectorSummaryAggregator {

    /**
     * @param exports export rows, several rows for the same sector and partner are summed
     * @param sectorNames resolves an HS2 code to its label
     * @return summaries keyed by sector id, in ascending id order
     */
    public Map<String, SectorSummary> aggregate(Collection<SectorPartnerExport> exports,
                                                Function<String, String> sectorNames) {
        Map<String, EnumMap<Partner, Double>> valuesBySector = new TreeMap<>();
        for (SectorPartnerExport row : exports) {
            valuesBySector
                    .computeIfAbsent(row.sectorId(), id -> new EnumMap<>(Partner.class))
                    .merge(row.partner(), row.exportValue(), Double::sum);
        }

        Map<String, SectorSummary> summaries = new LinkedHashMap<>();
        valuesBySector.forEach((sectorId, values) ->
                summaries.put(sectorId, summarize(sectorId, sectorNames.apply(sectorId), values)));
        return Collections.unmodifiableMap(summaries);
    }

    SectorSummary summarize(String sectorId, String sectorName, Map<Partner, Double> values) {
        double total = 0.0;
        for (Partner partner : Partner.values()) {
            total += values.getOrDefault(partner, 0.0);
        }

        EnumMap<Partner, Double> shares = new EnumMap<>(Partner.class);
        Partner top = Partner.US;
        double topShare = -1.0;
        for (Partner partner : Partner.values()) {
            double share = total > 0 ? Math.min(1.0, values.getOrDefault(partner, 0.0) / total) : 0.0;
            shares.put(partner, share);
            if (share > topShare) {
                top = partner;
                topShare = share;
            }
        }
        return new SectorSummary(sectorId, sectorName, total, shares, top, topShare);
    }
}
