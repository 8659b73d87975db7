package com.barthel.tariffshock.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Trade profile of one HS2 sector, built once when reference data is loaded.
 *
 * @param sectorId two-digit HS2 code
 * @param sectorName human-readable label
 * @param totalExports total export value across all partners
 * @param partnerShares share of exports per partner bucket, each in [0, 1]
 * @param topPartner partner with the largest share
 * @param topPartnerShare share of the top partner, in [0, 1]
 */
public record SectorSummary(
        String sectorId,
        String sectorName,
        double totalExports,
        Map<Partner, Double> partnerShares,
        Partner topPartner,
        double topPartnerShare) {

    public SectorSummary {
        if (sectorId == null || sectorId.isBlank()) {
            throw new IllegalArgumentException("sector_id is required");
        }
        if (sectorName == null || sectorName.isBlank()) {
            throw new IllegalArgumentException("sector_name is required");
        }
        if (totalExports < 0 || Double.isNaN(totalExports)) {
            throw new IllegalArgumentException("total_exports must be >= 0, got " + totalExports);
        }
        if (topPartner == null) {
            throw new IllegalArgumentException("top_partner is required");
        }
        if (!(topPartnerShare >= 0.0 && topPartnerShare <= 1.0)) {
            throw new IllegalArgumentException("top_partner_share must be in [0, 1], got " + topPartnerShare);
        }
        EnumMap<Partner, Double> shares = new EnumMap<>(Partner.class);
        if (partnerShares != null) {
            partnerShares.forEach((partner, share) -> {
                if (partner == null) {
                    throw new IllegalArgumentException("partner_shares must not contain a null partner");
                }
                if (share == null || !(share >= 0.0 && share <= 1.0)) {
                    throw new IllegalArgumentException("partner share for " + partner.code() + " must be in [0, 1], got " + share);
                }
                shares.put(partner, share);
            });
        }
        partnerShares = Collections.unmodifiableMap(shares);
    }

    /**
     * Share of exports going to the given partner, 0 when the partner is not listed.
     */
    public double shareOf(Partner partner) {
        return partnerShares.getOrDefault(partner, 0.0);
    }
}
