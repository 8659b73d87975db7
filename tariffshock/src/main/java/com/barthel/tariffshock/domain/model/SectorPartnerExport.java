package com.barthel.tariffshock.domain.model;

/**
 * Aggregated export value of one HS2 sector towards one partner bucket.
 *
 * @param sectorId HS2 code
 * @param partner the partner bucket
 * @param exportValue summed export value, never negative
 */
public record SectorPartnerExport(String sectorId, Partner partner, double exportValue) {
    public SectorPartnerExport {
        if (sectorId == null || sectorId.isBlank()) {
            throw new IllegalArgumentException("sector_id is required");
        }
        if (partner == null) {
            throw new IllegalArgumentException("partner is required");
        }
        if (exportValue < 0 || Double.isNaN(exportValue)) {
            throw new IllegalArgumentException("export_value must be >= 0, got " + exportValue);
        }
    }
}
