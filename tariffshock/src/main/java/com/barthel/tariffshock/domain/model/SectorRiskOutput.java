package com.barthel.tariffshock.domain.model;

/**
 * Risk of one sector under one scenario.
 *
 * @param sectorId HS2 code
 * @param sectorName sector label
 * @param exposure share of exports towards the targeted partners, in [0, 1]
 * @param concentration share of the sector's top partner, in [0, 1]
 * @param shock normalised tariff severity, in [0, 1]
 * @param riskScore composite score in [0, 100], one decimal
 * @param dependencyPercent top partner share as a percentage
 * @param affectedExportValue export value hit by the tariff
 * @param topPartner the sector's largest partner
 * @param riskDelta change against the zero-tariff baseline
 * @param appliedTariffPercent tariff rate that produced {@code shock}
 * @param explainability how the score was composed
 */
public record SectorRiskOutput(
        String sectorId,
        String sectorName,
        double exposure,
        double concentration,
        double shock,
        double riskScore,
        double dependencyPercent,
        double affectedExportValue,
        Partner topPartner,
        double riskDelta,
        double appliedTariffPercent,
        ExplainabilityBreakdown explainability) {
}
