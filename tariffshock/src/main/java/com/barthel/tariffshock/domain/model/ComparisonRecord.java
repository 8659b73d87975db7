package com.barthel.tariffshock.domain.model;

/**
 * Baseline versus shock risk of one sector.
 */
public record ComparisonRecord(
        String sectorId,
        String sectorName,
        double baselineRisk,
        double scenarioRisk,
        double riskChange,
        double affectedExportValue,
        Partner topPartner,
        double dependencyPercent) {
}
