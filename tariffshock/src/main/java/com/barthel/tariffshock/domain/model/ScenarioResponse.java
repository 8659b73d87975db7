package com.barthel.tariffshock.domain.model;

import java.util.List;

/**
 * Ranked result of one scenario evaluation.
 *
 * @param scenario the evaluated scenario
 * @param sectors sector results, highest risk first
 * @param biggestMovers leading slice of {@code sectors}
 * @param metadata weights and constants in force
 */
public record ScenarioResponse(
        ScenarioEcho scenario,
        List<SectorRiskOutput> sectors,
        List<SectorRiskOutput> biggestMovers,
        ScenarioMetadata metadata) {

    public ScenarioResponse {
        sectors = List.copyOf(sectors);
        biggestMovers = List.copyOf(biggestMovers);
    }
}
