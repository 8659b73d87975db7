package com.barthel.tariffshock.domain.model;

import java.util.List;

/**
 * Result of comparing a baseline scenario with a shock scenario.
 *
 * @param baselineScenario the reference scenario
 * @param shockScenario the scenario being measured
 * @param comparison per-sector records, largest risk increase first
 * @param biggestGainers leading slice of {@code comparison}
 * @param totalSectors number of compared sectors
 */
public record ComparisonResponse(
        ScenarioEcho baselineScenario,
        ScenarioEcho shockScenario,
        List<ComparisonRecord> comparison,
        List<ComparisonRecord> biggestGainers,
        int totalSectors) {

    public ComparisonResponse {
        comparison = List.copyOf(comparison);
        biggestGainers = List.copyOf(biggestGainers);
    }
}
