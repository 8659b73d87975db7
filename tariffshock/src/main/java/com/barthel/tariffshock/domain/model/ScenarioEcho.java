package com.barthel.tariffshock.domain.model;

import java.util.List;
import java.util.Set;

/**
 * The scenario a response was computed for.
 *
 * @param mode how the tariff rate was chosen
 * @param tariffPercent uniform tariff rate, {@code null} when rates come from the tariff tables
 * @param targetPartners partners imposing the tariff
 * @param sectorFilter requested sector ids, {@code null} for all sectors
 */
public record ScenarioEcho(EvaluationMode mode, Double tariffPercent, Set<Partner> targetPartners, List<String> sectorFilter) {

    public static ScenarioEcho of(EvaluationMode mode, ScenarioInput input) {
        return new ScenarioEcho(mode, input.tariffPercent(), input.targetPartners(), input.sectorFilter());
    }
}
