package com.barthel.tariffshock.application.port.in;

import com.barthel.tariffshock.domain.model.Partner;
import com.barthel.tariffshock.domain.model.RiskWeights;
import com.barthel.tariffshock.domain.model.ScenarioInput;
import com.barthel.tariffshock.domain.model.ScenarioResponse;

import java.util.Collection;
import java.util.List;

/**
 * Use case for scoring sectors under a tariff scenario.
 */
public interface EvaluateScenarioUseCase {
    /**
     * Score every candidate sector under a uniform tariff.
     *
     * @param scenario the scenario to evaluate
     * @return sectors ranked by risk
     */
    ScenarioResponse evaluate(ScenarioInput scenario);

    /**
     * Score sectors under a zero tariff with no target partners.
     *
     * @param sectorFilter sector ids to include, {@code null} for all
     * @return sectors with zero risk
     */
    ScenarioResponse evaluateBaseline(List<String> sectorFilter);

    /**
     * Score sectors using each sector's recorded tariff rate, taking the highest rate among
     * the targeted partners.
     *
     * @param targetPartners partners whose tariff schedules apply
     * @param sectorFilter sector ids to include, {@code null} for all
     * @return sectors ranked by risk
     */
    ScenarioResponse evaluateActualTariffs(Collection<Partner> targetPartners, List<String> sectorFilter);

    /**
     * @return weights and constants currently in force
     */
    RiskWeights weights();
}
