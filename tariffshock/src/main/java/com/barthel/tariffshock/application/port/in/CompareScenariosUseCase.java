package com.barthel.tariffshock.application.port.in;

import com.barthel.tariffshock.domain.model.ComparisonResponse;
import com.barthel.tariffshock.domain.model.ScenarioInput;

import java.util.List;

/**
 * Use case for measuring how a shock scenario moves risk relative to a baseline.
 */
public interface CompareScenariosUseCase {
    /**
     * Evaluate both scenarios over the same sectors and diff them.
     *
     * @param baseline the reference scenario
     * @param shock the scenario being measured
     * @param sectorFilter sector ids applied to both scenarios, {@code null} for all
     * @return per-sector risk changes, largest increase first
     */
    ComparisonResponse compare(ScenarioInput baseline, ScenarioInput shock, List<String> sectorFilter);
}
