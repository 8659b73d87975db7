package com.barthel.tariffshock.application.service;

import com.barthel.tariffshock.application.port.in.CompareScenariosUseCase;
import com.barthel.tariffshock.application.port.in.EvaluateScenarioUseCase;
import com.barthel.tariffshock.domain.model.ComparisonRecord;
import com.barthel.tariffshock.domain.model.ComparisonResponse;
import com.barthel.tariffshock.domain.model.EvaluationMode;
import com.barthel.tariffshock.domain.model.ScenarioEcho;
import com.barthel.tariffshock.domain.model.ScenarioInput;
import com.barthel.tariffshock.domain.model.ScenarioResponse;
import com.barthel.tariffshock.domain.model.SectorRiskOutput;
import com.barthel.tariffshock.domain.service.RiskScoringCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a baseline and a shock scenario over the same sectors and reports the risk change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScenarioComparisonService implements CompareScenariosUseCase {

    static final int TOP_GAINERS = 5;

    private final EvaluateScenarioUseCase evaluateScenarioUseCase;

    @Override
    public ComparisonResponse compare(ScenarioInput baseline, ScenarioInput shock, List<String> sectorFilter) {
        ScenarioInput baselineScenario = baseline.withSectorFilter(sectorFilter);
        ScenarioInput shockScenario = shock.withSectorFilter(sectorFilter);

        ScenarioResponse baselineResponse = evaluateScenarioUseCase.evaluate(baselineScenario);
        ScenarioResponse shockResponse = evaluateScenarioUseCase.evaluate(shockScenario);

        Map<String, Double> baselineRisk = new HashMap<>();
        for (SectorRiskOutput sector : baselineResponse.sectors()) {
            baselineRisk.put(sector.sectorId(), sector.riskScore());
        }

        List<ComparisonRecord> comparison = new ArrayList<>(shockResponse.sectors().size());
        for (SectorRiskOutput sector : shockResponse.sectors()) {
            double before = baselineRisk.getOrDefault(sector.sectorId(), 0.0);
            comparison.add(new ComparisonRecord(
                    sector.sectorId(),
                    sector.sectorName(),
                    before,
                    sector.riskScore(),
                    RiskScoringCalculator.round(sector.riskScore() - before, 1),
                    sector.affectedExportValue(),
                    sector.topPartner(),
                    sector.dependencyPercent()));
        }
        comparison.sort(Comparator.comparingDouble(ComparisonRecord::riskChange).reversed());

        log.debug("Compared {} sectors", comparison.size());
        return new ComparisonResponse(
                ScenarioEcho.of(EvaluationMode.BASELINE, baselineScenario),
                ScenarioEcho.of(EvaluationMode.SCENARIO, shockScenario),
                comparison,
                comparison.subList(0, Math.min(TOP_GAINERS, comparison.size())),
                comparison.size());
    }
}
