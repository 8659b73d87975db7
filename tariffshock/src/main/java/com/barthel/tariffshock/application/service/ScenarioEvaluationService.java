package com.barthel.tariffshock.application.service;

import com.barthel.tariffshock.application.exception.ReferenceDataUnavailableException;
import com.barthel.tariffshock.application.port.in.EvaluateScenarioUseCase;
import com.barthel.tariffshock.application.port.out.FetchTariffRatePort;
import com.barthel.tariffshock.application.port.out.LoadSectorCatalogPort;
import com.barthel.tariffshock.domain.model.EvaluationMode;
import com.barthel.tariffshock.domain.model.Partner;
import com.barthel.tariffshock.domain.model.RiskWeights;
import com.barthel.tariffshock.domain.model.ScenarioEcho;
import com.barthel.tariffshock.domain.model.ScenarioInput;
import com.barthel.tariffshock.domain.model.ScenarioMetadata;
import com.barthel.tariffshock.domain.model.ScenarioResponse;
import com.barthel.tariffshock.domain.model.SectorRiskOutput;
import com.barthel.tariffshock.domain.model.SectorSummary;
import com.barthel.tariffshock.domain.service.RiskScoringCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Scores a set of sectors under one scenario and ranks them by risk.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScenarioEvaluationService implements EvaluateScenarioUseCase {

    static final int TOP_MOVERS = 5;

    private static final Comparator<SectorRiskOutput> BY_RISK_DESC =
            Comparator.comparingDouble(SectorRiskOutput::riskScore).reversed();

    private final LoadSectorCatalogPort sectorCatalogPort;
    private final FetchTariffRatePort tariffRatePort;
    private final RiskScoringCalculator calculator;

    @Override
    public ScenarioResponse evaluate(ScenarioInput scenario) {
        return run(EvaluationMode.SCENARIO, scenario, sector -> scenario.tariffPercent());
    }

    @Override
    public ScenarioResponse evaluateBaseline(List<String> sectorFilter) {
        return run(EvaluationMode.BASELINE, ScenarioInput.baseline(sectorFilter), sector -> 0.0);
    }

    @Override
    public ScenarioResponse evaluateActualTariffs(Collection<Partner> targetPartners, List<String> sectorFilter) {
        Set<Partner> partners = targetPartners == null || targetPartners.isEmpty()
                ? EnumSet.noneOf(Partner.class)
                : EnumSet.copyOf(targetPartners);
        ScenarioInput scenario = new ScenarioInput(0.0, partners, sectorFilter);
        ScenarioEcho echo = new ScenarioEcho(EvaluationMode.ACTUAL_TARIFFS, null, scenario.targetPartners(), scenario.sectorFilter());
        return run(echo, scenario, sector -> maxRate(sector.sectorId(), partners));
    }

    @Override
    public RiskWeights weights() {
        return calculator.weights();
    }

    /**
     * Scores one sector at the given tariff rate against the scenario's target partners.
     */
    SectorRiskOutput scoreSector(SectorSummary sector, Set<Partner> targetPartners, double tariffPercent) {
        double exposure = calculator.exposure(sector, targetPartners);
        double concentration = calculator.concentration(sector);
        double shock = calculator.shock(tariffPercent);
        double riskScore = calculator.riskScore(exposure, concentration, shock);
        double baselineRisk = calculator.riskScore(exposure, concentration, calculator.shock(0.0));

        return new SectorRiskOutput(
                sector.sectorId(),
                sector.sectorName(),
                exposure,
                concentration,
                shock,
                riskScore,
                calculator.dependencyPercent(sector),
                calculator.affectedExportValue(sector.totalExports(), exposure, shock),
                sector.topPartner(),
                RiskScoringCalculator.round(riskScore - baselineRisk, 1),
                tariffPercent,
                calculator.explain(exposure, concentration, shock));
    }

    private ScenarioResponse run(EvaluationMode mode, ScenarioInput scenario, ToDoubleFunction<SectorSummary> tariffFor) {
        return run(ScenarioEcho.of(mode, scenario), scenario, tariffFor);
    }

    private ScenarioResponse run(ScenarioEcho echo, ScenarioInput scenario, ToDoubleFunction<SectorSummary> tariffFor) {
        List<SectorSummary> candidates = resolveCandidates(scenario.sectorFilter());

        List<SectorRiskOutput> results = new ArrayList<>(candidates.size());
        for (SectorSummary sector : candidates) {
            results.add(scoreSector(sector, scenario.targetPartners(), tariffFor.applyAsDouble(sector)));
        }
        results.sort(BY_RISK_DESC);

        log.debug("Evaluated {} sectors in mode={} partners={}", results.size(), echo.mode().label(), scenario.targetPartners());
        return new ScenarioResponse(
                echo,
                results,
                results.subList(0, Math.min(TOP_MOVERS, results.size())),
                ScenarioMetadata.of(calculator.weights(), results.size()));
    }

    private List<SectorSummary> resolveCandidates(List<String> sectorFilter) {
        if (!sectorCatalogPort.isLoaded()) {
            throw new ReferenceDataUnavailableException("Reference data is not loaded yet");
        }
        Map<String, SectorSummary> sectors = sectorCatalogPort.allSectors();
        if (sectorFilter == null) {
            return new ArrayList<>(sectors.values());
        }
        Set<String> wanted = new HashSet<>(sectorFilter);
        List<SectorSummary> candidates = new ArrayList<>();
        for (SectorSummary sector : sectors.values()) {
            if (wanted.contains(sector.sectorId())) {
                candidates.add(sector);
            }
        }
        return candidates;
    }

    private double maxRate(String sectorId, Set<Partner> partners) {
        double max = 0.0;
        for (Partner partner : partners) {
            max = Math.max(max, tariffRatePort.rate(sectorId, partner));
        }
        return max;
    }
}
