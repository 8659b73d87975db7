package com.barthel.tariffshock.adapter.in.web.controller;

import com.barthel.tariffshock.adapter.in.web.dto.CompareRequestDto;
import com.barthel.tariffshock.adapter.in.web.dto.ScenarioRequestDto;
import com.barthel.tariffshock.adapter.in.web.dto.ScenarioSpecDto;
import com.barthel.tariffshock.application.port.in.CompareScenariosUseCase;
import com.barthel.tariffshock.application.port.in.EvaluateScenarioUseCase;
import com.barthel.tariffshock.domain.model.ComparisonResponse;
import com.barthel.tariffshock.domain.model.Partner;
import com.barthel.tariffshock.domain.model.ScenarioInput;
import com.barthel.tariffshock.domain.model.ScenarioResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.EnumSet;
import java.util.Set;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ScenarioController {

    private final EvaluateScenarioUseCase evaluateScenarioUseCase;
    private final CompareScenariosUseCase compareScenariosUseCase;

    @GetMapping("/baseline")
    public ScenarioResponse baseline(@RequestParam(required = false) String sectors) {
        return evaluateScenarioUseCase.evaluateBaseline(RequestParams.sectorFilter(sectors));
    }

    @PostMapping("/scenario")
    public ScenarioResponse scenario(@Valid @RequestBody ScenarioRequestDto request) {
        ScenarioInput scenario = new ScenarioInput(
                request.tariffPercent(),
                RequestParams.targetPartners(request.targetPartners()),
                request.sectorFilter());
        return evaluateScenarioUseCase.evaluate(scenario);
    }

    @PostMapping("/compare")
    public ComparisonResponse compare(@Valid @RequestBody CompareRequestDto request) {
        ScenarioInput baseline = request.baseline() == null
                ? ScenarioInput.baseline(null)
                : toScenario(request.baseline());
        return compareScenariosUseCase.compare(baseline, toScenario(request.scenario()), request.sectorFilter());
    }

    @GetMapping("/actual-tariffs")
    public ScenarioResponse actualTariffs(
            @RequestParam(defaultValue = "US") String partners,
            @RequestParam(required = false) String sectors
    ) {
        Set<Partner> targets = RequestParams.targetPartnersOrSkip(partners);
        if (targets.isEmpty()) {
            targets = EnumSet.of(Partner.US);
        }
        return evaluateScenarioUseCase.evaluateActualTariffs(targets, RequestParams.sectorFilter(sectors));
    }

    private static ScenarioInput toScenario(ScenarioSpecDto spec) {
        double tariff = spec.tariffPercent() == null ? 0.0 : spec.tariffPercent();
        return new ScenarioInput(tariff, RequestParams.targetPartners(spec.targetPartners()), null);
    }
}
