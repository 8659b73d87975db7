package com.barthel.tariffshock.adapter.in.web.controller;

import com.barthel.tariffshock.adapter.in.web.dto.HealthDto;
import com.barthel.tariffshock.adapter.in.web.dto.RiskConfigDto;
import com.barthel.tariffshock.application.port.in.EvaluateScenarioUseCase;
import com.barthel.tariffshock.application.port.in.QueryReferenceDataUseCase;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class EngineStatusController {

    private final QueryReferenceDataUseCase queryReferenceDataUseCase;
    private final EvaluateScenarioUseCase evaluateScenarioUseCase;

    @GetMapping("/health")
    public HealthDto health() {
        boolean loaded = queryReferenceDataUseCase.isReady();
        return new HealthDto(loaded ? "healthy" : "loading", loaded);
    }

    @GetMapping("/api/config")
    public RiskConfigDto config() {
        return RiskConfigDto.from(evaluateScenarioUseCase.weights());
    }
}
