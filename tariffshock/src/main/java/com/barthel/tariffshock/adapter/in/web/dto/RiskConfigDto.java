package com.barthel.tariffshock.adapter.in.web.dto;

import com.barthel.tariffshock.domain.model.RiskWeights;

public record RiskConfigDto(
        double wExposure,
        double wConcentration,
        double maxTariffPercent,
        String riskFormula,
        String shockFormula) {

    public static RiskConfigDto from(RiskWeights weights) {
        return new RiskConfigDto(
                weights.wExposure(),
                weights.wConcentration(),
                weights.maxTariffPercent(),
                "risk = (w_exposure * exposure + w_concentration * concentration) * shock",
                "shock = tariff_percent / " + weights.maxTariffPercent());
    }
}
