package com.barthel.tariffshock.domain.model;

public record ScenarioMetadata(double wExposure, double wConcentration, double maxTariffPercent, int totalSectors) {

    public static ScenarioMetadata of(RiskWeights weights, int totalSectors) {
        return new ScenarioMetadata(weights.wExposure(), weights.wConcentration(), weights.maxTariffPercent(), totalSectors);
    }
}
