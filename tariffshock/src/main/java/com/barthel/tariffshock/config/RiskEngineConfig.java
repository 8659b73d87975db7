package com.barthel.tariffshock.config;

import com.barthel.tariffshock.domain.model.RiskWeights;
import com.barthel.tariffshock.domain.service.RiskScoringCalculator;
import com.barthel.tariffshock.domain.service.SectorSummaryAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class RiskEngineConfig {

    @Bean
    public RiskWeights riskWeights(TariffShockProperties properties) {
        TariffShockProperties.Weights cfg = properties.getWeights();
        RiskWeights weights = new RiskWeights(cfg.getExposure(), cfg.getConcentration(), cfg.getMaxTariffPercent());
        log.info("Risk weights: exposure={}, concentration={}, maxTariffPercent={}",
                weights.wExposure(), weights.wConcentration(), weights.maxTariffPercent());
        return weights;
    }

    @Bean
    public RiskScoringCalculator riskScoringCalculator(RiskWeights riskWeights) {
        return new RiskScoringCalculator(riskWeights);
    }

    @Bean
    public SectorSummaryAggregator sectorSummaryAggregator() {
        return new SectorSummaryAggregator();
    }
}
