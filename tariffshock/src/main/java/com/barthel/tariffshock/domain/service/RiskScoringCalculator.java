package com.barthel.tariffshock.domain.service;

import com.barthel.tariffshock.domain.model.ExplainabilityBreakdown;
import com.barthel.tariffshock.domain.model.Partner;
import com.barthel.tariffshock.domain.model.RiskWeights;
import com.barthel.tariffshock.domain.model.SectorSummary;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Pure scoring primitives.
 * <p>
 * {@code risk = round((wExposure * exposure + wConcentration * concentration) * shock * 100, 1)}
 * where {@code shock = tariff / maxTariffPercent}. Every intermediate value is clamped to its
 * range so noisy upstream shares can never push an output out of bounds.
 */
public class RiskScoringCalculator {

    private final RiskWeights weights;

    public RiskScoringCalculator(RiskWeights weights) {
        if (weights == null) {
            throw new IllegalArgumentException("Risk weights are required");
        }
        this.weights = weights;
    }

    public RiskWeights weights() {
        return weights;
    }

    /**
     * Sum of the sector's shares towards the targeted partners, clamped to [0, 1].
     */
    public double exposure(SectorSummary sector, Collection<Partner> targetPartners) {
        double total = 0.0;
        for (Partner partner : targetPartners) {
            total += sector.shareOf(partner);
        }
        return clamp(total, 0.0, 1.0);
    }

    public double concentration(SectorSummary sector) {
        return clamp(sector.topPartnerShare(), 0.0, 1.0);
    }

    public double shock(double tariffPercent) {
        return clamp(tariffPercent / weights.maxTariffPercent(), 0.0, 1.0);
    }

    public double riskScore(double exposure, double concentration, double shock) {
        double raw = (weights.wExposure() * exposure + weights.wConcentration() * concentration) * shock;
        return clamp(round(raw * 100, 1), 0.0, 100.0);
    }

    public double affectedExportValue(double totalExports, double exposure, double shock) {
        return totalExports * exposure * shock;
    }

    public double dependencyPercent(SectorSummary sector) {
        return clamp(round(sector.topPartnerShare() * 100, 1), 0.0, 100.0);
    }

    public ExplainabilityBreakdown explain(double exposure, double concentration, double shock) {
        return new ExplainabilityBreakdown(
                exposure,
                concentration,
                shock,
                weights.wExposure() * exposure,
                weights.wConcentration() * concentration);
    }

    /**
     * Rounds the exact binary value of {@code value} half-even, so results do not depend on
     * how the double happens to print.
     */
    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
