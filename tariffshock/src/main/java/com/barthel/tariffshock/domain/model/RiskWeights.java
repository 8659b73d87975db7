package com.barthel.tariffshock.domain.model;

/**
 * Weights and normalisation constant used to compose a risk score.
 *
 * @param wExposure weight of the exposure term
 * @param wConcentration weight of the concentration term
 * @param maxTariffPercent tariff rate that maps to a shock of 1
 */
public record RiskWeights(double wExposure, double wConcentration, double maxTariffPercent) {

    public static final RiskWeights DEFAULT = new RiskWeights(0.6, 0.4, 25.0);

    private static final double SUM_TOLERANCE = 1e-9;

    public RiskWeights {
        if (!(wExposure >= 0.0 && wExposure <= 1.0)) {
            throw new IllegalArgumentException("w_exposure must be in [0, 1], got " + wExposure);
        }
        if (!(wConcentration >= 0.0 && wConcentration <= 1.0)) {
            throw new IllegalArgumentException("w_concentration must be in [0, 1], got " + wConcentration);
        }
        if (Math.abs(wExposure + wConcentration - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException(
                    "w_exposure + w_concentration must equal 1.0, got " + (wExposure + wConcentration));
        }
        if (!(maxTariffPercent > 0.0) || Double.isInfinite(maxTariffPercent)) {
            throw new IllegalArgumentException("max_tariff_percent must be > 0, got " + maxTariffPercent);
        }
    }
}
