package com.barthel.tariffshock.domain.model;

/**
 * Raw inputs and weighted terms behind one risk score.
 */
public record ExplainabilityBreakdown(
        double exposureValue,
        double concentrationValue,
        double shockValue,
        double exposureComponent,
        double concentrationComponent) {
}
