package org.carball.beamcheck.model.assessment;

/**
 * @param actualLength    unrestrained length in m
 * @param effectiveLength k1·k2·actualLength in m
 * @param slenderness     effective length over minor-axis radius of gyration; zero when not applicable
 * @param reductionFactor lateral-torsional buckling reduction applied to bending capacity
 */
public record EffectiveLength(
        double actualLength,
        double effectiveLength,
        double slenderness,
        double reductionFactor
) {}
