package org.carball.beamcheck.model.assessment;

/**
 * Factored resistance of the member after condition and safety factors.
 *
 * @param momentCapacity kNm
 * @param shearCapacity  kN
 * @param method         short name of the resistance method used
 */
public record Capacity(double momentCapacity, double shearCapacity, String method) {}
