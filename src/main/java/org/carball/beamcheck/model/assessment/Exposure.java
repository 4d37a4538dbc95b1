package org.carball.beamcheck.model.assessment;

import java.util.Locale;

/**
 * Service class of a timber member with its K2 modification factors.
 */
public enum Exposure {
    DRY(1.0, 1.0),
    WET(0.8, 0.9);

    private final double bendingFactor;
    private final double shearFactor;

    Exposure(double bendingFactor, double shearFactor) {
        this.bendingFactor = bendingFactor;
        this.shearFactor = shearFactor;
    }

    public double getBendingFactor() {
        return bendingFactor;
    }

    public double getShearFactor() {
        return shearFactor;
    }

    public static Exposure fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown exposure: " + name + ". Use dry or wet");
        }
    }
}
