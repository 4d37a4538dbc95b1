package org.carball.beamcheck.model.assessment;

/**
 * Restraint multipliers on the unrestrained length: k1 for support rotation, k2 for the height
 * at which load is applied.
 */
public record EffectiveLengthFactors(double k1, double k2) {

    public static EffectiveLengthFactors unity() {
        return new EffectiveLengthFactors(1.0, 1.0);
    }
}
