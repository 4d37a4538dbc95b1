package org.carball.beamcheck.catalog;

/**
 * Lateral-torsional buckling reduction factor against slenderness L_e / r_y. Linear
 * interpolation between points; held at the last value beyond the end of the table.
 */
public final class SlendernessCurve {

    private static final double[] SLENDERNESS = {0, 40, 60, 80, 100, 120, 150, 200, 250, 300};
    private static final double[] REDUCTION = {1.00, 1.00, 0.93, 0.83, 0.72, 0.61, 0.48, 0.33, 0.24, 0.18};

    private SlendernessCurve() {
    }

    public static double reductionFactor(double slenderness) {
        if (slenderness <= SLENDERNESS[0]) {
            return REDUCTION[0];
        }
        for (int i = 1; i < SLENDERNESS.length; i++) {
            if (slenderness <= SLENDERNESS[i]) {
                double fraction = (slenderness - SLENDERNESS[i - 1]) / (SLENDERNESS[i] - SLENDERNESS[i - 1]);
                return REDUCTION[i - 1] + fraction * (REDUCTION[i] - REDUCTION[i - 1]);
            }
        }
        return getFloor();
    }

    public static double getFloor() {
        return REDUCTION[REDUCTION.length - 1];
    }
}
