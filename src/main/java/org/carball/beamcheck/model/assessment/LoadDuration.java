package org.carball.beamcheck.model.assessment;

import java.util.Locale;

/**
 * Timber load-duration classes with their K3 modification factors.
 */
public enum LoadDuration {
    LONG(1.0),
    MEDIUM(1.25),
    SHORT(1.5),
    VERY_SHORT(1.75);

    private final double factor;

    LoadDuration(double factor) {
        this.factor = factor;
    }

    public double getFactor() {
        return factor;
    }

    public static LoadDuration fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown load duration: " + name +
                    ". Use long, medium, short or very_short");
        }
    }
}
