package org.carball.beamcheck.model.load;

import java.util.Locale;

public enum SharingMode {
    FULL(1.0),
    PER_BEAM(0.5);

    private final double axleFraction;

    SharingMode(double axleFraction) {
        this.axleFraction = axleFraction;
    }

    /**
     * Fraction of each axle load carried by the assessed beam line.
     */
    public double getAxleFraction() {
        return axleFraction;
    }

    public static SharingMode fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (normalized) {
            case "FULL", "FULL_AXLE" -> FULL;
            case "PER_BEAM", "HALF", "HALF_AXLE" -> PER_BEAM;
            default -> throw new IllegalArgumentException("Unknown load sharing mode: " + name + ". Use full or per_beam");
        };
    }
}
