package org.carball.beamcheck.model.load;

import java.util.Locale;

public enum LoadDistribution {
    UDL("kN/m"),
    POINT("kN");

    private final String unit;

    LoadDistribution(String unit) {
        this.unit = unit;
    }

    public String getUnit() {
        return unit;
    }

    public static LoadDistribution fromName(String name) {
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "UDL", "UNIFORM", "DISTRIBUTED" -> UDL;
            case "POINT", "CONCENTRATED" -> POINT;
            default -> throw new IllegalArgumentException("Unknown load distribution: " + name + ". Use udl or point");
        };
    }
}
