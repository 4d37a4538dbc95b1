package org.carball.beamcheck.model.section;

import java.util.Locale;

public enum SteelShape {
    I("I-section"),
    BOX("Box girder");

    private final String displayName;

    SteelShape(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static SteelShape fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace("-BEAM", "").replace("-SECTION", "")
                .replace(" GIRDER", "");
        for (SteelShape shape : values()) {
            if (shape.name().equals(normalized)) {
                return shape;
            }
        }
        throw new IllegalArgumentException("Unknown steel section shape: " + name + ". Use i or box");
    }
}
