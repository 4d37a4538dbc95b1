package org.carball.beamcheck.model.load;

import java.util.Locale;

public enum LoadingType {
    HA("Normal traffic"),
    HB("Abnormal vehicle");

    private final String description;

    LoadingType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static LoadingType fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown loading type: " + name + ". Use HA or HB");
        }
    }
}
