package org.carball.beamcheck.model.load;

import java.util.Locale;

public enum AccessType {
    COMPANY,
    PUBLIC;

    public static AccessType fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown access type: " + name + ". Use company or public");
        }
    }
}
