package org.carball.beamcheck.model.load;

import java.util.Locale;

public enum LoadType {
    DEAD,
    LIVE;

    public static LoadType fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown load type: " + name + ". Use dead or live");
        }
    }
}
