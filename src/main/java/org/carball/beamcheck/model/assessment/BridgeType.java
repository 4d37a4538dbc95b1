package org.carball.beamcheck.model.assessment;

import java.util.Locale;

public enum BridgeType {
    SIMPLY_SUPPORTED("Simply Supported"),
    CANTILEVER("Cantilever");

    private final String displayName;

    BridgeType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static BridgeType fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        if ("CONTINUOUS".equals(normalized)) {
            throw new IllegalArgumentException("Continuous spans are not supported. " +
                    "Assess a simply_supported or cantilever span");
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown bridge type: " + name + ". Use simply_supported or cantilever");
        }
    }
}
