package org.carball.beamcheck.exception;

public enum ErrorKind {
    UNKNOWN_MATERIAL("Unknown material"),
    INVALID_GEOMETRY("Invalid section geometry"),
    INVALID_LOADING_PARAMETERS("Invalid loading parameters"),
    INVALID_VEHICLE_SPACING("Invalid vehicle axle spacing"),
    UNSUPPORTED_MATERIAL("Unsupported material"),
    VALIDATION("Validation error");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
