package org.carball.beamcheck.model.assessment;

public record TimberModifiers(Exposure exposure, LoadDuration duration) {

    public static TimberModifiers defaults() {
        return new TimberModifiers(Exposure.DRY, LoadDuration.LONG);
    }
}
