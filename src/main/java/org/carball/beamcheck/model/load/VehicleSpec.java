package org.carball.beamcheck.model.load;

import lombok.Builder;
import lombok.Value;

/**
 * Two-axle assessment vehicle. Axle loads are nominal (unfactored) in kN, spacing in m and
 * dispersion as a percentage reduction.
 */
@Value
@Builder(toBuilder = true)
public class VehicleSpec {
    String vehicleType;
    double frontAxleLoad;
    double rearAxleLoad;
    double axleSpacing;
    @Builder.Default
    double impactFactor = 1.3;
    @Builder.Default
    double dispersion = 0.0;
    @Builder.Default
    SharingMode sharingMode = SharingMode.FULL;

    /**
     * Combined multiplier applied to each nominal axle load.
     */
    public double getLoadMultiplier() {
        return impactFactor * (1.0 - dispersion / 100.0) * sharingMode.getAxleFraction();
    }

    public double getDesignFrontAxleLoad() {
        return frontAxleLoad * getLoadMultiplier();
    }

    public double getDesignRearAxleLoad() {
        return rearAxleLoad * getLoadMultiplier();
    }
}
