package org.carball.beamcheck.model.load;

/**
 * Worst moment and shear produced by the assessment vehicle anywhere on the span.
 *
 * @param criticalPosition distance in m from the left support to the governing axle
 * @param governingAxle    "front" or "rear"; "none" when no vehicle was assessed
 */
public record VehicleEnvelope(
        double maxMoment,
        double maxShear,
        double criticalPosition,
        String governingAxle,
        double frontLoad,
        double rearLoad
) {

    public static VehicleEnvelope none() {
        return new VehicleEnvelope(0, 0, 0, "none", 0, 0);
    }

    public boolean isPresent() {
        return !"none".equals(governingAxle);
    }
}
