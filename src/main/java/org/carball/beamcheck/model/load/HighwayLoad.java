package org.carball.beamcheck.model.load;

/**
 * Highway loading acting on the member: uniformly distributed intensity in kN/m and knife-edge
 * load in kN, both already multiplied by lane count and access factor.
 */
public record HighwayLoad(
        LoadingType loadingType,
        double udl,
        double kel,
        int notionalLanes,
        double laneIntensity,
        double accessFactor
) {}
