package org.carball.beamcheck.model.load;

/**
 * Carriageway description for HA/HB loading. Widths in m; hbUnits only applies to HB.
 */
public record HighwayLoadParameters(
        LoadingType loadingType,
        double loadedWidth,
        double laneWidth,
        AccessType accessType,
        double hbUnits
) {}
