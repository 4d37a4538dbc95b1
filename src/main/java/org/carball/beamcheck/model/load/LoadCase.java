package org.carball.beamcheck.model.load;

/**
 * A user-supplied additional load. Magnitude is in kN/m for a UDL and kN for a point load;
 * point loads act at midspan (simply supported) or at the free end (cantilever).
 */
public record LoadCase(
        String description,
        double magnitude,
        LoadType type,
        String loadMaterial,
        LoadDistribution distribution
) {}
