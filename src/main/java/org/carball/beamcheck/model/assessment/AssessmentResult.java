package org.carball.beamcheck.model.assessment;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.beamcheck.model.load.HighwayLoad;
import org.carball.beamcheck.model.load.LoadCase;
import org.carball.beamcheck.model.load.LoadDemand;
import org.carball.beamcheck.model.load.VehicleEnvelope;
import org.carball.beamcheck.model.material.MaterialSpec;

import java.util.List;

@Value
@Builder
public class AssessmentResult {
    BridgeType bridgeType;
    MaterialSpec material;
    double spanLength;
    EffectiveLength effectiveLength;
    HighwayLoad highwayLoad;
    @Singular
    List<LoadCase> loadCases;
    LoadDemand demand;
    VehicleEnvelope vehicleEnvelope;
    boolean selfWeightIncluded;
    Capacity capacity;
    @Singular
    List<CalculationStep> steps;

    public boolean isMomentAdequate() {
        return capacity.momentCapacity() >= demand.getTotalMoment();
    }

    public boolean isShearAdequate() {
        return capacity.shearCapacity() >= demand.getTotalShear();
    }

    public boolean isPassed() {
        return isMomentAdequate() && isShearAdequate();
    }

    public double getMomentUtilisation() {
        return utilisation(demand.getTotalMoment(), capacity.momentCapacity());
    }

    public double getShearUtilisation() {
        return utilisation(demand.getTotalShear(), capacity.shearCapacity());
    }

    private static double utilisation(double demand, double capacity) {
        if (capacity > 0) {
            return demand / capacity;
        }
        return demand > 0 ? Double.POSITIVE_INFINITY : 0.0;
    }
}
