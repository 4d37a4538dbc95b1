package org.carball.beamcheck.model.load;

import lombok.Builder;
import lombok.Value;

/**
 * Applied moments (kNm) and shears (kN) grouped by source. Highway and vehicle effects are
 * already included in the live totals; they are kept separately for reporting.
 */
@Value
@Builder
public class LoadDemand {
    double deadMoment;
    double liveMoment;
    double deadShear;
    double liveShear;
    double selfWeightMoment;
    double selfWeightShear;
    double highwayMoment;
    double highwayShear;
    double vehicleMoment;
    double vehicleShear;

    public double getTotalMoment() {
        return deadMoment + liveMoment;
    }

    public double getTotalShear() {
        return deadShear + liveShear;
    }
}
