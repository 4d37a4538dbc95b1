package org.carball.beamcheck.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.beamcheck.exception.ValidationException;
import org.carball.beamcheck.model.assessment.BridgeType;
import org.carball.beamcheck.model.assessment.CalculationLog;
import org.carball.beamcheck.model.load.HighwayLoad;
import org.carball.beamcheck.model.load.LoadCase;
import org.carball.beamcheck.model.load.LoadDemand;
import org.carball.beamcheck.model.load.LoadDistribution;
import org.carball.beamcheck.model.load.LoadType;
import org.carball.beamcheck.model.load.VehicleEnvelope;

import java.util.List;
import java.util.Locale;

/**
 * Sums load effects into dead and live moment and shear. Point loads act at midspan of a simply
 * supported span and at the free end of a cantilever.
 */
@Slf4j
public class LoadCombinator {

    public LoadDemand combine(BridgeType bridgeType, double span, List<LoadCase> loadCases,
                              double selfWeightUdl, HighwayLoad highwayLoad, VehicleEnvelope vehicleEnvelope) {
        return combine(bridgeType, span, loadCases, selfWeightUdl, highwayLoad, vehicleEnvelope, new CalculationLog());
    }

    public LoadDemand combine(BridgeType bridgeType, double span, List<LoadCase> loadCases,
                              double selfWeightUdl, HighwayLoad highwayLoad, VehicleEnvelope vehicleEnvelope,
                              CalculationLog calculation) {
        double deadMoment = 0;
        double deadShear = 0;
        double liveMoment = 0;
        double liveShear = 0;

        double selfWeightMoment = 0;
        double selfWeightShear = 0;
        if (selfWeightUdl > 0) {
            selfWeightMoment = calculation.record("Self weight moment", udlMoment(bridgeType, span, selfWeightUdl), "kNm",
                    String.format(Locale.ROOT, "w = %.3f kN/m", selfWeightUdl));
            selfWeightShear = calculation.record("Self weight shear", udlShear(bridgeType, span, selfWeightUdl), "kN");
            deadMoment += selfWeightMoment;
            deadShear += selfWeightShear;
        }

        for (int i = 0; i < loadCases.size(); i++) {
            LoadCase loadCase = loadCases.get(i);
            if (!Double.isFinite(loadCase.magnitude()) || loadCase.magnitude() < 0) {
                throw new ValidationException("load_value_" + (i + 1),
                        "Load '" + loadCase.description() + "' must not be negative, got " + loadCase.magnitude());
            }

            double moment;
            double shear;
            if (loadCase.distribution() == LoadDistribution.UDL) {
                moment = udlMoment(bridgeType, span, loadCase.magnitude());
                shear = udlShear(bridgeType, span, loadCase.magnitude());
            } else {
                moment = pointMoment(bridgeType, span, loadCase.magnitude());
                shear = loadCase.magnitude();
            }

            String detail = String.format(Locale.ROOT, "%s %s %.2f %s, %s",
                    loadCase.type().name().toLowerCase(Locale.ROOT), loadCase.distribution().name().toLowerCase(Locale.ROOT),
                    loadCase.magnitude(), loadCase.distribution().getUnit(), loadCase.loadMaterial());
            calculation.record("Moment from " + loadCase.description(), moment, "kNm", detail);

            if (loadCase.type() == LoadType.DEAD) {
                deadMoment += moment;
                deadShear += shear;
            } else {
                liveMoment += moment;
                liveShear += shear;
            }
        }

        String loading = highwayLoad.loadingType().name();
        double highwayMoment = udlMoment(bridgeType, span, highwayLoad.udl()) + pointMoment(bridgeType, span, highwayLoad.kel());
        double highwayShear = udlShear(bridgeType, span, highwayLoad.udl()) + highwayLoad.kel();
        calculation.record(loading + " loading moment", highwayMoment, "kNm",
                bridgeType == BridgeType.CANTILEVER ? "KEL at free end" : "KEL at midspan");
        calculation.record(loading + " loading shear", highwayShear, "kN");
        liveMoment += highwayMoment;
        liveShear += highwayShear;

        liveMoment += vehicleEnvelope.maxMoment();
        liveShear += vehicleEnvelope.maxShear();

        calculation.record("Applied dead load moment", deadMoment, "kNm");
        calculation.record("Applied live load moment", liveMoment, "kNm");
        calculation.record("Total applied moment", deadMoment + liveMoment, "kNm");
        calculation.record("Total applied shear", deadShear + liveShear, "kN");

        log.debug("Demand: dead {} kNm, live {} kNm, shear {} kN", deadMoment, liveMoment, deadShear + liveShear);

        return LoadDemand.builder()
                .deadMoment(deadMoment)
                .liveMoment(liveMoment)
                .deadShear(deadShear)
                .liveShear(liveShear)
                .selfWeightMoment(selfWeightMoment)
                .selfWeightShear(selfWeightShear)
                .highwayMoment(highwayMoment)
                .highwayShear(highwayShear)
                .vehicleMoment(vehicleEnvelope.maxMoment())
                .vehicleShear(vehicleEnvelope.maxShear())
                .build();
    }

    static double udlMoment(BridgeType bridgeType, double span, double intensity) {
        return bridgeType == BridgeType.CANTILEVER
                ? intensity * span * span / 2.0
                : intensity * span * span / 8.0;
    }

    static double udlShear(BridgeType bridgeType, double span, double intensity) {
        return bridgeType == BridgeType.CANTILEVER
                ? intensity * span
                : intensity * span / 2.0;
    }

    static double pointMoment(BridgeType bridgeType, double span, double load) {
        return bridgeType == BridgeType.CANTILEVER
                ? load * span
                : load * span / 4.0;
    }
}
