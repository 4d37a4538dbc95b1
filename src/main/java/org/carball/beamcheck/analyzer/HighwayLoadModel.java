package org.carball.beamcheck.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.beamcheck.config.DesignCodeConstants;
import org.carball.beamcheck.exception.InvalidLoadingParametersException;
import org.carball.beamcheck.exception.ValidationException;
import org.carball.beamcheck.model.assessment.CalculationLog;
import org.carball.beamcheck.model.load.HighwayLoad;
import org.carball.beamcheck.model.load.HighwayLoadParameters;
import org.carball.beamcheck.model.load.LoadingType;

import java.util.Locale;

/**
 * HA and HB highway loading intensities for the loaded carriageway.
 */
@Slf4j
public class HighwayLoadModel {

    private final DesignCodeConstants constants;

    public HighwayLoadModel(DesignCodeConstants constants) {
        this.constants = constants;
    }

    public HighwayLoad compute(double spanLength, HighwayLoadParameters parameters) {
        return compute(spanLength, parameters, new CalculationLog());
    }

    public HighwayLoad compute(double spanLength, HighwayLoadParameters parameters, CalculationLog calculation) {
        validate(spanLength, parameters);

        int lanes = notionalLanes(parameters.loadedWidth(), parameters.laneWidth());
        calculation.record("Notional lanes", lanes, "",
                String.format(Locale.ROOT, "loaded width %.2f m / lane width %.2f m", parameters.loadedWidth(), parameters.laneWidth()));
        double accessFactor = calculation.record("Access factor", constants.accessFactor(parameters.accessType()), "",
                parameters.accessType().name().toLowerCase(Locale.ROOT) + " access");

        HighwayLoad load;
        if (parameters.loadingType() == LoadingType.HA) {
            double laneIntensity = calculation.record("HA UDL per notional lane", haLaneIntensity(spanLength), "kN/m",
                    String.format(Locale.ROOT, "L = %.2f m", spanLength));
            double udl = calculation.record("HA UDL", laneIntensity * lanes * accessFactor, "kN/m");
            double kel = calculation.record("HA KEL", constants.getKelPerLane() * lanes * accessFactor, "kN",
                    String.format(Locale.ROOT, "%.0f kN per lane", constants.getKelPerLane()));
            load = new HighwayLoad(LoadingType.HA, udl, kel, lanes, laneIntensity, accessFactor);
        } else {
            double laneIntensity = calculation.record("HB load per notional lane",
                    parameters.hbUnits() * constants.getHbUnitLoad() / lanes, "kN/m",
                    String.format(Locale.ROOT, "%.0f units x %.0f kN", parameters.hbUnits(), constants.getHbUnitLoad()));
            double udl = calculation.record("HB UDL", laneIntensity * accessFactor, "kN/m");
            load = new HighwayLoad(LoadingType.HB, udl, 0.0, lanes, laneIntensity, accessFactor);
        }

        log.debug("{} loading: udl {} kN/m, kel {} kN over {} lanes", load.loadingType(), load.udl(), load.kel(), lanes);
        return load;
    }

    /**
     * Number of notional lanes, at least one.
     */
    public static int notionalLanes(double loadedWidth, double laneWidth) {
        return Math.max(1, (int) Math.floor(loadedWidth / laneWidth));
    }

    /**
     * HA uniformly distributed load per notional lane in kN/m.
     */
    public double haLaneIntensity(double spanLength) {
        if (spanLength <= constants.getHaSpanLimit()) {
            return constants.getHaShortSpanCoefficient() * Math.pow(1.0 / spanLength, constants.getHaShortSpanExponent());
        }
        return constants.getHaLongSpanCoefficient() * Math.pow(1.0 / spanLength, constants.getHaLongSpanExponent());
    }

    private void validate(double spanLength, HighwayLoadParameters parameters) {
        if (parameters == null) {
            throw new ValidationException("loading_type", "Highway loading parameters are required");
        }
        if (!Double.isFinite(spanLength) || spanLength <= 0) {
            throw new InvalidLoadingParametersException("span_length",
                    "Span length must be positive, got " + spanLength);
        }
        if (!Double.isFinite(parameters.laneWidth()) || parameters.laneWidth() <= 0) {
            throw new InvalidLoadingParametersException("lane_width",
                    "Lane width must be positive, got " + parameters.laneWidth());
        }
        if (!Double.isFinite(parameters.loadedWidth()) || parameters.loadedWidth() < parameters.laneWidth()) {
            throw new InvalidLoadingParametersException("loaded_width", String.format(Locale.ROOT,
                    "Loaded width %.2f m is less than the lane width %.2f m",
                    parameters.loadedWidth(), parameters.laneWidth()));
        }
        if (parameters.accessType() == null) {
            throw new InvalidLoadingParametersException("access_type", "Access type is required (company or public)");
        }
        if (parameters.loadingType() == LoadingType.HB && !(parameters.hbUnits() > 0 && Double.isFinite(parameters.hbUnits()))) {
            throw new InvalidLoadingParametersException("hb_units",
                    "HB units must be positive, got " + parameters.hbUnits());
        }
    }
}
