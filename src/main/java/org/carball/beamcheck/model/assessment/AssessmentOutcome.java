package org.carball.beamcheck.model.assessment;

import org.carball.beamcheck.model.load.HighwayLoad;
import org.carball.beamcheck.model.load.LoadCase;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * What the engine hands to presentation: either a full result or an error, never both.
 */
public final class AssessmentOutcome {

    public static final String MOMENT_CAPACITY = "Moment Capacity (kNm)";
    public static final String SHEAR_CAPACITY = "Shear Capacity (kN)";
    public static final String DEAD_MOMENT = "Applied Dead Load Moment (kNm)";
    public static final String LIVE_MOMENT = "Applied Live Load Moment (kNm)";
    public static final String DEAD_SHEAR = "Applied Dead Load Shear (kN)";
    public static final String LIVE_SHEAR = "Applied Live Load Shear (kN)";
    public static final String TOTAL_MOMENT = "Total Applied Moment (kNm)";
    public static final String TOTAL_SHEAR = "Total Applied Shear (kN)";
    public static final String SELF_WEIGHT_MOMENT = "Self Weight Moment (kNm)";
    public static final String VEHICLE_MOMENT = "Vehicle Maximum Moment (kNm)";
    public static final String VEHICLE_SHEAR = "Vehicle Maximum Shear (kN)";
    public static final String SPAN_LENGTH = "Span Length (m)";
    public static final String EFFECTIVE_LENGTH = "Effective Member Length (m)";
    public static final String REDUCTION_FACTOR = "Reduction Factor";
    public static final String LOADING_TYPE = "Loading Type";
    public static final String NOTIONAL_LANES = "Notional Lanes";
    public static final String MOMENT_UTILISATION = "Moment Utilisation";
    public static final String SHEAR_UTILISATION = "Shear Utilisation";
    public static final String ADDITIONAL_LOADS = "Additional Loads";
    public static final String CALCULATION_PROCESS = "Calculation Process";
    public static final String RESULT = "Result";
    public static final String ERROR = "Error";

    private final AssessmentResult result;
    private final AssessmentError error;

    private AssessmentOutcome(AssessmentResult result, AssessmentError error) {
        this.result = result;
        this.error = error;
    }

    public static AssessmentOutcome success(AssessmentResult result) {
        return new AssessmentOutcome(result, null);
    }

    public static AssessmentOutcome failure(AssessmentError error) {
        return new AssessmentOutcome(null, error);
    }

    public boolean isSuccessful() {
        return result != null;
    }

    public Optional<AssessmentResult> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<AssessmentError> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Flattens the outcome into the named fields presentation layers read verbatim.
     */
    public Map<String, Object> toFieldMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (result == null) {
            fields.put(ERROR, error.getDisplayMessage());
            return fields;
        }

        fields.put(MOMENT_CAPACITY, round(result.getCapacity().momentCapacity()));
        fields.put(SHEAR_CAPACITY, round(result.getCapacity().shearCapacity()));
        fields.put(DEAD_MOMENT, round(result.getDemand().getDeadMoment()));
        fields.put(LIVE_MOMENT, round(result.getDemand().getLiveMoment()));
        fields.put(DEAD_SHEAR, round(result.getDemand().getDeadShear()));
        fields.put(LIVE_SHEAR, round(result.getDemand().getLiveShear()));
        fields.put(TOTAL_MOMENT, round(result.getDemand().getTotalMoment()));
        fields.put(TOTAL_SHEAR, round(result.getDemand().getTotalShear()));
        if (result.isSelfWeightIncluded()) {
            fields.put(SELF_WEIGHT_MOMENT, round(result.getDemand().getSelfWeightMoment()));
        }
        if (result.getVehicleEnvelope().isPresent()) {
            fields.put(VEHICLE_MOMENT, round(result.getVehicleEnvelope().maxMoment()));
            fields.put(VEHICLE_SHEAR, round(result.getVehicleEnvelope().maxShear()));
        }
        fields.put(SPAN_LENGTH, round(result.getSpanLength()));
        fields.put(EFFECTIVE_LENGTH, round(result.getEffectiveLength().effectiveLength()));
        fields.put(REDUCTION_FACTOR, round(result.getEffectiveLength().reductionFactor()));

        HighwayLoad highway = result.getHighwayLoad();
        String loadingType = highway.loadingType().name();
        fields.put(LOADING_TYPE, loadingType);
        fields.put(loadingType + " UDL (kN/m)", round(highway.udl()));
        fields.put(loadingType + " KEL (kN)", round(highway.kel()));
        fields.put(NOTIONAL_LANES, highway.notionalLanes());
        fields.put(MOMENT_UTILISATION, round(result.getMomentUtilisation()));
        fields.put(SHEAR_UTILISATION, round(result.getShearUtilisation()));

        List<Map<String, Object>> loads = new ArrayList<>();
        for (LoadCase loadCase : result.getLoadCases()) {
            Map<String, Object> load = new LinkedHashMap<>();
            load.put("description", loadCase.description());
            load.put("value", loadCase.magnitude());
            load.put("type", loadCase.type().name().toLowerCase(Locale.ROOT));
            load.put("load_material", loadCase.loadMaterial());
            load.put("load_distribution", loadCase.distribution().name().toLowerCase(Locale.ROOT));
            loads.add(load);
        }
        fields.put(ADDITIONAL_LOADS, loads);
        fields.put(CALCULATION_PROCESS, result.getSteps().stream().map(CalculationStep::format).toList());
        fields.put(RESULT, result.isPassed() ? "Pass" : "Fail");
        return fields;
    }

    private static double round(double value) {
        if (Double.isInfinite(value) || Double.isNaN(value)) {
            return value;
        }
        return Math.round(value * 100.0) / 100.0;
    }
}
