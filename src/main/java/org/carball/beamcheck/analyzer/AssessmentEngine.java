package org.carball.beamcheck.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.beamcheck.catalog.MaterialCatalog;
import org.carball.beamcheck.config.DesignCodeConstants;
import org.carball.beamcheck.exception.AssessmentException;
import org.carball.beamcheck.exception.ErrorKind;
import org.carball.beamcheck.exception.ValidationException;
import org.carball.beamcheck.model.assessment.AssessmentError;
import org.carball.beamcheck.model.assessment.AssessmentInput;
import org.carball.beamcheck.model.assessment.AssessmentOutcome;
import org.carball.beamcheck.model.assessment.AssessmentResult;
import org.carball.beamcheck.model.assessment.AssessmentState;
import org.carball.beamcheck.model.assessment.CalculationLog;
import org.carball.beamcheck.model.assessment.Capacity;
import org.carball.beamcheck.model.assessment.EffectiveLength;
import org.carball.beamcheck.model.assessment.SafetyFactors;
import org.carball.beamcheck.model.load.HighwayLoad;
import org.carball.beamcheck.model.load.LoadDemand;
import org.carball.beamcheck.model.load.VehicleEnvelope;
import org.carball.beamcheck.model.material.MaterialKind;
import org.carball.beamcheck.model.material.MaterialSpec;
import org.carball.beamcheck.parser.AssessmentInputParser;

import java.util.Locale;
import java.util.Map;

/**
 * Runs one member assessment end to end and reports the outcome. Failures never escape:
 * they are returned as an {@link AssessmentOutcome} carrying the offending field.
 */
@Slf4j
public class AssessmentEngine {

    private final DesignCodeConstants constants;
    private final AssessmentInputParser parser;
    private final EffectiveLengthResolver effectiveLengthResolver;
    private final HighwayLoadModel highwayLoadModel;
    private final VehicleLoadEnvelope vehicleLoadEnvelope;
    private final LoadCombinator loadCombinator;
    private final CapacityEngine capacityEngine;

    public AssessmentEngine() {
        this(DesignCodeConstants.createDefaults());
    }

    public AssessmentEngine(DesignCodeConstants constants) {
        this.constants = constants;
        this.parser = new AssessmentInputParser(constants);
        this.effectiveLengthResolver = new EffectiveLengthResolver();
        this.highwayLoadModel = new HighwayLoadModel(constants);
        this.vehicleLoadEnvelope = new VehicleLoadEnvelope();
        this.loadCombinator = new LoadCombinator();
        this.capacityEngine = new CapacityEngine(constants);
    }

    public AssessmentOutcome assess(Map<String, ?> parameters) {
        AssessmentInput input;
        try {
            input = parser.parse(parameters);
        } catch (AssessmentException e) {
            return fail(e, AssessmentState.VALIDATING);
        } catch (IllegalArgumentException e) {
            return fail(new ValidationException("input", e.getMessage(), e), AssessmentState.VALIDATING);
        }
        return assess(input);
    }

    public AssessmentOutcome assess(AssessmentInput input) {
        AssessmentState state = AssessmentState.VALIDATING;
        CalculationLog calculation = new CalculationLog();
        try {
            validate(input);

            state = transition(state, AssessmentState.RESOLVING);
            MaterialSpec material = resolveMaterial(input);
            calculation.record("Design strength", material.strength(), "MPa", material.getDescription());
            EffectiveLength effectiveLength = effectiveLengthResolver.resolve(
                    input.getUnrestrainedLength(), input.getEffectiveLengthFactors(), input.getSection(), calculation);

            state = transition(state, AssessmentState.COMBINING);
            HighwayLoad highwayLoad = highwayLoadModel.compute(input.getSpanLength(), input.getHighwayLoading(), calculation);
            VehicleEnvelope vehicleEnvelope = vehicleLoadEnvelope.maxEnvelope(
                    input.getBridgeType(), input.getSpanLength(), input.getVehicle(), calculation);
            double selfWeight = input.isIncludeSelfWeight()
                    ? calculation.record("Self weight", input.getSection().getArea() * 1.0e-6 * material.density(), "kN/m",
                    String.format(Locale.ROOT, "area %.0f mm², density %.1f kN/m³", input.getSection().getArea(), material.density()))
                    : 0.0;
            LoadDemand demand = loadCombinator.combine(input.getBridgeType(), input.getSpanLength(), input.getLoadCases(),
                    selfWeight, highwayLoad, vehicleEnvelope, calculation);

            state = transition(state, AssessmentState.COMPARING);
            SafetyFactors safetyFactors = input.getSafetyFactors() != null
                    ? input.getSafetyFactors()
                    : constants.getDefaultSafetyFactors();
            Capacity capacity = capacityEngine.capacity(material, input.getSection(), input.getConditionFactor(),
                    safetyFactors, effectiveLength.reductionFactor(), input.getTimberModifiers(), calculation);

            calculation.record("Moment utilisation", utilisation(demand.getTotalMoment(), capacity.momentCapacity()), "",
                    capacity.momentCapacity() >= demand.getTotalMoment() ? "adequate" : "inadequate");
            calculation.record("Shear utilisation", utilisation(demand.getTotalShear(), capacity.shearCapacity()), "",
                    capacity.shearCapacity() >= demand.getTotalShear() ? "adequate" : "inadequate");

            AssessmentResult result = AssessmentResult.builder()
                    .bridgeType(input.getBridgeType())
                    .material(material)
                    .spanLength(input.getSpanLength())
                    .effectiveLength(effectiveLength)
                    .highwayLoad(highwayLoad)
                    .loadCases(input.getLoadCases())
                    .demand(demand)
                    .vehicleEnvelope(vehicleEnvelope)
                    .selfWeightIncluded(input.isIncludeSelfWeight())
                    .capacity(capacity)
                    .steps(calculation.getSteps())
                    .build();

            transition(state, AssessmentState.DONE);
            log.info("Assessed {} {} member over {} m: {} (M {}/{} kNm, V {}/{} kN)",
                    material.grade(), input.getBridgeType().getDisplayName().toLowerCase(Locale.ROOT), input.getSpanLength(),
                    result.isPassed() ? "PASS" : "FAIL",
                    String.format(Locale.ROOT, "%.1f", demand.getTotalMoment()), String.format(Locale.ROOT, "%.1f", capacity.momentCapacity()),
                    String.format(Locale.ROOT, "%.1f", demand.getTotalShear()), String.format(Locale.ROOT, "%.1f", capacity.shearCapacity()));
            return AssessmentOutcome.success(result);

        } catch (AssessmentException e) {
            return fail(e, state);
        } catch (IllegalArgumentException e) {
            return fail(new ValidationException("input", e.getMessage(), e), state);
        }
    }

    private void validate(AssessmentInput input) {
        if (input.getBridgeType() == null) {
            throw ValidationException.missing("bridge_type");
        }
        if (!Double.isFinite(input.getSpanLength()) || input.getSpanLength() <= 0) {
            throw new ValidationException("span_length", "Span length must be positive, got " + input.getSpanLength());
        }
        if (input.getMaterialKind() == null) {
            throw ValidationException.missing("material");
        }
        if (input.getSection() == null) {
            throw ValidationException.missing("section");
        }
        if (input.getHighwayLoading() == null || input.getHighwayLoading().loadingType() == null) {
            throw ValidationException.missing("loading_type");
        }
        if (input.getEffectiveLengthFactors() == null) {
            throw ValidationException.missing("k1");
        }
        if (input.getTimberModifiers() == null || input.getTimberModifiers().exposure() == null) {
            throw ValidationException.missing("exposure");
        }
        if (input.getTimberModifiers().duration() == null) {
            throw ValidationException.missing("load_duration");
        }
        if (!(input.getConditionFactor() > 0 && input.getConditionFactor() <= 1.0)) {
            throw new ValidationException("condition_factor",
                    "Condition factor must be greater than 0 and at most 1.0, got " + input.getConditionFactor());
        }
    }

    private MaterialSpec resolveMaterial(AssessmentInput input) {
        MaterialSpec material = MaterialCatalog.resolve(input.getMaterialKind(), input.getGrade());
        if (material.kind() != MaterialKind.CONCRETE) {
            return material;
        }

        Double override = input.getReinforcementStrength();
        if (override != null && (!Double.isFinite(override) || override <= 0)) {
            throw new ValidationException("reinforcement_strength",
                    "Reinforcement strength must be positive, got " + override);
        }
        return material.withReinforcementStrength(override != null ? override : constants.getDefaultReinforcementStrength());
    }

    private AssessmentState transition(AssessmentState from, AssessmentState to) {
        log.debug("Assessment state {} -> {}", from, to);
        return to;
    }

    private AssessmentOutcome fail(AssessmentException e, AssessmentState state) {
        ErrorKind kind = e.getKind();
        log.warn("Assessment failed while {} on '{}': {}", state, e.getField(), e.getMessage());
        log.debug("Assessment failure details", e);
        transition(state, AssessmentState.FAILED);
        return AssessmentOutcome.failure(new AssessmentError(kind, e.getField(), e.getMessage(), state));
    }

    private static double utilisation(double demand, double capacity) {
        if (capacity > 0) {
            return demand / capacity;
        }
        return demand > 0 ? Double.POSITIVE_INFINITY : 0.0;
    }
}
