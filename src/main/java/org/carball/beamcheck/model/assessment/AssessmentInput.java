package org.carball.beamcheck.model.assessment;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.beamcheck.model.load.HighwayLoadParameters;
import org.carball.beamcheck.model.load.LoadCase;
import org.carball.beamcheck.model.load.VehicleSpec;
import org.carball.beamcheck.model.material.MaterialKind;
import org.carball.beamcheck.model.section.SectionGeometry;

import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of one assessment request.
 */
@Value
@Builder(toBuilder = true)
public class AssessmentInput {
    BridgeType bridgeType;
    double spanLength;
    Double effectiveMemberLength;
    MaterialKind materialKind;
    String grade;
    Double reinforcementStrength;
    SectionGeometry section;
    @Builder.Default
    EffectiveLengthFactors effectiveLengthFactors = EffectiveLengthFactors.unity();
    HighwayLoadParameters highwayLoading;
    @Builder.Default
    double conditionFactor = 1.0;
    SafetyFactors safetyFactors;
    @Singular
    List<LoadCase> loadCases;
    VehicleSpec vehicle;
    @Builder.Default
    TimberModifiers timberModifiers = TimberModifiers.defaults();
    @Builder.Default
    boolean includeSelfWeight = true;

    public Optional<VehicleSpec> getVehicleSpec() {
        return Optional.ofNullable(vehicle);
    }

    /**
     * Unrestrained length used for the effective length; the span when none was given.
     */
    public double getUnrestrainedLength() {
        return effectiveMemberLength != null ? effectiveMemberLength : spanLength;
    }
}
