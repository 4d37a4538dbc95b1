package org.carball.beamcheck.analyzer;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.beamcheck.exception.ErrorKind;
import org.carball.beamcheck.model.assessment.AssessmentError;
import org.carball.beamcheck.model.assessment.AssessmentInput;
import org.carball.beamcheck.model.assessment.AssessmentOutcome;
import org.carball.beamcheck.model.assessment.AssessmentResult;
import org.carball.beamcheck.model.assessment.AssessmentState;
import org.carball.beamcheck.model.assessment.BridgeType;
import org.carball.beamcheck.model.assessment.CalculationStep;
import org.carball.beamcheck.model.assessment.EffectiveLengthFactors;
import org.carball.beamcheck.model.assessment.Exposure;
import org.carball.beamcheck.model.assessment.SafetyFactors;
import org.carball.beamcheck.model.assessment.TimberModifiers;
import org.carball.beamcheck.model.load.AccessType;
import org.carball.beamcheck.model.load.HighwayLoadParameters;
import org.carball.beamcheck.model.load.LoadingType;
import org.carball.beamcheck.model.material.MaterialKind;
import org.carball.beamcheck.model.section.SteelSection;
import org.carball.beamcheck.model.section.SteelShape;
import org.carball.beamcheck.model.section.TimberSection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class AssessmentEngineTest {

    private AssessmentEngine engine;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        engine = new AssessmentEngine();

        logger = (Logger) LoggerFactory.getLogger(AssessmentEngine.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.INFO);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setAdditive(true);
    }

    private static Map<String, Object> steelGirder() {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("bridge_type", "simply_supported");
        parameters.put("span_length", 20);
        parameters.put("material", "steel");
        parameters.put("grade", "S355");
        parameters.put("flange_width", 300);
        parameters.put("flange_thickness", 20);
        parameters.put("web_thickness", 10);
        parameters.put("beam_depth", 640);
        parameters.put("k1", 1.0);
        parameters.put("k2", 1.0);
        parameters.put("loading_type", "HA");
        parameters.put("loaded_width", 7.3);
        parameters.put("lane_width", 3.65);
        parameters.put("access_type", "public");
        parameters.put("condition_factor", 1.0);
        return parameters;
    }

    private static Map<String, Object> concreteBeam() {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("bridge_type", "simply_supported");
        parameters.put("span_length", "10");
        parameters.put("material", "concrete");
        parameters.put("grade", "C32/40");
        parameters.put("beam_width", "300");
        parameters.put("beam_depth", "600");
        parameters.put("bar_count", "4");
        parameters.put("bar_diameter", "25");
        parameters.put("cover", "50");
        parameters.put("loading_type", "HB");
        parameters.put("loaded_width", "3.65");
        parameters.put("lane_width", "3.65");
        parameters.put("access_type", "company");
        return parameters;
    }

    @Test
    void shouldAssessSteelGirderUnderHaLoading() {
        // When
        AssessmentOutcome outcome = engine.assess(steelGirder());

        // Then
        assertThat(outcome.isSuccessful()).isTrue();
        AssessmentResult result = outcome.getResult().orElseThrow();
        assertThat(result.getCapacity().momentCapacity()).isCloseTo(313.47, within(0.01));
        assertThat(result.getCapacity().momentCapacity()).isFinite().isPositive();
        assertThat(result.getHighwayLoad().notionalLanes()).isEqualTo(2);
        assertThat(result.getEffectiveLength().reductionFactor()).isCloseTo(0.2007, within(1e-4));
        assertThat(result.getDemand().getSelfWeightMoment()).isCloseTo(70.65, within(1e-6));
        assertThat(outcome.toFieldMap().get(AssessmentOutcome.RESULT)).isIn("Pass", "Fail");
    }

    @Test
    void shouldAssessConcreteBeamUnderHbLoading() {
        // When
        AssessmentOutcome outcome = engine.assess(concreteBeam());

        // Then
        assertThat(outcome.isSuccessful()).isTrue();
        AssessmentResult result = outcome.getResult().orElseThrow();
        assertThat(result.getCapacity().momentCapacity()).isCloseTo(391.88, within(0.01));
        assertThat(result.getHighwayLoad().loadingType()).isEqualTo(LoadingType.HB);
        assertThat(result.getHighwayLoad().kel()).isZero();
        assertThat(result.isPassed()).isFalse();
        assertThat(outcome.toFieldMap()).containsKeys("HB UDL (kN/m)", "HB KEL (kN)");
    }

    @Test
    void shouldIncludeEighteenTonneVehicleSharedPerBeam() {
        // Given
        Map<String, Object> parameters = steelGirder();
        parameters.put("span_length", 12);
        parameters.put("vehicle_type", "18 tonne");
        parameters.put("axle_spacing", 3.0);
        parameters.put("load_sharing", "per_beam");

        // When
        AssessmentOutcome outcome = engine.assess(parameters);

        // Then
        AssessmentResult result = outcome.getResult().orElseThrow();
        assertThat(result.getVehicleEnvelope().maxMoment()).isCloseTo(285.57, within(0.01));
        assertThat(result.getDemand().getVehicleMoment()).isEqualTo(result.getVehicleEnvelope().maxMoment());
        assertThat((Double) outcome.toFieldMap().get(AssessmentOutcome.VEHICLE_MOMENT)).isCloseTo(285.57, within(1e-9));
    }

    @Test
    void shouldReturnErrorOnlyForUnknownMaterial() {
        // Given
        Map<String, Object> parameters = steelGirder();
        parameters.put("material", "unobtainium");

        // When
        AssessmentOutcome outcome = engine.assess(parameters);

        // Then
        assertThat(outcome.isSuccessful()).isFalse();
        assertThat(outcome.getResult()).isEmpty();
        AssessmentError error = outcome.getError().orElseThrow();
        assertThat(error.kind()).isEqualTo(ErrorKind.UNKNOWN_MATERIAL);
        assertThat(error.field()).isEqualTo("material");
        assertThat(error.state()).isEqualTo(AssessmentState.VALIDATING);
        assertThat(outcome.toFieldMap()).containsOnlyKeys(AssessmentOutcome.ERROR);
        assertThat(outcome.toFieldMap().values()).noneMatch(value -> value instanceof Number);
    }

    @Test
    void shouldReportAxleSpacingLongerThanSpan() {
        // Given
        Map<String, Object> parameters = steelGirder();
        parameters.put("span_length", 12);
        parameters.put("vehicle_type", "18 tonne");
        parameters.put("axle_spacing", 12.5);

        // When
        AssessmentOutcome outcome = engine.assess(parameters);

        // Then
        AssessmentError error = outcome.getError().orElseThrow();
        assertThat(error.kind()).isEqualTo(ErrorKind.INVALID_VEHICLE_SPACING);
        assertThat(error.field()).isEqualTo("axle_spacing");
        assertThat(error.state()).isEqualTo(AssessmentState.COMBINING);
        assertThat((String) outcome.toFieldMap().get(AssessmentOutcome.ERROR)).contains("axle_spacing");
    }

    @Test
    void shouldRejectContinuousSpans() {
        // Given
        Map<String, Object> parameters = steelGirder();
        parameters.put("bridge_type", "continuous");

        // When
        AssessmentOutcome outcome = engine.assess(parameters);

        // Then
        AssessmentError error = outcome.getError().orElseThrow();
        assertThat(error.kind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(error.field()).isEqualTo("bridge_type");
        assertThat(error.message()).contains("Continuous");
    }

    @Test
    void shouldProduceIdenticalOutcomeForIdenticalInput() {
        // When
        AssessmentOutcome first = engine.assess(concreteBeam());
        AssessmentOutcome second = engine.assess(concreteBeam());

        // Then
        assertThat(second.toFieldMap()).isEqualTo(first.toFieldMap());
    }

    @Test
    void shouldPassOnlyWhenCapacityCoversDemand() {
        // Given - short, restrained girder on a single company lane
        Map<String, Object> adequate = steelGirder();
        adequate.put("span_length", 5);
        adequate.put("effective_member_length", 2);
        adequate.put("loaded_width", 3.65);
        adequate.put("access_type", "company");

        for (Map<String, Object> parameters : List.of(adequate, steelGirder(), concreteBeam())) {
            // When
            AssessmentResult result = engine.assess(parameters).getResult().orElseThrow();

            // Then
            boolean covered = result.getCapacity().momentCapacity() >= result.getDemand().getTotalMoment()
                    && result.getCapacity().shearCapacity() >= result.getDemand().getTotalShear();
            assertThat(result.isPassed()).isEqualTo(covered);
        }
        assertThat(engine.assess(adequate).getResult().orElseThrow().isPassed()).isTrue();
    }

    @Test
    void shouldOmitSelfWeightWhenDisabled() {
        // Given
        Map<String, Object> parameters = steelGirder();
        parameters.put("include_self_weight", "false");

        // When
        AssessmentOutcome outcome = engine.assess(parameters);

        // Then
        assertThat(outcome.getResult().orElseThrow().getDemand().getDeadMoment()).isZero();
        assertThat(outcome.toFieldMap()).doesNotContainKey(AssessmentOutcome.SELF_WEIGHT_MOMENT);
    }

    @Test
    void shouldAssessTypedInput() {
        // Given
        AssessmentInput input = AssessmentInput.builder()
                .bridgeType(BridgeType.CANTILEVER)
                .spanLength(3.0)
                .materialKind(MaterialKind.TIMBER)
                .grade("C24")
                .section(new TimberSection(200, 400))
                .highwayLoading(new HighwayLoadParameters(LoadingType.HA, 3.65, 3.65, AccessType.COMPANY, 0))
                .build();

        // When
        AssessmentOutcome outcome = engine.assess(input);

        // Then
        AssessmentResult result = outcome.getResult().orElseThrow();
        assertThat(result.getCapacity().momentCapacity()).isCloseTo(40.0, within(1e-9));
        assertThat(result.getSteps()).isNotEmpty();
    }

    @Test
    void shouldReportMaterialThatDoesNotMatchSection() {
        // Given
        AssessmentInput input = AssessmentInput.builder()
                .bridgeType(BridgeType.SIMPLY_SUPPORTED)
                .spanLength(10.0)
                .materialKind(MaterialKind.TIMBER)
                .grade("C24")
                .section(new SteelSection(SteelShape.I, 300, 20, 10, 640))
                .highwayLoading(new HighwayLoadParameters(LoadingType.HA, 3.65, 3.65, AccessType.COMPANY, 0))
                .build();

        // When
        AssessmentOutcome outcome = engine.assess(input);

        // Then
        AssessmentError error = outcome.getError().orElseThrow();
        assertThat(error.kind()).isEqualTo(ErrorKind.UNSUPPORTED_MATERIAL);
        assertThat(error.state()).isEqualTo(AssessmentState.COMPARING);
    }

    @Test
    void shouldRejectNonFiniteParameters() {
        for (String field : List.of("span_length", "condition_factor", "k1", "safety_factor_steel")) {
            for (String value : List.of("NaN", "Infinity", "-Infinity")) {
                // Given
                Map<String, Object> parameters = steelGirder();
                parameters.put(field, value);

                // When
                AssessmentOutcome outcome = engine.assess(parameters);

                // Then
                assertThat(outcome.isSuccessful()).as("%s = %s", field, value).isFalse();
                AssessmentError error = outcome.getError().orElseThrow();
                assertThat(error.field()).isEqualTo(field);
                assertThat(error.kind()).isEqualTo(ErrorKind.VALIDATION);
                assertThat(error.state()).isEqualTo(AssessmentState.VALIDATING);
            }
        }
    }

    private static AssessmentInput timberCantilever() {
        return AssessmentInput.builder()
                .bridgeType(BridgeType.CANTILEVER)
                .spanLength(3.0)
                .materialKind(MaterialKind.TIMBER)
                .grade("C24")
                .section(new TimberSection(200, 400))
                .highwayLoading(new HighwayLoadParameters(LoadingType.HA, 3.65, 3.65, AccessType.COMPANY, 0))
                .build();
    }

    @Test
    void shouldRejectNonFiniteTypedInput() {
        // Given
        AssessmentInput base = timberCantilever();
        Map<String, AssessmentInput> inputs = Map.of(
                "span_length", base.toBuilder().spanLength(Double.NaN).build(),
                "condition_factor", base.toBuilder().conditionFactor(Double.NaN).build(),
                "k1", base.toBuilder().effectiveLengthFactors(new EffectiveLengthFactors(Double.NaN, 1.0)).build(),
                "safety_factor_timber", base.toBuilder()
                        .safetyFactors(new SafetyFactors(1.05, 1.5, 1.15, Double.POSITIVE_INFINITY)).build(),
                "effective_member_length", base.toBuilder()
                        .effectiveMemberLength(Double.POSITIVE_INFINITY).build());

        inputs.forEach((field, input) -> {
            // When
            AssessmentOutcome outcome = engine.assess(input);

            // Then
            assertThat(outcome.isSuccessful()).as(field).isFalse();
            assertThat(outcome.getError().orElseThrow().field()).isEqualTo(field);
        });
    }

    @Test
    void shouldReportMissingTypedFactorsAsFailure() {
        // Given
        AssessmentInput base = timberCantilever();

        // When
        AssessmentOutcome noFactors = engine.assess(base.toBuilder().effectiveLengthFactors(null).build());
        AssessmentOutcome noModifiers = engine.assess(base.toBuilder().timberModifiers(null).build());
        AssessmentOutcome noDuration = engine.assess(base.toBuilder()
                .timberModifiers(new TimberModifiers(Exposure.DRY, null)).build());

        // Then
        assertThat(noFactors.getError().orElseThrow().field()).isEqualTo("k1");
        assertThat(noModifiers.getError().orElseThrow().field()).isEqualTo("exposure");
        assertThat(noDuration.getError().orElseThrow().field()).isEqualTo("load_duration");
        assertThat(noFactors.getError().orElseThrow().state()).isEqualTo(AssessmentState.VALIDATING);
    }

    @Test
    void shouldProduceSameNarrativeUnderAnyDefaultLocale() {
        // Given
        Locale original = Locale.getDefault();
        Map<String, Object> parameters = steelGirder();
        parameters.put("section_shape", "i");
        parameters.put("vehicle_type", "18 tonne");
        List<String> expected = engine.assess(parameters).getResult().orElseThrow().getSteps().stream()
                .map(CalculationStep::format).toList();

        try {
            for (Locale locale : List.of(Locale.GERMANY, Locale.forLanguageTag("tr-TR"))) {
                Locale.setDefault(locale);

                // When
                AssessmentOutcome outcome = engine.assess(parameters);

                // Then
                assertThat(outcome.isSuccessful()).as(locale.toString()).isTrue();
                assertThat(outcome.getResult().orElseThrow().getSteps())
                        .extracting(CalculationStep::format)
                        .containsExactlyElementsOf(expected);
            }
        } finally {
            Locale.setDefault(original);
        }
        assertThat(expected).anyMatch(line -> line.contains("impact 1.30"));
    }

    @Test
    void shouldLogWarningWithFieldOnFailure() {
        // Given
        Map<String, Object> parameters = concreteBeam();
        parameters.remove("loaded_width");

        // When
        engine.assess(parameters);

        // Then
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .singleElement()
                .satisfies(event -> assertThat(event.getFormattedMessage()).contains("loaded_width"));
    }

    @Test
    void shouldLogVerdictAtInfo() {
        // When
        engine.assess(concreteBeam());

        // Then
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.INFO)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(message -> assertThat(message).contains("C32/40").contains("FAIL"));
    }
}
