package org.carball.beamcheck.analyzer;

import org.carball.beamcheck.exception.ValidationException;
import org.carball.beamcheck.model.assessment.BridgeType;
import org.carball.beamcheck.model.assessment.CalculationLog;
import org.carball.beamcheck.model.load.HighwayLoad;
import org.carball.beamcheck.model.load.LoadCase;
import org.carball.beamcheck.model.load.LoadDemand;
import org.carball.beamcheck.model.load.LoadDistribution;
import org.carball.beamcheck.model.load.LoadType;
import org.carball.beamcheck.model.load.LoadingType;
import org.carball.beamcheck.model.load.VehicleEnvelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class LoadCombinatorTest {

    private static final HighwayLoad NO_HIGHWAY_LOAD = new HighwayLoad(LoadingType.HA, 0, 0, 1, 0, 1.0);

    private LoadCombinator combinator;
    private LoadCase surfacing;
    private LoadCase parapet;
    private LoadCase crowd;

    @BeforeEach
    void setUp() {
        combinator = new LoadCombinator();
        surfacing = new LoadCase("Surfacing", 2.0, LoadType.DEAD, "asphalt", LoadDistribution.UDL);
        parapet = new LoadCase("Parapet post", 10.0, LoadType.DEAD, "steel", LoadDistribution.POINT);
        crowd = new LoadCase("Footway crowd", 5.0, LoadType.LIVE, "", LoadDistribution.UDL);
    }

    @Test
    void shouldCombineSimplySupportedLoads() {
        // When
        LoadDemand demand = combinator.combine(BridgeType.SIMPLY_SUPPORTED, 10.0, List.of(surfacing, parapet, crowd),
                0.0, NO_HIGHWAY_LOAD, VehicleEnvelope.none());

        // Then - wL²/8 and PL/4
        assertThat(demand.getDeadMoment()).isCloseTo(2.0 * 100 / 8 + 10.0 * 10 / 4, within(1e-9));
        assertThat(demand.getDeadShear()).isCloseTo(2.0 * 10 / 2 + 10.0, within(1e-9));
        assertThat(demand.getLiveMoment()).isCloseTo(5.0 * 100 / 8, within(1e-9));
        assertThat(demand.getLiveShear()).isCloseTo(25.0, within(1e-9));
        assertThat(demand.getTotalMoment()).isCloseTo(25.0 + 25.0 + 62.5, within(1e-9));
    }

    @Test
    void shouldCombineCantileverLoads() {
        // When
        LoadDemand demand = combinator.combine(BridgeType.CANTILEVER, 4.0, List.of(surfacing, parapet),
                0.0, NO_HIGHWAY_LOAD, VehicleEnvelope.none());

        // Then - wL²/2 and PL
        assertThat(demand.getDeadMoment()).isCloseTo(2.0 * 16 / 2 + 10.0 * 4, within(1e-9));
        assertThat(demand.getDeadShear()).isCloseTo(2.0 * 4 + 10.0, within(1e-9));
    }

    @Test
    void shouldAddSelfWeightToDeadLoad() {
        // When
        LoadDemand demand = combinator.combine(BridgeType.SIMPLY_SUPPORTED, 20.0, List.of(),
                1.413, NO_HIGHWAY_LOAD, VehicleEnvelope.none());

        // Then
        assertThat(demand.getSelfWeightMoment()).isCloseTo(70.65, within(1e-9));
        assertThat(demand.getDeadMoment()).isEqualTo(demand.getSelfWeightMoment());
        assertThat(demand.getDeadShear()).isCloseTo(14.13, within(1e-9));
    }

    @Test
    void shouldAddHighwayAndVehicleEffectsToLiveLoad() {
        // Given
        HighwayLoad highway = new HighwayLoad(LoadingType.HA, 30.0, 120.0, 1, 30.0, 1.0);
        VehicleEnvelope vehicle = new VehicleEnvelope(200.0, 90.0, 5.0, "rear", 40.0, 70.0);

        // When
        LoadDemand demand = combinator.combine(BridgeType.SIMPLY_SUPPORTED, 10.0, List.of(),
                0.0, highway, vehicle);

        // Then
        assertThat(demand.getHighwayMoment()).isCloseTo(30.0 * 100 / 8 + 120.0 * 10 / 4, within(1e-9));
        assertThat(demand.getHighwayShear()).isCloseTo(150.0 + 120.0, within(1e-9));
        assertThat(demand.getLiveMoment()).isCloseTo(demand.getHighwayMoment() + 200.0, within(1e-9));
        assertThat(demand.getLiveShear()).isCloseTo(demand.getHighwayShear() + 90.0, within(1e-9));
    }

    @Test
    void shouldNotDependOnLoadOrder() {
        // When
        LoadDemand forward = combinator.combine(BridgeType.SIMPLY_SUPPORTED, 12.0, List.of(surfacing, parapet, crowd),
                1.0, NO_HIGHWAY_LOAD, VehicleEnvelope.none());
        LoadDemand reversed = combinator.combine(BridgeType.SIMPLY_SUPPORTED, 12.0, List.of(crowd, parapet, surfacing),
                1.0, NO_HIGHWAY_LOAD, VehicleEnvelope.none());

        // Then
        assertThat(reversed.getTotalMoment()).isCloseTo(forward.getTotalMoment(), within(1e-9));
        assertThat(reversed.getTotalShear()).isCloseTo(forward.getTotalShear(), within(1e-9));
    }

    @Test
    void shouldRecordMomentForEachLoad() {
        // Given
        CalculationLog calculation = new CalculationLog();

        // When
        combinator.combine(BridgeType.SIMPLY_SUPPORTED, 10.0, List.of(surfacing, parapet),
                0.0, NO_HIGHWAY_LOAD, VehicleEnvelope.none(), calculation);

        // Then
        assertThat(calculation.getSteps())
                .extracting(step -> step.label())
                .contains("Moment from Surfacing", "Moment from Parapet post", "Total applied moment");
    }

    @Test
    void shouldRejectNegativeLoadNamingItsIndex() {
        // Given
        LoadCase negative = new LoadCase("Uplift", -3.0, LoadType.DEAD, "", LoadDistribution.UDL);

        // When/Then
        assertThatThrownBy(() -> combinator.combine(BridgeType.SIMPLY_SUPPORTED, 10.0, List.of(surfacing, negative),
                0.0, NO_HIGHWAY_LOAD, VehicleEnvelope.none()))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("load_value_2");
    }
}
