package org.carball.beamcheck.model.section;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Raw section dimensions as supplied, in mm. Fields not relevant to the material are left null.
 */
@Value
@Builder
public class SectionDimensions {
    SteelShape shape;
    Double flangeWidth;
    Double flangeThickness;
    Double webThickness;
    Double depth;
    Double width;
    @Singular
    List<ReinforcementLayer> layers;
}
