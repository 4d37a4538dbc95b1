package org.carball.beamcheck.model.section;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.carball.beamcheck.model.material.MaterialKind;

import java.util.Locale;

@Getter
@ToString
@EqualsAndHashCode
public final class TimberSection implements SectionGeometry {

    private final double width;
    private final double depth;

    private final double area;
    private final double secondMomentOfArea;
    private final double elasticModulus;

    public TimberSection(double width, double depth) {
        this.width = width;
        this.depth = depth;
        this.area = width * depth;
        this.secondMomentOfArea = width * Math.pow(depth, 3) / 12.0;
        this.elasticModulus = width * depth * depth / 6.0;
    }

    @Override
    public MaterialKind getMaterialKind() {
        return MaterialKind.TIMBER;
    }

    @Override
    public String describe() {
        return String.format(Locale.ROOT, "Rectangular timber %.0f x %.0f", width, depth);
    }
}
