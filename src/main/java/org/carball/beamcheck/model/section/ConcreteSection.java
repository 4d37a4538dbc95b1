package org.carball.beamcheck.model.section;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.carball.beamcheck.model.material.MaterialKind;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Singly reinforced rectangular concrete section.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ConcreteSection implements SectionGeometry {

    private final double width;
    private final double depth;
    private final List<ReinforcementLayer> layers;

    private final double area;
    private final double secondMomentOfArea;
    private final double elasticModulus;
    private final double steelArea;
    private final double reinforcementCentroid;
    private final double effectiveDepth;

    public ConcreteSection(double width, double depth, List<ReinforcementLayer> layers) {
        this.width = width;
        this.depth = depth;
        this.layers = layers.stream()
                .sorted(Comparator.comparingDouble(ReinforcementLayer::getCentroidDistance))
                .toList();

        this.area = width * depth;
        this.secondMomentOfArea = width * Math.pow(depth, 3) / 12.0;
        this.elasticModulus = width * depth * depth / 6.0;

        double totalSteel = 0;
        double firstMoment = 0;
        for (ReinforcementLayer layer : this.layers) {
            totalSteel += layer.getSteelArea();
            firstMoment += layer.getSteelArea() * layer.getCentroidDistance();
        }
        this.steelArea = totalSteel;
        this.reinforcementCentroid = totalSteel > 0 ? firstMoment / totalSteel : 0;
        this.effectiveDepth = depth - reinforcementCentroid;
    }

    @Override
    public MaterialKind getMaterialKind() {
        return MaterialKind.CONCRETE;
    }

    /**
     * Tension reinforcement ratio As / (b·d).
     */
    public double getReinforcementRatio() {
        return steelArea / (width * effectiveDepth);
    }

    @Override
    public String describe() {
        return String.format(Locale.ROOT, "Rectangular %.0f x %.0f, %d layer(s), As = %.0f mm², d = %.1f mm",
                width, depth, layers.size(), steelArea, effectiveDepth);
    }
}
