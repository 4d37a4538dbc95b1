package org.carball.beamcheck.model.section;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.carball.beamcheck.model.material.MaterialKind;

import java.util.Locale;

/**
 * Doubly symmetric rolled or fabricated steel section. A box section has two webs of the given
 * thickness set at the flange tips.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SteelSection implements SectionGeometry {

    private final SteelShape shape;
    private final double flangeWidth;
    private final double flangeThickness;
    private final double webThickness;
    private final double depth;

    private final double webDepth;
    private final double area;
    private final double secondMomentOfArea;
    private final double elasticModulus;
    private final double plasticModulus;
    private final double minorSecondMomentOfArea;
    private final double shearArea;

    public SteelSection(SteelShape shape, double flangeWidth, double flangeThickness,
                        double webThickness, double depth) {
        this.shape = shape;
        this.flangeWidth = flangeWidth;
        this.flangeThickness = flangeThickness;
        this.webThickness = webThickness;
        this.depth = depth;

        int webs = shape == SteelShape.BOX ? 2 : 1;
        double b = flangeWidth;
        double tf = flangeThickness;
        double tw = webThickness;
        double h = depth;
        double hw = h - 2 * tf;

        this.webDepth = hw;
        this.area = 2 * b * tf + webs * hw * tw;
        this.secondMomentOfArea = (b * Math.pow(h, 3) - (b - webs * tw) * Math.pow(hw, 3)) / 12.0;
        this.elasticModulus = 2 * secondMomentOfArea / h;
        this.plasticModulus = b * tf * (h - tf) + webs * tw * hw * hw / 4.0;

        double flangesMinor = 2 * tf * Math.pow(b, 3) / 12.0;
        if (shape == SteelShape.BOX) {
            double offset = (b - tw) / 2.0;
            this.minorSecondMomentOfArea = flangesMinor + 2 * hw * Math.pow(tw, 3) / 12.0 + 2 * hw * tw * offset * offset;
        } else {
            this.minorSecondMomentOfArea = flangesMinor + hw * Math.pow(tw, 3) / 12.0;
        }
        this.shearArea = webs * h * tw;
    }

    @Override
    public MaterialKind getMaterialKind() {
        return MaterialKind.STEEL;
    }

    /**
     * Radius of gyration about the minor axis, used for lateral-torsional buckling slenderness.
     */
    public double getMinorRadiusOfGyration() {
        return Math.sqrt(minorSecondMomentOfArea / area);
    }

    /**
     * Width of the compression flange used in the compactness check: the outstand from the web
     * face for an I-section, the internal width between webs for a box.
     */
    public double getFlangeCompressionWidth() {
        return shape == SteelShape.BOX
                ? (flangeWidth - 2 * webThickness)
                : (flangeWidth - webThickness) / 2.0;
    }

    @Override
    public String describe() {
        return String.format(Locale.ROOT, "%s %.0f x %.0f flange, %.0f web, %.0f deep",
                shape.getDisplayName(), flangeWidth, flangeThickness, webThickness, depth);
    }
}
