package org.carball.beamcheck.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.beamcheck.exception.InvalidGeometryException;
import org.carball.beamcheck.model.material.MaterialKind;
import org.carball.beamcheck.model.section.ConcreteSection;
import org.carball.beamcheck.model.section.ReinforcementLayer;
import org.carball.beamcheck.model.section.SectionDimensions;
import org.carball.beamcheck.model.section.SectionGeometry;
import org.carball.beamcheck.model.section.SteelSection;
import org.carball.beamcheck.model.section.SteelShape;
import org.carball.beamcheck.model.section.TimberSection;

import java.util.List;
import java.util.Locale;

@Slf4j
public class SectionGeometryDeriver {

    public SectionGeometry derive(MaterialKind kind, SectionDimensions dimensions) {
        SectionGeometry section = switch (kind) {
            case STEEL -> deriveSteel(dimensions);
            case CONCRETE -> deriveConcrete(dimensions);
            case TIMBER -> deriveTimber(dimensions);
        };
        log.debug("Derived {} section: {}", kind, section.describe());
        return section;
    }

    private SteelSection deriveSteel(SectionDimensions dimensions) {
        double flangeWidth = require("flange_width", dimensions.getFlangeWidth());
        double flangeThickness = require("flange_thickness", dimensions.getFlangeThickness());
        double webThickness = require("web_thickness", dimensions.getWebThickness());
        double depth = require("beam_depth", dimensions.getDepth());
        SteelShape shape = dimensions.getShape() != null ? dimensions.getShape() : SteelShape.I;

        if (2 * flangeThickness >= depth) {
            throw new InvalidGeometryException("flange_thickness", String.format(Locale.ROOT,
                    "Flange thickness %.1f mm leaves no web in a %.1f mm deep section", flangeThickness, depth));
        }
        int webs = shape == SteelShape.BOX ? 2 : 1;
        if (webs * webThickness >= flangeWidth) {
            throw new InvalidGeometryException("web_thickness", String.format(Locale.ROOT,
                    "Web thickness %.1f mm does not fit within a %.1f mm flange", webThickness, flangeWidth));
        }
        return new SteelSection(shape, flangeWidth, flangeThickness, webThickness, depth);
    }

    private ConcreteSection deriveConcrete(SectionDimensions dimensions) {
        double width = require("beam_width", dimensions.getWidth());
        double depth = require("beam_depth", dimensions.getDepth());
        List<ReinforcementLayer> layers = dimensions.getLayers();

        if (layers == null || layers.isEmpty()) {
            throw new InvalidGeometryException("reinforcement_layers",
                    "A concrete section needs at least one layer of tension reinforcement");
        }
        for (int i = 0; i < layers.size(); i++) {
            ReinforcementLayer layer = layers.get(i);
            String suffix = i == 0 ? "" : "_" + (i + 1);
            if (layer.barCount() <= 0) {
                throw new InvalidGeometryException("bar_count" + suffix,
                        "Bar count must be positive, got " + layer.barCount());
            }
            require("bar_diameter" + suffix, layer.barDiameter());
            require("cover" + suffix, layer.cover());
        }

        ConcreteSection section = new ConcreteSection(width, depth, layers);
        if (section.getEffectiveDepth() <= 0) {
            throw new InvalidGeometryException("cover", String.format(Locale.ROOT,
                    "Reinforcement centroid %.1f mm lies outside the %.1f mm deep section",
                    section.getReinforcementCentroid(), depth));
        }
        return section;
    }

    private TimberSection deriveTimber(SectionDimensions dimensions) {
        double width = require("beam_width", dimensions.getWidth());
        double depth = require("beam_depth", dimensions.getDepth());
        return new TimberSection(width, depth);
    }

    private static double require(String field, Double value) {
        if (value == null) {
            throw new InvalidGeometryException(field, "Required dimension '" + field + "' is missing");
        }
        if (!Double.isFinite(value) || value <= 0) {
            throw new InvalidGeometryException(field,
                    "Dimension '" + field + "' must be positive, got " + value);
        }
        return value;
    }
}
