package org.carball.beamcheck.parser;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.beamcheck.analyzer.SectionGeometryDeriver;
import org.carball.beamcheck.catalog.VehicleCatalog;
import org.carball.beamcheck.config.DesignCodeConstants;
import org.carball.beamcheck.exception.ValidationException;
import org.carball.beamcheck.model.assessment.AssessmentInput;
import org.carball.beamcheck.model.assessment.BridgeType;
import org.carball.beamcheck.model.assessment.EffectiveLengthFactors;
import org.carball.beamcheck.model.assessment.Exposure;
import org.carball.beamcheck.model.assessment.LoadDuration;
import org.carball.beamcheck.model.assessment.SafetyFactors;
import org.carball.beamcheck.model.assessment.TimberModifiers;
import org.carball.beamcheck.model.load.AccessType;
import org.carball.beamcheck.model.load.HighwayLoadParameters;
import org.carball.beamcheck.model.load.LoadCase;
import org.carball.beamcheck.model.load.LoadDistribution;
import org.carball.beamcheck.model.load.LoadType;
import org.carball.beamcheck.model.load.LoadingType;
import org.carball.beamcheck.model.load.SharingMode;
import org.carball.beamcheck.model.load.VehicleSpec;
import org.carball.beamcheck.model.material.MaterialKind;
import org.carball.beamcheck.model.section.ReinforcementLayer;
import org.carball.beamcheck.model.section.SectionDimensions;
import org.carball.beamcheck.model.section.SteelShape;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns a flat parameter map, as posted by a form or read from a YAML/JSON file, into a typed
 * {@link AssessmentInput}. Every failure names the parameter at fault.
 */
@Slf4j
public class AssessmentInputParser {

    private final DesignCodeConstants constants;
    private final SectionGeometryDeriver sectionDeriver;

    public AssessmentInputParser(DesignCodeConstants constants) {
        this.constants = constants;
        this.sectionDeriver = new SectionGeometryDeriver();
    }

    /**
     * Reads a parameter file. Files ending in .yml or .yaml are read as YAML, anything else as JSON.
     */
    public static Map<String, Object> readParameters(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Parameter file not found: " + file);
        }

        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = name.endsWith(".yml") || name.endsWith(".yaml")
                ? new ObjectMapper(new YAMLFactory())
                : new ObjectMapper();

        Map<String, Object> parameters = mapper.readValue(file.toFile(), new TypeReference<>() {});
        if (parameters == null) {
            throw new IOException("Parameter file is empty: " + file);
        }
        log.info("Read {} parameters from {}", parameters.size(), file);
        return parameters;
    }

    public AssessmentInput parse(Map<String, ?> parameters) {
        MaterialKind kind = MaterialKind.fromName(requiredText(parameters, "material"));

        AssessmentInput.AssessmentInputBuilder input = AssessmentInput.builder()
                .bridgeType(enumValue(parameters, "bridge_type", BridgeType::fromName))
                .spanLength(requiredNumber(parameters, "span_length"))
                .effectiveMemberLength(number(parameters, "effective_member_length"))
                .materialKind(kind)
                .grade(requiredText(parameters, "grade"))
                .reinforcementStrength(number(parameters, "reinforcement_strength"))
                .section(sectionDeriver.derive(kind, dimensions(kind, parameters)))
                .effectiveLengthFactors(new EffectiveLengthFactors(
                        numberOr(parameters, "k1", 1.0),
                        numberOr(parameters, "k2", 1.0)))
                .highwayLoading(highwayLoading(parameters))
                .conditionFactor(numberOr(parameters, "condition_factor", 1.0))
                .safetyFactors(safetyFactors(parameters))
                .timberModifiers(timberModifiers(parameters))
                .includeSelfWeight(flag(parameters, "include_self_weight", true))
                .loadCases(loadCases(parameters))
                .vehicle(vehicle(parameters));

        return input.build();
    }

    private SectionDimensions dimensions(MaterialKind kind, Map<String, ?> parameters) {
        SectionDimensions.SectionDimensionsBuilder dimensions = SectionDimensions.builder()
                .depth(number(parameters, "beam_depth"));

        switch (kind) {
            case STEEL -> dimensions
                    .shape(text(parameters, "section_shape") == null ? null
                            : enumValue(parameters, "section_shape", SteelShape::fromName))
                    .flangeWidth(number(parameters, "flange_width"))
                    .flangeThickness(number(parameters, "flange_thickness"))
                    .webThickness(number(parameters, "web_thickness"));
            case CONCRETE -> dimensions
                    .width(number(parameters, "beam_width"))
                    .layers(reinforcementLayers(parameters));
            case TIMBER -> dimensions.width(number(parameters, "beam_width"));
        }
        return dimensions.build();
    }

    private List<ReinforcementLayer> reinforcementLayers(Map<String, ?> parameters) {
        List<ReinforcementLayer> layers = new ArrayList<>();

        Object listed = parameters.get("reinforcement_layers");
        if (listed != null) {
            if (!(listed instanceof List<?> entries)) {
                throw new ValidationException("reinforcement_layers", "Expected a list of reinforcement layers");
            }
            for (int i = 0; i < entries.size(); i++) {
                Map<String, ?> entry = asMap("reinforcement_layers", entries.get(i));
                layers.add(layer(entry, "", "reinforcement_layers[" + i + "]."));
            }
            return layers;
        }

        if (parameters.containsKey("bar_count")) {
            layers.add(layer(parameters, "", ""));
        }
        for (int n = 2; parameters.containsKey("bar_count_" + n); n++) {
            layers.add(layer(parameters, "_" + n, ""));
        }
        return layers;
    }

    private ReinforcementLayer layer(Map<String, ?> source, String suffix, String prefix) {
        double barCount = requiredNumber(source, "bar_count" + suffix, prefix);
        if (barCount != Math.rint(barCount)) {
            throw new ValidationException(prefix + "bar_count" + suffix, "Bar count must be a whole number, got " + barCount);
        }
        return new ReinforcementLayer(
                (int) barCount,
                requiredNumber(source, "bar_diameter" + suffix, prefix),
                requiredNumber(source, "cover" + suffix, prefix));
    }

    private HighwayLoadParameters highwayLoading(Map<String, ?> parameters) {
        String access = text(parameters, "access_type");
        return new HighwayLoadParameters(
                enumValue(parameters, "loading_type", LoadingType::fromName),
                requiredNumber(parameters, "loaded_width"),
                requiredNumber(parameters, "lane_width"),
                access == null ? null : enumValue(parameters, "access_type", AccessType::fromName),
                numberOr(parameters, "hb_units", constants.getDefaultHbUnits()));
    }

    private SafetyFactors safetyFactors(Map<String, ?> parameters) {
        SafetyFactors defaults = constants.getDefaultSafetyFactors();
        return new SafetyFactors(
                numberOr(parameters, "safety_factor_steel", defaults.steel()),
                numberOr(parameters, "safety_factor_concrete", defaults.concrete()),
                numberOr(parameters, "safety_factor_reinforcement", defaults.reinforcement()),
                numberOr(parameters, "safety_factor_timber", defaults.timber()));
    }

    private TimberModifiers timberModifiers(Map<String, ?> parameters) {
        TimberModifiers defaults = TimberModifiers.defaults();
        Exposure exposure = text(parameters, "exposure") == null
                ? defaults.exposure()
                : enumValue(parameters, "exposure", Exposure::fromName);
        LoadDuration duration = text(parameters, "load_duration") == null
                ? defaults.duration()
                : enumValue(parameters, "load_duration", LoadDuration::fromName);
        return new TimberModifiers(exposure, duration);
    }

    private List<LoadCase> loadCases(Map<String, ?> parameters) {
        List<LoadCase> loads = new ArrayList<>();

        Object listed = parameters.get("additional_loads");
        if (listed != null) {
            if (!(listed instanceof List<?> entries)) {
                throw new ValidationException("additional_loads", "Expected a list of loads");
            }
            for (int i = 0; i < entries.size(); i++) {
                Map<String, ?> entry = asMap("additional_loads", entries.get(i));
                loads.add(loadCase(entry, i + 1, "description", "value", "type", "load_material", "load_distribution",
                        "additional_loads[" + i + "]."));
            }
            return loads;
        }

        for (int n = 1; parameters.containsKey("load_value_" + n); n++) {
            loads.add(loadCase(parameters, n, "load_description_" + n, "load_value_" + n, "load_type_" + n,
                    "load_material_" + n, "load_distribution_" + n, ""));
        }
        return loads;
    }

    private LoadCase loadCase(Map<String, ?> source, int index, String descriptionKey, String valueKey,
                              String typeKey, String materialKey, String distributionKey, String prefix) {
        String description = text(source, descriptionKey);
        String type = text(source, typeKey);
        String material = text(source, materialKey);
        String distribution = text(source, distributionKey);

        return new LoadCase(
                description == null ? "Load " + index : description,
                requiredNumber(source, valueKey, prefix),
                type == null ? LoadType.DEAD : convert(prefix + typeKey, type, LoadType::fromName),
                material == null ? "" : material,
                distribution == null ? LoadDistribution.UDL : convert(prefix + distributionKey, distribution,
                        LoadDistribution::fromName));
    }

    private VehicleSpec vehicle(Map<String, ?> parameters) {
        String type = text(parameters, "vehicle_type");
        boolean custom = parameters.containsKey("front_axle_load") || parameters.containsKey("rear_axle_load");

        VehicleSpec.VehicleSpecBuilder vehicle;
        if (!custom && VehicleCatalog.isNone(type)) {
            return null;
        } else if (!custom) {
            vehicle = VehicleCatalog.find(type)
                    .orElseThrow(() -> new ValidationException("vehicle_type", "Unknown vehicle type: " + type +
                            ". Available vehicles: " + VehicleCatalog.getAvailableVehicles() +
                            ", or give front_axle_load, rear_axle_load and axle_spacing"))
                    .toBuilder();
            Double spacing = number(parameters, "axle_spacing");
            if (spacing != null) {
                vehicle.axleSpacing(spacing);
            }
        } else {
            vehicle = VehicleSpec.builder()
                    .vehicleType(type == null ? "custom" : type)
                    .frontAxleLoad(requiredNumber(parameters, "front_axle_load"))
                    .rearAxleLoad(requiredNumber(parameters, "rear_axle_load"))
                    .axleSpacing(requiredNumber(parameters, "axle_spacing"));
        }

        String sharing = text(parameters, "load_sharing");
        return vehicle
                .impactFactor(numberOr(parameters, "impact_factor", constants.getDefaultImpactFactor()))
                .dispersion(numberOr(parameters, "dispersion", 0.0))
                .sharingMode(sharing == null ? SharingMode.FULL
                        : enumValue(parameters, "load_sharing", SharingMode::fromName))
                .build();
    }

    // Value helpers

    private static String text(Map<String, ?> source, String key) {
        Object value = source.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static String requiredText(Map<String, ?> source, String key) {
        String text = text(source, key);
        if (text == null) {
            throw ValidationException.missing(key);
        }
        return text;
    }

    private static Double number(Map<String, ?> source, String key) {
        return number(source, key, "");
    }

    private static Double number(Map<String, ?> source, String key, String prefix) {
        Object value = source.get(key);
        double parsed;
        if (value instanceof Number n) {
            parsed = n.doubleValue();
        } else {
            String text = text(source, key);
            if (text == null) {
                return null;
            }
            try {
                parsed = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new ValidationException(prefix + key, "Parameter '" + prefix + key + "' must be a number, got '" +
                        text + "'", e);
            }
        }
        if (!Double.isFinite(parsed)) {
            throw new ValidationException(prefix + key, "Parameter '" + prefix + key + "' must be a finite number, got " +
                    parsed);
        }
        return parsed;
    }

    private static double requiredNumber(Map<String, ?> source, String key) {
        return requiredNumber(source, key, "");
    }

    private static double requiredNumber(Map<String, ?> source, String key, String prefix) {
        Double value = number(source, key, prefix);
        if (value == null) {
            throw ValidationException.missing(prefix + key);
        }
        return value;
    }

    private static double numberOr(Map<String, ?> source, String key, double fallback) {
        Double value = number(source, key);
        return value != null ? value : fallback;
    }

    private static boolean flag(Map<String, ?> source, String key, boolean fallback) {
        Object value = source.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        String text = text(source, key);
        if (text == null) {
            return fallback;
        }
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on", "1" -> true;
            case "false", "no", "off", "0" -> false;
            default -> throw new ValidationException(key, "Parameter '" + key + "' must be true or false, got '" +
                    text + "'");
        };
    }

    private static <T> T enumValue(Map<String, ?> source, String key, Function<String, T> lookup) {
        String text = text(source, key);
        if (text == null) {
            throw ValidationException.missing(key);
        }
        return convert(key, text, lookup);
    }

    private static <T> T convert(String field, String text, Function<String, T> lookup) {
        try {
            return lookup.apply(text);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field, e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asMap(String field, Object entry) {
        if (!(entry instanceof Map<?, ?>)) {
            throw new ValidationException(field, "Expected each entry to be a map, got " + entry);
        }
        return (Map<String, ?>) entry;
    }
}
