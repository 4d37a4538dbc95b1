package org.carball.beamcheck.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_PREFIX = "BEAMCHECK_";
    static final String CLI_PREFIX = "--constants.";

    private static final Map<String, BiConsumer<DesignCodeConstants, Double>> SETTERS = new LinkedHashMap<>();

    static {
        SETTERS.put("ha_short_span_coefficient", DesignCodeConstants::setHaShortSpanCoefficient);
        SETTERS.put("ha_short_span_exponent", DesignCodeConstants::setHaShortSpanExponent);
        SETTERS.put("ha_long_span_coefficient", DesignCodeConstants::setHaLongSpanCoefficient);
        SETTERS.put("ha_long_span_exponent", DesignCodeConstants::setHaLongSpanExponent);
        SETTERS.put("ha_span_limit", DesignCodeConstants::setHaSpanLimit);
        SETTERS.put("kel_per_lane", DesignCodeConstants::setKelPerLane);
        SETTERS.put("hb_unit_load", DesignCodeConstants::setHbUnitLoad);
        SETTERS.put("default_hb_units", DesignCodeConstants::setDefaultHbUnits);
        SETTERS.put("company_access_factor", DesignCodeConstants::setCompanyAccessFactor);
        SETTERS.put("public_access_factor", DesignCodeConstants::setPublicAccessFactor);
        SETTERS.put("steel_safety_factor", DesignCodeConstants::setSteelSafetyFactor);
        SETTERS.put("concrete_safety_factor", DesignCodeConstants::setConcreteSafetyFactor);
        SETTERS.put("reinforcement_safety_factor", DesignCodeConstants::setReinforcementSafetyFactor);
        SETTERS.put("timber_safety_factor", DesignCodeConstants::setTimberSafetyFactor);
        SETTERS.put("steel_shear_strength_ratio", DesignCodeConstants::setSteelShearStrengthRatio);
        SETTERS.put("flange_outstand_limit", DesignCodeConstants::setFlangeOutstandLimit);
        SETTERS.put("box_flange_limit", DesignCodeConstants::setBoxFlangeLimit);
        SETTERS.put("web_depth_limit", DesignCodeConstants::setWebDepthLimit);
        SETTERS.put("default_reinforcement_strength", DesignCodeConstants::setDefaultReinforcementStrength);
        SETTERS.put("concrete_stress_block_factor", DesignCodeConstants::setConcreteStressBlockFactor);
        SETTERS.put("stress_block_depth_ratio", DesignCodeConstants::setStressBlockDepthRatio);
        SETTERS.put("neutral_axis_limit_ratio", DesignCodeConstants::setNeutralAxisLimitRatio);
        SETTERS.put("max_lever_arm_ratio", DesignCodeConstants::setMaxLeverArmRatio);
        SETTERS.put("concrete_shear_coefficient", DesignCodeConstants::setConcreteShearCoefficient);
        SETTERS.put("minimum_shear_coefficient", DesignCodeConstants::setMinimumShearCoefficient);
        SETTERS.put("max_shear_reinforcement_ratio", DesignCodeConstants::setMaxShearReinforcementRatio);
        SETTERS.put("default_impact_factor", DesignCodeConstants::setDefaultImpactFactor);
    }

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads constants using the hierarchy: CLI args > env vars > defaults
     */
    public DesignCodeConstants loadConfiguration(String[] args) {
        log.debug("Loading design constants");
        DesignCodeConstants constants = DesignCodeConstants.createDefaults();
        return applyOverrides(constants, args);
    }

    /**
     * Loads constants from a YAML file, then overlays environment variables and CLI arguments.
     * A missing or unreadable file falls back to the defaults.
     */
    public DesignCodeConstants loadConfiguration(Path constantsFile, String[] args) {
        DesignCodeConstants constants = loadConstantsFile(constantsFile);
        return applyOverrides(constants, args);
    }

    /**
     * Reads a YAML constants file. Keys use the snake_case names listed by {@link #getConstantsHelp()}.
     */
    public DesignCodeConstants loadConstantsFile(Path constantsFile) {
        if (constantsFile == null) {
            log.info("No constants file provided, using code defaults");
            return DesignCodeConstants.createDefaults();
        }

        if (!Files.exists(constantsFile)) {
            log.warn("Constants file not found: {}, using code defaults", constantsFile);
            return DesignCodeConstants.createDefaults();
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
            DesignCodeConstants constants = mapper.readValue(constantsFile.toFile(), DesignCodeConstants.class);
            log.info("Loaded design constants from: {}", constantsFile);
            return constants;
        } catch (IOException e) {
            log.error("Failed to load constants from {}: {}, using code defaults",
                    constantsFile, e.getMessage());
            return DesignCodeConstants.createDefaults();
        }
    }

    private DesignCodeConstants applyOverrides(DesignCodeConstants constants, String[] args) {
        // 1. Apply environment variables
        applyEnvironmentVariables(constants);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(constants, args);

        constants.validate();
        log.info("Configuration loaded: {}", constants.getDescription());
        return constants;
    }

    private void applyEnvironmentVariables(DesignCodeConstants constants) {
        SETTERS.forEach((name, setter) -> {
            String variable = ENV_PREFIX + name.toUpperCase(Locale.ROOT);
            if (environment.containsKey(variable)) {
                apply(constants, variable, environment.get(variable), setter);
            }
        });
    }

    private void applyCLIArguments(DesignCodeConstants constants, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            if (!arg.startsWith(CLI_PREFIX)) {
                continue;
            }

            String name = arg.substring(CLI_PREFIX.length()).replace('-', '_');
            BiConsumer<DesignCodeConstants, Double> setter = SETTERS.get(name);
            if (setter == null) {
                log.warn("Unknown design constant: {}", arg);
                continue;
            }
            apply(constants, arg, args[i + 1], setter);
            i++;
        }
    }

    private void apply(DesignCodeConstants constants, String source, String value,
                       BiConsumer<DesignCodeConstants, Double> setter) {
        try {
            setter.accept(constants, Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    /**
     * Returns help text for design constant options.
     */
    public static String getConstantsHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Design Constant Options:\n\n");
        help.append("YAML file (--constants <file>) keys, CLI arguments and environment variables:\n");
        for (String name : SETTERS.keySet()) {
            help.append(String.format(Locale.ROOT, "  %-32s %s%-32s %s%s%n", name,
                    CLI_PREFIX, name.replace('_', '-'),
                    ENV_PREFIX, name.toUpperCase(Locale.ROOT)));
        }
        help.append("""

                Priority Order (highest to lowest):
                  1. CLI arguments
                  2. Environment variables
                  3. Constants file
                  4. Built-in code defaults
                """);
        return help.toString();
    }
}
