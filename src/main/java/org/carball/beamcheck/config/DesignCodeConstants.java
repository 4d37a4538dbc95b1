package org.carball.beamcheck.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.beamcheck.model.assessment.SafetyFactors;
import org.carball.beamcheck.model.load.AccessType;

import java.util.Locale;

/**
 * Code-of-practice coefficients used by the loading and resistance calculations. Defaults follow
 * BD 37/01 highway loading and the ultimate limit state partial factors in common UK assessment
 * practice; every value can be overridden from a YAML file, the environment or the command line.
 */
@Data
@Slf4j
public class DesignCodeConstants {

    // HA loading, W = coefficient * (1/L)^exponent kN/m per notional lane
    @JsonProperty("ha_short_span_coefficient")
    private double haShortSpanCoefficient = 336.0;

    @JsonProperty("ha_short_span_exponent")
    private double haShortSpanExponent = 0.67;

    @JsonProperty("ha_long_span_coefficient")
    private double haLongSpanCoefficient = 36.0;

    @JsonProperty("ha_long_span_exponent")
    private double haLongSpanExponent = 0.1;

    @JsonProperty("ha_span_limit")
    private double haSpanLimit = 50.0;

    @JsonProperty("kel_per_lane")
    private double kelPerLane = 120.0;

    // HB loading
    @JsonProperty("hb_unit_load")
    private double hbUnitLoad = 10.0;

    @JsonProperty("default_hb_units")
    private double defaultHbUnits = 30.0;

    // Access multipliers
    @JsonProperty("company_access_factor")
    private double companyAccessFactor = 1.3;

    @JsonProperty("public_access_factor")
    private double publicAccessFactor = 1.5;

    // Material partial safety factors
    @JsonProperty("steel_safety_factor")
    private double steelSafetyFactor = 1.05;

    @JsonProperty("concrete_safety_factor")
    private double concreteSafetyFactor = 1.5;

    @JsonProperty("reinforcement_safety_factor")
    private double reinforcementSafetyFactor = 1.15;

    @JsonProperty("timber_safety_factor")
    private double timberSafetyFactor = 1.0;

    // Steel resistance
    @JsonProperty("steel_shear_strength_ratio")
    private double steelShearStrengthRatio = 1.0 / Math.sqrt(3.0);

    @JsonProperty("flange_outstand_limit")
    private double flangeOutstandLimit = 9.0;

    @JsonProperty("box_flange_limit")
    private double boxFlangeLimit = 33.0;

    @JsonProperty("web_depth_limit")
    private double webDepthLimit = 72.0;

    // Concrete resistance
    @JsonProperty("default_reinforcement_strength")
    private double defaultReinforcementStrength = 500.0;

    @JsonProperty("concrete_stress_block_factor")
    private double concreteStressBlockFactor = 0.85;

    @JsonProperty("stress_block_depth_ratio")
    private double stressBlockDepthRatio = 0.8;

    @JsonProperty("neutral_axis_limit_ratio")
    private double neutralAxisLimitRatio = 0.45;

    @JsonProperty("max_lever_arm_ratio")
    private double maxLeverArmRatio = 0.95;

    @JsonProperty("concrete_shear_coefficient")
    private double concreteShearCoefficient = 0.18;

    @JsonProperty("minimum_shear_coefficient")
    private double minimumShearCoefficient = 0.035;

    @JsonProperty("max_shear_reinforcement_ratio")
    private double maxShearReinforcementRatio = 0.02;

    // Vehicle defaults
    @JsonProperty("default_impact_factor")
    private double defaultImpactFactor = 1.3;

    public static DesignCodeConstants createDefaults() {
        return new DesignCodeConstants();
    }

    @JsonIgnore
    public SafetyFactors getDefaultSafetyFactors() {
        return new SafetyFactors(steelSafetyFactor, concreteSafetyFactor,
                reinforcementSafetyFactor, timberSafetyFactor);
    }

    public double accessFactor(AccessType accessType) {
        return switch (accessType) {
            case COMPANY -> companyAccessFactor;
            case PUBLIC -> publicAccessFactor;
        };
    }

    /**
     * Logs warnings for values that are legal but unlikely to be intended.
     */
    public void validate() {
        if (haShortSpanExponent <= 0 || haLongSpanExponent <= 0) {
            log.warn("HA span exponents ({}, {}) should be positive or the UDL will not reduce with span",
                    haShortSpanExponent, haLongSpanExponent);
        }

        if (haSpanLimit <= 0) {
            log.warn("HA span limit ({}) should be positive", haSpanLimit);
        }

        if (companyAccessFactor < 1.0 || publicAccessFactor < 1.0) {
            log.warn("Access factors (company {}, public {}) below 1.0 reduce the highway loading",
                    companyAccessFactor, publicAccessFactor);
        }

        if (steelSafetyFactor < 1.0 || concreteSafetyFactor < 1.0
                || reinforcementSafetyFactor < 1.0 || timberSafetyFactor < 1.0) {
            log.warn("Partial safety factors below 1.0 increase resistance above characteristic values " +
                    "(steel {}, concrete {}, reinforcement {}, timber {})",
                    steelSafetyFactor, concreteSafetyFactor, reinforcementSafetyFactor, timberSafetyFactor);
        }

        if (neutralAxisLimitRatio <= 0 || neutralAxisLimitRatio >= 1.0) {
            log.warn("Neutral axis limit ratio ({}) should lie between 0 and 1", neutralAxisLimitRatio);
        }

        if (maxLeverArmRatio > 1.0) {
            log.warn("Maximum lever arm ratio ({}) should not exceed 1.0", maxLeverArmRatio);
        }

        if (defaultImpactFactor < 1.0) {
            log.warn("Default impact factor ({}) should be at least 1.0", defaultImpactFactor);
        }

        log.debug("Using design constants - HA: {}(1/L)^{}, KEL: {} kN, HB unit: {} kN",
                haShortSpanCoefficient, haShortSpanExponent, kelPerLane, hbUnitLoad);
    }

    @JsonIgnore
    public String getDescription() {
        return String.format(Locale.ROOT,
                "Constants: HA=%.0f(1/L)^%.2f/%.0f(1/L)^%.2f, KEL=%.0f kN, HB unit=%.0f kN, " +
                "access=%.2f/%.2f, gamma steel=%.2f concrete=%.2f rebar=%.2f timber=%.2f",
                haShortSpanCoefficient, haShortSpanExponent, haLongSpanCoefficient, haLongSpanExponent,
                kelPerLane, hbUnitLoad, companyAccessFactor, publicAccessFactor,
                steelSafetyFactor, concreteSafetyFactor, reinforcementSafetyFactor, timberSafetyFactor
        );
    }
}
