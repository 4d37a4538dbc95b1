package org.carball.beamcheck.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.beamcheck.config.DesignCodeConstants;
import org.carball.beamcheck.exception.UnsupportedMaterialException;
import org.carball.beamcheck.exception.ValidationException;
import org.carball.beamcheck.model.assessment.CalculationLog;
import org.carball.beamcheck.model.assessment.Capacity;
import org.carball.beamcheck.model.assessment.SafetyFactors;
import org.carball.beamcheck.model.assessment.TimberModifiers;
import org.carball.beamcheck.model.material.MaterialSpec;
import org.carball.beamcheck.model.section.ConcreteSection;
import org.carball.beamcheck.model.section.SectionGeometry;
import org.carball.beamcheck.model.section.SteelSection;
import org.carball.beamcheck.model.section.SteelShape;
import org.carball.beamcheck.model.section.TimberSection;

import java.util.Locale;

/**
 * Moment and shear resistance by material: limit state methods for steel and reinforced
 * concrete, permissible stress for timber. Section dimensions are in mm and stresses in MPa, so
 * N·mm and N results are converted to kNm and kN at the end.
 */
@Slf4j
public class CapacityEngine {

    private static final double NMM_TO_KNM = 1.0e-6;
    private static final double N_TO_KN = 1.0e-3;

    private final DesignCodeConstants constants;

    public CapacityEngine(DesignCodeConstants constants) {
        this.constants = constants;
    }

    public Capacity capacity(MaterialSpec material, SectionGeometry section, double conditionFactor,
                             SafetyFactors safetyFactors, double slendernessFactor, TimberModifiers timberModifiers) {
        return capacity(material, section, conditionFactor, safetyFactors, slendernessFactor, timberModifiers,
                new CalculationLog());
    }

    public Capacity capacity(MaterialSpec material, SectionGeometry section, double conditionFactor,
                             SafetyFactors safetyFactors, double slendernessFactor, TimberModifiers timberModifiers,
                             CalculationLog calculation) {
        if (!(conditionFactor > 0 && conditionFactor <= 1.0)) {
            throw new ValidationException("condition_factor",
                    "Condition factor must be greater than 0 and at most 1.0, got " + conditionFactor);
        }

        Capacity characteristic;
        if (section instanceof SteelSection steel && material.kind() == steel.getMaterialKind()) {
            characteristic = steelCapacity(material, steel, safetyFactors.steel(), slendernessFactor, calculation);
        } else if (section instanceof ConcreteSection concrete && material.kind() == concrete.getMaterialKind()) {
            characteristic = concreteCapacity(material, concrete, safetyFactors, calculation);
        } else if (section instanceof TimberSection timber && material.kind() == timber.getMaterialKind()) {
            characteristic = timberCapacity(material, timber, safetyFactors.timber(), timberModifiers, calculation);
        } else {
            throw new UnsupportedMaterialException("material", String.format(Locale.ROOT,
                    "No resistance method for %s material with a %s section",
                    material.kind().getDisplayName().toLowerCase(Locale.ROOT),
                    section.getMaterialKind().getDisplayName().toLowerCase(Locale.ROOT)));
        }

        double moment = calculation.record("Moment capacity", characteristic.momentCapacity() * conditionFactor, "kNm",
                String.format(Locale.ROOT, "condition factor %.2f", conditionFactor));
        double shear = calculation.record("Shear capacity", characteristic.shearCapacity() * conditionFactor, "kN",
                String.format(Locale.ROOT, "condition factor %.2f", conditionFactor));

        log.debug("{} capacity: M = {} kNm, V = {} kN", characteristic.method(), moment, shear);
        return new Capacity(moment, shear, characteristic.method());
    }

    private Capacity steelCapacity(MaterialSpec material, SteelSection section, double gammaM,
                                   double slendernessFactor, CalculationLog calculation) {
        requirePositive("safety_factor_steel", gammaM);
        double fy = material.strength();
        double epsilon = Math.sqrt(355.0 / fy);

        double flangeRatio = section.getFlangeCompressionWidth() / section.getFlangeThickness();
        double flangeLimit = (section.getShape() == SteelShape.BOX
                ? constants.getBoxFlangeLimit()
                : constants.getFlangeOutstandLimit()) * epsilon;
        double webRatio = section.getWebDepth() / section.getWebThickness();
        double webLimit = constants.getWebDepthLimit() * epsilon;
        boolean compact = flangeRatio <= flangeLimit && webRatio <= webLimit;

        calculation.record("Flange width-to-thickness ratio", flangeRatio, "",
                String.format(Locale.ROOT, "limit %.1f", flangeLimit));
        calculation.record("Web depth-to-thickness ratio", webRatio, "",
                String.format(Locale.ROOT, "limit %.1f", webLimit));

        double modulus = compact ? section.getPlasticModulus() : section.getElasticModulus();
        calculation.record(compact ? "Plastic section modulus" : "Elastic section modulus", modulus, "mm³",
                compact ? "compact section" : "non-compact section");

        double moment = calculation.record("Steel moment resistance Z·fy·χLT/γm",
                modulus * fy * slendernessFactor / gammaM * NMM_TO_KNM, "kNm",
                String.format(Locale.ROOT, "fy = %.0f MPa, χLT = %.3f, γm = %.2f", fy, slendernessFactor, gammaM));

        double shearStrength = fy * constants.getSteelShearStrengthRatio();
        double shear = calculation.record("Steel shear resistance Av·τy/γm",
                section.getShearArea() * shearStrength / gammaM * N_TO_KN, "kN",
                String.format(Locale.ROOT, "Av = %.0f mm², τy = %.1f MPa", section.getShearArea(), shearStrength));

        return new Capacity(moment, shear, compact ? "Steel plastic" : "Steel elastic");
    }

    private Capacity concreteCapacity(MaterialSpec material, ConcreteSection section, SafetyFactors safetyFactors,
                                      CalculationLog calculation) {
        double gammaC = safetyFactors.concrete();
        double gammaS = safetyFactors.reinforcement();
        requirePositive("safety_factor_concrete", gammaC);
        requirePositive("safety_factor_reinforcement", gammaS);

        double fck = material.strength();
        double fyk = material.reinforcementStrength();
        double b = section.getWidth();
        double d = section.getEffectiveDepth();

        calculation.record("Tension reinforcement area As", section.getSteelArea(), "mm²");
        calculation.record("Effective depth d", d, "mm",
                String.format(Locale.ROOT, "h = %.0f mm, centroid %.1f mm", section.getDepth(), section.getReinforcementCentroid()));

        double concreteStress = constants.getConcreteStressBlockFactor() * fck / gammaC;
        double tension = section.getSteelArea() * fyk / gammaS;
        double blockDepth = tension / (concreteStress * b);
        double blockLimit = constants.getStressBlockDepthRatio() * constants.getNeutralAxisLimitRatio() * d;

        double force = tension;
        if (blockDepth > blockLimit) {
            // over-reinforced: concrete crushes before the steel yields
            blockDepth = blockLimit;
            force = concreteStress * b * blockDepth;
        }
        calculation.record("Compression block depth", blockDepth, "mm",
                String.format(Locale.ROOT, "limit %.1f mm", blockLimit));

        double leverArm = calculation.record("Lever arm z", Math.min(d - blockDepth / 2.0,
                constants.getMaxLeverArmRatio() * d), "mm");
        double moment = calculation.record("Concrete moment resistance F·z", force * leverArm * NMM_TO_KNM, "kNm",
                String.format(Locale.ROOT, "F = %.1f kN, fck = %.0f MPa, fyk = %.0f MPa, γc = %.2f, γs = %.2f",
                        force * N_TO_KN, fck, fyk, gammaC, gammaS));

        double k = Math.min(2.0, 1.0 + Math.sqrt(200.0 / d));
        double rho = Math.min(constants.getMaxShearReinforcementRatio(), section.getReinforcementRatio());
        double shearStress = Math.max(
                constants.getConcreteShearCoefficient() / gammaC * k * Math.cbrt(100.0 * rho * fck),
                constants.getMinimumShearCoefficient() * Math.pow(k, 1.5) * Math.sqrt(fck));
        calculation.record("Concrete shear stress vRd,c", shearStress, "MPa",
                String.format(Locale.ROOT, "k = %.3f, ρ = %.4f", k, rho));
        double shear = calculation.record("Concrete shear resistance vRd,c·b·d", shearStress * b * d * N_TO_KN, "kN");

        return new Capacity(moment, shear, "Reinforced concrete ultimate");
    }

    private Capacity timberCapacity(MaterialSpec material, TimberSection section, double gamma,
                                    TimberModifiers modifiers, CalculationLog calculation) {
        requirePositive("safety_factor_timber", gamma);
        double k2Bending = modifiers.exposure().getBendingFactor();
        double k2Shear = modifiers.exposure().getShearFactor();
        double k3 = modifiers.duration().getFactor();

        double bendingStress = calculation.record("Permissible bending stress σm·K2·K3",
                material.strength() * k2Bending * k3, "MPa",
                String.format(Locale.ROOT, "K2 = %.2f (%s), K3 = %.2f (%s)", k2Bending, modifiers.exposure().name().toLowerCase(Locale.ROOT),
                        k3, modifiers.duration().name().toLowerCase(Locale.ROOT)));
        double shearStress = calculation.record("Permissible shear stress τ·K2·K3",
                material.shearStrength() * k2Shear * k3, "MPa");

        double moment = calculation.record("Timber moment capacity σ·Z/γ",
                bendingStress * section.getElasticModulus() / gamma * NMM_TO_KNM, "kNm",
                String.format(Locale.ROOT, "Z = %.0f mm³", section.getElasticModulus()));
        // peak shear stress in a rectangle is 1.5 V/A
        double shear = calculation.record("Timber shear capacity (2/3)·τ·A/γ",
                2.0 / 3.0 * shearStress * section.getArea() / gamma * N_TO_KN, "kN");

        return new Capacity(moment, shear, "Timber permissible stress");
    }

    private static void requirePositive(String field, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new ValidationException(field, "Safety factor must be positive, got " + value);
        }
    }
}
