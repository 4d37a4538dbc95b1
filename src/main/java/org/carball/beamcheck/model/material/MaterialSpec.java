package org.carball.beamcheck.model.material;

import java.util.Locale;

/**
 * Characteristic properties of one catalogued material grade. Stresses in MPa, density in kN/m³.
 *
 * @param strength       steel yield strength, concrete cylinder strength or timber bending grade stress
 * @param shearStrength  timber grade shear stress; zero for steel and concrete
 * @param reinforcementStrength characteristic reinforcement yield strength; zero unless concrete
 */
public record MaterialSpec(
        String grade,
        MaterialKind kind,
        double strength,
        double shearStrength,
        double reinforcementStrength,
        double elasticModulus,
        double density
) {

    public static MaterialSpec steel(String grade, double yieldStrength) {
        return new MaterialSpec(grade, MaterialKind.STEEL, yieldStrength, 0, 0, 210_000, 78.5);
    }

    public static MaterialSpec concrete(String grade, double cylinderStrength, double elasticModulus) {
        return new MaterialSpec(grade, MaterialKind.CONCRETE, cylinderStrength, 0, 500, elasticModulus, 25.0);
    }

    public static MaterialSpec timber(String grade, double bendingStress, double shearStress,
                                      double elasticModulus, double density) {
        return new MaterialSpec(grade, MaterialKind.TIMBER, bendingStress, shearStress, 0, elasticModulus, density);
    }

    public MaterialSpec withReinforcementStrength(double fyk) {
        return new MaterialSpec(grade, kind, strength, shearStrength, fyk, elasticModulus, density);
    }

    public String getDescription() {
        return switch (kind) {
            case STEEL -> String.format(Locale.ROOT, "%s steel, fy = %.0f MPa, E = %.0f MPa", grade, strength, elasticModulus);
            case CONCRETE -> String.format(Locale.ROOT, "%s concrete, fck = %.0f MPa, fyk = %.0f MPa", grade, strength, reinforcementStrength);
            case TIMBER -> String.format(Locale.ROOT, "%s timber, bending %.2f MPa, shear %.2f MPa", grade, strength, shearStrength);
        };
    }
}
