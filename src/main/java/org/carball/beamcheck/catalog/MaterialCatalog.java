package org.carball.beamcheck.catalog;

import org.carball.beamcheck.exception.UnknownMaterialException;
import org.carball.beamcheck.model.material.MaterialKind;
import org.carball.beamcheck.model.material.MaterialSpec;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Characteristic properties by grade. Steel to EN 10025, concrete cylinder strengths and mean
 * moduli to EN 1992-1-1 Table 3.1, timber grade stresses to BS 5268-2 Table 7.
 */
public final class MaterialCatalog {

    private static final Map<MaterialKind, Map<String, MaterialSpec>> CATALOG;

    static {
        Map<MaterialKind, Map<String, MaterialSpec>> catalog = new EnumMap<>(MaterialKind.class);

        Map<String, MaterialSpec> steel = new LinkedHashMap<>();
        add(steel, MaterialSpec.steel("S235", 235));
        add(steel, MaterialSpec.steel("S275", 275));
        add(steel, MaterialSpec.steel("S355", 355));
        add(steel, MaterialSpec.steel("S420", 420));
        add(steel, MaterialSpec.steel("S460", 460));
        catalog.put(MaterialKind.STEEL, Map.copyOf(steel));

        Map<String, MaterialSpec> concrete = new LinkedHashMap<>();
        add(concrete, MaterialSpec.concrete("C25/30", 25, 31_000));
        add(concrete, MaterialSpec.concrete("C28/35", 28, 32_000));
        add(concrete, MaterialSpec.concrete("C30/37", 30, 33_000));
        add(concrete, MaterialSpec.concrete("C32/40", 32, 33_500));
        add(concrete, MaterialSpec.concrete("C35/45", 35, 34_000));
        add(concrete, MaterialSpec.concrete("C40/50", 40, 35_000));
        add(concrete, MaterialSpec.concrete("C45/55", 45, 36_000));
        add(concrete, MaterialSpec.concrete("C50/60", 50, 37_000));
        catalog.put(MaterialKind.CONCRETE, Map.copyOf(concrete));

        Map<String, MaterialSpec> timber = new LinkedHashMap<>();
        add(timber, MaterialSpec.timber("C16", 5.3, 0.67, 8_800, 5.0));
        add(timber, MaterialSpec.timber("C24", 7.5, 0.71, 10_800, 5.0));
        add(timber, MaterialSpec.timber("C27", 10.0, 1.10, 12_300, 5.0));
        add(timber, MaterialSpec.timber("D30", 9.0, 1.40, 9_500, 9.0));
        add(timber, MaterialSpec.timber("D40", 12.5, 2.00, 10_800, 9.0));
        add(timber, MaterialSpec.timber("D50", 16.0, 2.20, 15_000, 9.0));
        add(timber, MaterialSpec.timber("D70", 23.0, 2.60, 19_000, 9.0));
        catalog.put(MaterialKind.TIMBER, Map.copyOf(timber));

        CATALOG = Map.copyOf(catalog);
    }

    private MaterialCatalog() {
    }

    private static void add(Map<String, MaterialSpec> grades, MaterialSpec spec) {
        grades.put(normalize(spec.grade()), spec);
    }

    private static String normalize(String grade) {
        return grade.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
    }

    public static MaterialSpec resolve(String kind, String grade) {
        return resolve(MaterialKind.fromName(kind), grade);
    }

    public static MaterialSpec resolve(MaterialKind kind, String grade) {
        if (kind == null) {
            throw new UnknownMaterialException("material", "Material kind not specified");
        }
        if (grade == null || grade.isBlank()) {
            throw new UnknownMaterialException("grade", "No grade given for " + kind.getDisplayName().toLowerCase(Locale.ROOT));
        }

        MaterialSpec spec = CATALOG.get(kind).get(normalize(grade));
        if (spec == null) {
            throw new UnknownMaterialException("grade", "Unknown " + kind.getDisplayName().toLowerCase(Locale.ROOT) +
                    " grade: " + grade + ". Available grades: " + String.join(", ", availableGrades(kind)));
        }
        return spec;
    }

    public static Set<String> availableGrades(MaterialKind kind) {
        return new TreeSet<>(CATALOG.get(kind).keySet());
    }
}
