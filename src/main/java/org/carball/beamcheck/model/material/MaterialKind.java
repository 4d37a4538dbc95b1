package org.carball.beamcheck.model.material;

import org.carball.beamcheck.exception.UnknownMaterialException;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum MaterialKind {
    STEEL("Steel"),
    CONCRETE("Concrete"),
    TIMBER("Timber");

    private final String displayName;

    MaterialKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Finds a material kind by name (case-insensitive).
     */
    public static MaterialKind fromName(String name) {
        if (name != null) {
            for (MaterialKind kind : values()) {
                if (kind.name().equalsIgnoreCase(name.trim()) || kind.displayName.equalsIgnoreCase(name.trim())) {
                    return kind;
                }
            }
        }
        throw new UnknownMaterialException("material", "Unknown material: " + name +
                ". Available materials: " + Arrays.stream(values())
                .map(MaterialKind::getDisplayName)
                .collect(Collectors.joining(", ")));
    }
}
