package org.carball.beamcheck.catalog;

import org.carball.beamcheck.model.load.VehicleSpec;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Two-axle assessment vehicles by gross weight. Nominal axle loads in kN, spacing in m.
 */
public final class VehicleCatalog {

    private static final Map<String, VehicleSpec> VEHICLES;

    static {
        Map<String, VehicleSpec> vehicles = new LinkedHashMap<>();
        vehicles.put("3 tonne", preset("3 tonne", 11.0, 18.5, 2.0));
        vehicles.put("7.5 tonne", preset("7.5 tonne", 26.0, 48.0, 2.6));
        vehicles.put("18 tonne", preset("18 tonne", 64.0, 113.0, 3.0));
        VEHICLES = Map.copyOf(vehicles);
    }

    private VehicleCatalog() {
    }

    private static VehicleSpec preset(String type, double front, double rear, double spacing) {
        return VehicleSpec.builder()
                .vehicleType(type)
                .frontAxleLoad(front)
                .rearAxleLoad(rear)
                .axleSpacing(spacing)
                .build();
    }

    /**
     * Looks up a preset, accepting "18 tonne", "18t", "18-tonne" and similar spellings.
     */
    public static Optional<VehicleSpec> find(String vehicleType) {
        if (vehicleType == null) {
            return Optional.empty();
        }
        String key = normalize(vehicleType);
        return VEHICLES.entrySet().stream()
                .filter(e -> normalize(e.getKey()).equals(key))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    public static boolean isNone(String vehicleType) {
        return vehicleType == null || vehicleType.isBlank() || "none".equalsIgnoreCase(vehicleType.trim());
    }

    public static String getAvailableVehicles() {
        return String.join(", ", new TreeSet<>(VEHICLES.keySet()));
    }

    private static String normalize(String type) {
        return type.toLowerCase(Locale.ROOT).replaceAll("[\\s_-]", "").replace("tonnes", "t").replace("tonne", "t");
    }
}
