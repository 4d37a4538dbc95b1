package org.carball.beamcheck.model.assessment;

import java.util.Locale;

/**
 * One line of the calculation narrative.
 *
 * @param detail inputs the value was derived from; may be empty
 */
public record CalculationStep(String label, double value, String unit, String detail) {

    public String format() {
        StringBuilder line = new StringBuilder(label).append(": ")
                .append(String.format(Locale.ROOT, "%.3f", value));
        if (unit != null && !unit.isEmpty()) {
            line.append(' ').append(unit);
        }
        if (detail != null && !detail.isEmpty()) {
            line.append(" (").append(detail).append(')');
        }
        return line.toString();
    }
}
