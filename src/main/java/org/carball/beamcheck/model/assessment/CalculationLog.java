package org.carball.beamcheck.model.assessment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only narrative of a single assessment run.
 */
public class CalculationLog {

    private final List<CalculationStep> steps = new ArrayList<>();

    public double record(String label, double value, String unit) {
        return record(label, value, unit, "");
    }

    /**
     * Appends a step and returns the value so calls can be inlined into the calculation.
     */
    public double record(String label, double value, String unit, String detail) {
        steps.add(new CalculationStep(label, value, unit, detail));
        return value;
    }

    public List<CalculationStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public int size() {
        return steps.size();
    }
}
