package org.carball.beamcheck.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.beamcheck.catalog.SlendernessCurve;
import org.carball.beamcheck.exception.ValidationException;
import org.carball.beamcheck.model.assessment.CalculationLog;
import org.carball.beamcheck.model.assessment.EffectiveLength;
import org.carball.beamcheck.model.assessment.EffectiveLengthFactors;
import org.carball.beamcheck.model.section.SectionGeometry;
import org.carball.beamcheck.model.section.SteelSection;

import java.util.Locale;

@Slf4j
public class EffectiveLengthResolver {

    public EffectiveLength resolve(double actualLength, EffectiveLengthFactors factors, SectionGeometry section) {
        return resolve(actualLength, factors, section, new CalculationLog());
    }

    /**
     * Effective length is k1·k2·L. Only steel sections are checked for lateral-torsional
     * buckling; concrete and timber always get a reduction factor of 1.0.
     */
    public EffectiveLength resolve(double actualLength, EffectiveLengthFactors factors,
                                   SectionGeometry section, CalculationLog calculation) {
        if (!Double.isFinite(actualLength) || actualLength <= 0) {
            throw new ValidationException("effective_member_length",
                    "Unrestrained length must be positive, got " + actualLength);
        }
        if (!Double.isFinite(factors.k1()) || factors.k1() <= 0) {
            throw new ValidationException("k1", "Effective length factor k1 must be positive, got " + factors.k1());
        }
        if (!Double.isFinite(factors.k2()) || factors.k2() <= 0) {
            throw new ValidationException("k2", "Effective length factor k2 must be positive, got " + factors.k2());
        }

        double effectiveLength = calculation.record("Effective length Le = k1·k2·L",
                factors.k1() * factors.k2() * actualLength, "m",
                String.format(Locale.ROOT, "k1 = %.2f, k2 = %.2f, L = %.2f m", factors.k1(), factors.k2(), actualLength));

        if (!(section instanceof SteelSection steel)) {
            calculation.record("Lateral-torsional buckling reduction factor", 1.0, "",
                    "not applicable to " + section.getMaterialKind().getDisplayName().toLowerCase(Locale.ROOT));
            return new EffectiveLength(actualLength, effectiveLength, 0.0, 1.0);
        }

        double radius = steel.getMinorRadiusOfGyration();
        double slenderness = calculation.record("Slenderness Le/ry", effectiveLength * 1000.0 / radius, "",
                String.format(Locale.ROOT, "ry = %.1f mm", radius));
        double reduction = calculation.record("Lateral-torsional buckling reduction factor",
                SlendernessCurve.reductionFactor(slenderness), "");

        log.debug("Effective length {} m, slenderness {}, reduction {}", effectiveLength, slenderness, reduction);
        return new EffectiveLength(actualLength, effectiveLength, slenderness, reduction);
    }
}
