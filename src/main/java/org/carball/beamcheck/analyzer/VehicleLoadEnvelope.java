package org.carball.beamcheck.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.beamcheck.exception.InvalidVehicleSpacingException;
import org.carball.beamcheck.exception.ValidationException;
import org.carball.beamcheck.model.assessment.BridgeType;
import org.carball.beamcheck.model.assessment.CalculationLog;
import org.carball.beamcheck.model.load.VehicleEnvelope;
import org.carball.beamcheck.model.load.VehicleSpec;

import java.util.Locale;

/**
 * Worst-case placement of a two-axle vehicle on a single span, found in closed form.
 */
@Slf4j
public class VehicleLoadEnvelope {

    public VehicleEnvelope maxEnvelope(BridgeType bridgeType, double span, VehicleSpec vehicle) {
        return maxEnvelope(bridgeType, span, vehicle, new CalculationLog());
    }

    public VehicleEnvelope maxEnvelope(BridgeType bridgeType, double span, VehicleSpec vehicle,
                                       CalculationLog calculation) {
        if (vehicle == null) {
            return VehicleEnvelope.none();
        }
        validate(span, vehicle);

        double multiplier = vehicle.getLoadMultiplier();
        String factors = String.format(Locale.ROOT, "impact %.2f, dispersion %.1f%%, %s sharing",
                vehicle.getImpactFactor(), vehicle.getDispersion(), vehicle.getSharingMode().name().toLowerCase(Locale.ROOT));
        double front = calculation.record("Vehicle front axle design load",
                vehicle.getFrontAxleLoad() * multiplier, "kN", factors);
        double rear = calculation.record("Vehicle rear axle design load",
                vehicle.getRearAxleLoad() * multiplier, "kN", factors);
        double spacing = vehicle.getAxleSpacing();

        VehicleEnvelope envelope = bridgeType == BridgeType.CANTILEVER
                ? cantilever(span, front, rear, spacing)
                : simplySupported(span, front, rear, spacing);

        calculation.record("Vehicle maximum moment", envelope.maxMoment(), "kNm",
                String.format(Locale.ROOT, "%s axle at %.3f m", envelope.governingAxle(), envelope.criticalPosition()));
        calculation.record("Vehicle maximum shear", envelope.maxShear(), "kN");

        log.debug("Vehicle envelope on {} m span: M = {} kNm, V = {} kN", span, envelope.maxMoment(), envelope.maxShear());
        return envelope;
    }

    /**
     * Maximum moment under a governing axle G with the other axle O at spacing s. The midspan
     * bisects the distance between G and the resultant R, which lies d = O·s/R from G, giving
     * M = R·(L − d)² / 4L. If O would then fall off the span, G alone at midspan governs.
     */
    static double momentUnderAxle(double span, double governing, double other, double spacing) {
        double resultant = governing + other;
        double offset = other * spacing / resultant;
        double position = (span - offset) / 2.0;

        double pair = position + spacing <= span
                ? resultant * Math.pow(span - offset, 2) / (4.0 * span)
                : 0.0;
        double single = governing * span / 4.0;
        return Math.max(pair, single);
    }

    /**
     * Position of the governing axle from the left support for whichever placement governs.
     */
    static double criticalPosition(double span, double governing, double other, double spacing) {
        double resultant = governing + other;
        double offset = other * spacing / resultant;
        double position = (span - offset) / 2.0;
        if (position + spacing > span) {
            return span / 2.0;
        }
        double pair = resultant * Math.pow(span - offset, 2) / (4.0 * span);
        return pair >= governing * span / 4.0 ? position : span / 2.0;
    }

    /**
     * Support shear with one axle over the support and the other s inside the span.
     */
    static double shearWithAxleAtSupport(double span, double atSupport, double inside, double spacing) {
        return atSupport + inside * (span - spacing) / span;
    }

    private VehicleEnvelope simplySupported(double span, double front, double rear, double spacing) {
        double frontGoverning = momentUnderAxle(span, front, rear, spacing);
        double rearGoverning = momentUnderAxle(span, rear, front, spacing);

        String governingAxle;
        double maxMoment;
        double position;
        if (rearGoverning >= frontGoverning) {
            governingAxle = "rear";
            maxMoment = rearGoverning;
            position = criticalPosition(span, rear, front, spacing);
        } else {
            governingAxle = "front";
            maxMoment = frontGoverning;
            position = criticalPosition(span, front, rear, spacing);
        }

        double maxShear = Math.max(
                shearWithAxleAtSupport(span, front, rear, spacing),
                shearWithAxleAtSupport(span, rear, front, spacing));

        return new VehicleEnvelope(maxMoment, maxShear, position, governingAxle, front, rear);
    }

    private VehicleEnvelope cantilever(double span, double front, double rear, double spacing) {
        // heavier axle at the free end, lighter axle s towards the root
        boolean rearHeavier = rear >= front;
        double heavy = rearHeavier ? rear : front;
        double light = rearHeavier ? front : rear;

        double maxMoment = heavy * span + light * (span - spacing);
        double maxShear = front + rear;
        return new VehicleEnvelope(maxMoment, maxShear, span, rearHeavier ? "rear" : "front", front, rear);
    }

    private void validate(double span, VehicleSpec vehicle) {
        if (!Double.isFinite(vehicle.getFrontAxleLoad()) || vehicle.getFrontAxleLoad() < 0) {
            throw new ValidationException("front_axle_load",
                    "Front axle load must not be negative, got " + vehicle.getFrontAxleLoad());
        }
        if (!Double.isFinite(vehicle.getRearAxleLoad()) || vehicle.getRearAxleLoad() < 0) {
            throw new ValidationException("rear_axle_load",
                    "Rear axle load must not be negative, got " + vehicle.getRearAxleLoad());
        }
        if (vehicle.getFrontAxleLoad() + vehicle.getRearAxleLoad() <= 0) {
            throw new ValidationException("vehicle_type", "Vehicle axle loads must not both be zero");
        }
        if (!Double.isFinite(vehicle.getAxleSpacing()) || vehicle.getAxleSpacing() <= 0) {
            throw new InvalidVehicleSpacingException("axle_spacing",
                    "Axle spacing must be positive, got " + vehicle.getAxleSpacing());
        }
        if (vehicle.getAxleSpacing() >= span) {
            throw new InvalidVehicleSpacingException("axle_spacing", String.format(Locale.ROOT,
                    "Axle spacing %.2f m does not fit on a %.2f m span", vehicle.getAxleSpacing(), span));
        }
        if (!Double.isFinite(vehicle.getImpactFactor()) || vehicle.getImpactFactor() < 1.0) {
            throw new ValidationException("impact_factor",
                    "Impact factor must be at least 1.0, got " + vehicle.getImpactFactor());
        }
        if (!(vehicle.getDispersion() >= 0 && vehicle.getDispersion() < 100)) {
            throw new ValidationException("dispersion",
                    "Dispersion must be between 0 and 100 percent, got " + vehicle.getDispersion());
        }
    }
}
