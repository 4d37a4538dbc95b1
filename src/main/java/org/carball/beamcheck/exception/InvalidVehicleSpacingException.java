package org.carball.beamcheck.exception;

public class InvalidVehicleSpacingException extends AssessmentException {

    public InvalidVehicleSpacingException(String field, String message) {
        super(ErrorKind.INVALID_VEHICLE_SPACING, field, message);
    }
}
