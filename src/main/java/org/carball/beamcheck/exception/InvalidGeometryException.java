package org.carball.beamcheck.exception;

public class InvalidGeometryException extends AssessmentException {

    public InvalidGeometryException(String field, String message) {
        super(ErrorKind.INVALID_GEOMETRY, field, message);
    }
}
