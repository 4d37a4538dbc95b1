package org.carball.beamcheck.exception;

public class UnknownMaterialException extends AssessmentException {

    public UnknownMaterialException(String field, String message) {
        super(ErrorKind.UNKNOWN_MATERIAL, field, message);
    }
}
