package org.carball.beamcheck.exception;

public class UnsupportedMaterialException extends AssessmentException {

    public UnsupportedMaterialException(String field, String message) {
        super(ErrorKind.UNSUPPORTED_MATERIAL, field, message);
    }
}
