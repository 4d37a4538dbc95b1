package org.carball.beamcheck.exception;

public class InvalidLoadingParametersException extends AssessmentException {

    public InvalidLoadingParametersException(String field, String message) {
        super(ErrorKind.INVALID_LOADING_PARAMETERS, field, message);
    }
}
