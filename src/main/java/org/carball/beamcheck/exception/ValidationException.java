package org.carball.beamcheck.exception;

public class ValidationException extends AssessmentException {

    public ValidationException(String field, String message) {
        super(ErrorKind.VALIDATION, field, message);
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(ErrorKind.VALIDATION, field, message, cause);
    }

    public static ValidationException missing(String field) {
        return new ValidationException(field, "Required parameter '" + field + "' is missing");
    }
}
