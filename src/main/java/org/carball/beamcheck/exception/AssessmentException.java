package org.carball.beamcheck.exception;

import lombok.Getter;

/**
 * Base type for every failure the assessment engine reports. Carries the name of the input
 * parameter at fault so the message can be shown next to the offending form field.
 */
@Getter
public abstract class AssessmentException extends RuntimeException {

    private final String field;
    private final ErrorKind kind;

    protected AssessmentException(ErrorKind kind, String field, String message) {
        super(message);
        this.kind = kind;
        this.field = field;
    }

    protected AssessmentException(ErrorKind kind, String field, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.field = field;
    }
}
