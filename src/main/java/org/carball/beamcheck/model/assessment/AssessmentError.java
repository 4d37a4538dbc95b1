package org.carball.beamcheck.model.assessment;

import org.carball.beamcheck.exception.ErrorKind;

/**
 * @param state the engine state in which the assessment stopped
 */
public record AssessmentError(ErrorKind kind, String field, String message, AssessmentState state) {

    public String getDisplayMessage() {
        return kind.getDisplayName() + " (" + field + "): " + message;
    }
}
