package org.carball.beamcheck.model.assessment;

public enum AssessmentState {
    VALIDATING,
    RESOLVING,
    COMBINING,
    COMPARING,
    DONE,
    FAILED
}
