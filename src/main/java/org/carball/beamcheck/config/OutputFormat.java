package org.carball.beamcheck.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
