package org.carball.beamcheck.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class BeamCheckConfig {
    private Path inputFile;
    private String outputFile;
    private OutputFormat outputFormat;
    private boolean verbose;
    private DesignCodeConstants constants;
}
