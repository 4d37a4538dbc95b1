package org.carball.beamcheck.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.beamcheck.analyzer.AssessmentEngine;
import org.carball.beamcheck.catalog.MaterialCatalog;
import org.carball.beamcheck.catalog.VehicleCatalog;
import org.carball.beamcheck.config.BeamCheckConfig;
import org.carball.beamcheck.config.ConfigurationLoader;
import org.carball.beamcheck.config.DesignCodeConstants;
import org.carball.beamcheck.config.OutputFormat;
import org.carball.beamcheck.model.assessment.AssessmentError;
import org.carball.beamcheck.model.assessment.AssessmentOutcome;
import org.carball.beamcheck.model.assessment.AssessmentResult;
import org.carball.beamcheck.model.assessment.CalculationStep;
import org.carball.beamcheck.model.material.MaterialKind;
import org.carball.beamcheck.output.AssessmentReport;
import org.carball.beamcheck.parser.AssessmentInputParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

@Slf4j
public class BeamCheckCLI {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_ASSESSMENT_FAILED = 2;

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║        Bridge Member Capacity Assessment (beamcheck) v%s    ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? EXIT_ERROR : EXIT_OK;
        }

        try {
            BeamCheckConfig config = parseArgs(args);

            System.out.println("\n🔍 Starting assessment...");
            System.out.println("   Parameters: " + config.getInputFile());
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output: " + baseFileName + ".json, " + baseFileName + ".md");
            } else {
                System.out.println("   Output: " + config.getOutputFile());
            }
            System.out.println();

            System.out.print("📄 Reading parameters... ");
            Map<String, Object> parameters = AssessmentInputParser.readParameters(config.getInputFile());
            System.out.println("✓");

            System.out.print("📐 Assessing member... ");
            AssessmentOutcome outcome = new AssessmentEngine(config.getConstants()).assess(parameters);
            System.out.println("✓");

            System.out.print("📝 Writing results... ");
            outputResults(outcome, config);
            System.out.println("✓");

            printSummary(outcome, config.isVerbose());

            if (!outcome.isSuccessful()) {
                System.out.println("\n⚠️  Assessment could not be completed.");
                return EXIT_ASSESSMENT_FAILED;
            }
            boolean passed = outcome.getResult().map(AssessmentResult::isPassed).orElse(false);
            System.out.println(passed ? "\n✅ Member is adequate." : "\n❌ Member is inadequate for the assessed loading.");
            return passed ? EXIT_OK : EXIT_ASSESSMENT_FAILED;

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_ERROR;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_ERROR;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar beamcheck.jar <parameters-file> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  parameters-file     Assessment parameters (.yml, .yaml or .json)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the report (default: assessment.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --constants         YAML file with design code constants (optional)");
        System.out.println("  --constants.<name>  Override a single design constant, e.g. --constants.kel-per-lane 120");
        System.out.println("  --verbose, -v       Print the calculation process");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println("Available grades:");
        for (MaterialKind kind : MaterialKind.values()) {
            System.out.printf("  %-10s %s%n", kind.getDisplayName(), String.join(", ", MaterialCatalog.availableGrades(kind)));
        }
        System.out.println();
        System.out.println("Vehicle presets: " + VehicleCatalog.getAvailableVehicles());
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  # Assess a steel girder and write a JSON report");
        System.out.println("  java -jar beamcheck.jar girder.yml");
        System.out.println();
        System.out.println("  # Markdown and JSON reports with the calculation narrative on screen");
        System.out.println("  java -jar beamcheck.jar girder.yml --format both --output reports/girder -v");
        System.out.println();
        System.out.println(ConfigurationLoader.getConstantsHelp());
    }

    static BeamCheckConfig parseArgs(String[] args) {
        BeamCheckConfig config = new BeamCheckConfig();
        config.setInputFile(Paths.get(args[0]));

        config.setOutputFile("assessment.json");
        config.setOutputFormat(OutputFormat.JSON);
        config.setVerbose(false);

        Path constantsFile = null;

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--constants.")) {
                // handled by ConfigurationLoader
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Value not specified for " + arg);
                }
                i++;
                continue;
            }

            switch (arg) {
                case "--output":
                case "-o":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output file not specified");
                    }
                    config.setOutputFile(args[++i]);
                    break;

                case "--format":
                case "-f":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output format not specified");
                    }
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(args[++i].toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--constants":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Constants file not specified");
                    }
                    constantsFile = Paths.get(args[++i]);
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        String baseFileName = removeFileExtension(config.getOutputFile());
        if (config.getOutputFormat() == OutputFormat.MARKDOWN) {
            config.setOutputFile(baseFileName + ".md");
        } else {
            config.setOutputFile(baseFileName + ".json");
        }

        DesignCodeConstants constants = new ConfigurationLoader().loadConfiguration(constantsFile, args);
        config.setConstants(constants);

        validateConfig(config);
        return config;
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void validateConfig(BeamCheckConfig config) {
        if (!Files.exists(config.getInputFile())) {
            throw new IllegalArgumentException("Parameters file not found: " + config.getInputFile());
        }

        String name = config.getInputFile().getFileName().toString().toLowerCase(Locale.ROOT);
        if (!name.endsWith(".yml") && !name.endsWith(".yaml") && !name.endsWith(".json")) {
            throw new IllegalArgumentException("Parameters file must be a .yml, .yaml or .json file");
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static void outputResults(AssessmentOutcome outcome, BeamCheckConfig config) throws IOException {
        AssessmentReport report = new AssessmentReport(outcome);
        String baseFileName = removeFileExtension(config.getOutputFile());

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".json"), report.toJson());
        }

        if (config.getOutputFormat() == OutputFormat.MARKDOWN || config.getOutputFormat() == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".md"), report.toMarkdown());
        }
    }

    private static void printSummary(AssessmentOutcome outcome, boolean verbose) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 ASSESSMENT SUMMARY");
        System.out.println("=".repeat(60));

        if (!outcome.isSuccessful()) {
            AssessmentError error = outcome.getError().orElseThrow();
            System.out.println("\n" + error.getDisplayMessage());
            System.out.println("Stopped while " + error.state().name().toLowerCase(Locale.ROOT));
            return;
        }

        AssessmentResult result = outcome.getResult().orElseThrow();
        System.out.println("\n" + result.getBridgeType().getDisplayName() + ", span " + result.getSpanLength() + " m");
        System.out.println(result.getMaterial().getDescription());

        System.out.println();
        System.out.printf("%-10s %12s %12s %8s%n", "", "Applied", "Capacity", "Ratio");
        System.out.println("-".repeat(46));
        System.out.printf("%-10s %8.1f kNm %8.1f kNm %8.2f  %s%n", "Moment",
                result.getDemand().getTotalMoment(), result.getCapacity().momentCapacity(),
                result.getMomentUtilisation(), result.isMomentAdequate() ? "🟢" : "🔴");
        System.out.printf("%-10s %8.1f kN  %8.1f kN  %8.2f  %s%n", "Shear",
                result.getDemand().getTotalShear(), result.getCapacity().shearCapacity(),
                result.getShearUtilisation(), result.isShearAdequate() ? "🟢" : "🔴");

        if (result.getVehicleEnvelope().isPresent()) {
            System.out.printf("%nVehicle: %.1f kNm, %.1f kN (%s axle governs)%n",
                    result.getVehicleEnvelope().maxMoment(), result.getVehicleEnvelope().maxShear(),
                    result.getVehicleEnvelope().governingAxle());
        }

        if (verbose) {
            System.out.println("\n🧮 Calculation Process:");
            System.out.println("-".repeat(60));
            int stepNum = 1;
            for (CalculationStep step : result.getSteps()) {
                System.out.printf("%3d. %s%n", stepNum++, step.format());
            }
        }
    }
}
