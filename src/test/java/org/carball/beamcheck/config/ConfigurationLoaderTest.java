package org.carball.beamcheck.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private ConfigurationLoader loader;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        loader = new ConfigurationLoader(Map.of());

        logger = (Logger) LoggerFactory.getLogger(ConfigurationLoader.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setLevel(null);
        logger.setAdditive(true);
    }

    private static Path fixture() throws URISyntaxException {
        return Paths.get(ConfigurationLoaderTest.class.getResource("/constants/design-constants.yml").toURI());
    }

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        DesignCodeConstants constants = loader.loadConfiguration(new String[0]);

        // Then
        assertThat(constants.getKelPerLane()).isEqualTo(120.0);
        assertThat(constants.getHaShortSpanCoefficient()).isEqualTo(336.0);
        assertThat(constants.getPublicAccessFactor()).isEqualTo(1.5);
        assertThat(constants.getSteelSafetyFactor()).isEqualTo(1.05);
    }

    @Test
    void shouldParseCLIArguments() {
        // Given
        String[] args = {
                "girder.yml",
                "--constants.kel-per-lane", "110",
                "--constants.company-access-factor", "1.2",
                "--constants.default_impact_factor", "1.25"
        };

        // When
        DesignCodeConstants constants = loader.loadConfiguration(args);

        // Then
        assertThat(constants.getKelPerLane()).isEqualTo(110.0);
        assertThat(constants.getCompanyAccessFactor()).isEqualTo(1.2);
        assertThat(constants.getDefaultImpactFactor()).isEqualTo(1.25);
    }

    @Test
    void shouldApplyEnvironmentVariables() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of(
                "BEAMCHECK_KEL_PER_LANE", "130",
                "BEAMCHECK_CONCRETE_SAFETY_FACTOR", "1.4"));

        // When
        DesignCodeConstants constants = envLoader.loadConfiguration(new String[0]);

        // Then
        assertThat(constants.getKelPerLane()).isEqualTo(130.0);
        assertThat(constants.getConcreteSafetyFactor()).isEqualTo(1.4);
    }

    @Test
    void shouldPreferCLIOverEnvironmentOverFile() throws URISyntaxException {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of(
                "BEAMCHECK_KEL_PER_LANE", "130",
                "BEAMCHECK_PUBLIC_ACCESS_FACTOR", "1.45"));
        String[] args = {"--constants.kel-per-lane", "140"};

        // When
        DesignCodeConstants constants = envLoader.loadConfiguration(fixture(), args);

        // Then - CLI > env vars > file > defaults
        assertThat(constants.getKelPerLane()).isEqualTo(140.0);
        assertThat(constants.getPublicAccessFactor()).isEqualTo(1.45);
        assertThat(constants.getSteelSafetyFactor()).isEqualTo(1.1);
        assertThat(constants.getHaShortSpanCoefficient()).isEqualTo(336.0);
    }

    @Test
    void shouldLoadConstantsFile() throws URISyntaxException {
        // When
        DesignCodeConstants constants = loader.loadConstantsFile(fixture());

        // Then
        assertThat(constants.getKelPerLane()).isEqualTo(100.0);
        assertThat(constants.getPublicAccessFactor()).isEqualTo(1.4);
        assertThat(constants.getSteelSafetyFactor()).isEqualTo(1.1);
        assertThat(constants.getConcreteSafetyFactor()).isEqualTo(1.5);
    }

    @Test
    void shouldFallBackToDefaultsForMissingFile() {
        // When
        DesignCodeConstants constants = loader.loadConstantsFile(tempDir.resolve("missing.yml"));

        // Then
        assertThat(constants.getKelPerLane()).isEqualTo(120.0);
        assertThat(logAppender.list)
                .anyMatch(event -> event.getLevel() == Level.WARN
                        && event.getFormattedMessage().contains("Constants file not found"));
    }

    @Test
    void shouldFallBackToDefaultsForUnknownKey() throws IOException {
        // Given
        Path file = tempDir.resolve("typo.yml");
        Files.writeString(file, "kel_per_lan: 90\n");

        // When
        DesignCodeConstants constants = loader.loadConstantsFile(file);

        // Then
        assertThat(constants.getKelPerLane()).isEqualTo(120.0);
        assertThat(logAppender.list)
                .anyMatch(event -> event.getLevel() == Level.ERROR
                        && event.getFormattedMessage().contains("Failed to load constants"));
    }

    @Test
    void shouldIgnoreInvalidNumericValue() {
        // Given
        String[] args = {"--constants.kel-per-lane", "lots"};

        // When
        DesignCodeConstants constants = loader.loadConfiguration(args);

        // Then
        assertThat(constants.getKelPerLane()).isEqualTo(120.0);
        assertThat(logAppender.list)
                .anyMatch(event -> event.getLevel() == Level.WARN
                        && event.getFormattedMessage().contains("Invalid numeric value for --constants.kel-per-lane"));
    }

    @Test
    void shouldWarnOnUnknownConstant() {
        // Given
        String[] args = {"--constants.lane-factor", "2"};

        // When
        loader.loadConfiguration(args);

        // Then
        assertThat(logAppender.list)
                .anyMatch(event -> event.getLevel() == Level.WARN
                        && event.getFormattedMessage().contains("Unknown design constant: --constants.lane-factor"));
    }

    @Test
    void shouldListEveryConstantInHelp() {
        // When
        String help = ConfigurationLoader.getConstantsHelp();

        // Then
        assertThat(help)
                .contains("kel_per_lane")
                .contains("--constants.kel-per-lane")
                .contains("BEAMCHECK_KEL_PER_LANE")
                .contains("Priority Order");
    }
}
