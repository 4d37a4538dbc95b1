package org.carball.beamcheck.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.beamcheck.model.assessment.SafetyFactors;
import org.carball.beamcheck.model.load.AccessType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class DesignCodeConstantsTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(DesignCodeConstants.class);
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

    @Test
    void shouldValidateDefaultsWithoutWarnings() {
        // Given
        DesignCodeConstants constants = DesignCodeConstants.createDefaults();

        // When
        constants.validate();

        // Then
        List<ILoggingEvent> logs = logAppender.list;
        assertThat(logs).hasSize(1);
        assertThat(logs.get(0).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(logs.get(0).getFormattedMessage()).contains("Using design constants");
    }

    @Test
    void shouldWarnWhenAccessFactorReducesLoading() {
        // Given
        DesignCodeConstants constants = DesignCodeConstants.createDefaults();
        constants.setCompanyAccessFactor(0.9);

        // When
        constants.validate();

        // Then
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .singleElement()
                .satisfies(event -> assertThat(event.getFormattedMessage())
                        .contains("Access factors (company 0.9, public 1.5)"));
    }

    @Test
    void shouldWarnWhenSafetyFactorBelowOne() {
        // Given
        DesignCodeConstants constants = DesignCodeConstants.createDefaults();
        constants.setTimberSafetyFactor(0.8);

        // When
        constants.validate();

        // Then
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .singleElement()
                .satisfies(event -> assertThat(event.getFormattedMessage())
                        .contains("Partial safety factors below 1.0"));
    }

    @Test
    void shouldPickAccessFactorByAccessType() {
        // Given
        DesignCodeConstants constants = DesignCodeConstants.createDefaults();

        // When/Then
        assertThat(constants.accessFactor(AccessType.COMPANY)).isEqualTo(1.3);
        assertThat(constants.accessFactor(AccessType.PUBLIC)).isEqualTo(1.5);
    }

    @Test
    void shouldBundleSafetyFactors() {
        // Given
        DesignCodeConstants constants = DesignCodeConstants.createDefaults();
        constants.setReinforcementSafetyFactor(1.2);

        // When
        SafetyFactors factors = constants.getDefaultSafetyFactors();

        // Then
        assertThat(factors).isEqualTo(new SafetyFactors(1.05, 1.5, 1.2, 1.0));
    }

    @Test
    void shouldDescribeConstants() {
        // When
        String description = DesignCodeConstants.createDefaults().getDescription();

        // Then
        assertThat(description)
                .contains("HA=336(1/L)^0.67")
                .contains("KEL=120 kN")
                .contains("access=1.30/1.50");
    }
}
