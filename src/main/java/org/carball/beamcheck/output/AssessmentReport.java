package org.carball.beamcheck.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.beamcheck.model.assessment.AssessmentError;
import org.carball.beamcheck.model.assessment.AssessmentOutcome;
import org.carball.beamcheck.model.assessment.AssessmentResult;
import org.carball.beamcheck.model.assessment.CalculationStep;
import org.carball.beamcheck.model.load.LoadCase;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

@Slf4j
public class AssessmentReport {

    private static final String VERSION = "1.0.0";

    private final AssessmentOutcome outcome;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public AssessmentReport(AssessmentOutcome outcome) {
        this(outcome, LocalDateTime.now());
    }

    AssessmentReport(AssessmentOutcome outcome, LocalDateTime timestamp) {
        this.outcome = outcome;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Beam Capacity Assessment Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Assessor Version:** ").append(VERSION).append("  \n\n");

        if (!outcome.isSuccessful()) {
            AssessmentError error = outcome.getError().orElseThrow();
            md.append("## Assessment Failed\n\n");
            md.append("- **Error:** ").append(error.kind().getDisplayName()).append("\n");
            md.append("- **Field:** `").append(error.field()).append("`\n");
            md.append("- **Message:** ").append(error.message()).append("\n");
            return md.toString();
        }

        AssessmentResult result = outcome.getResult().orElseThrow();

        md.append("## Verdict\n\n");
        md.append(result.isPassed() ? "✅ **PASS**" : "❌ **FAIL**").append(" | ")
                .append(result.getBridgeType().getDisplayName()).append(" span of ")
                .append(format(result.getSpanLength())).append(" m, ")
                .append(result.getMaterial().getDescription()).append(".\n\n");

        md.append("## Summary\n\n");
        md.append("| Quantity | Value |\n");
        md.append("|----------|-------|\n");
        for (Map.Entry<String, Object> field : outcome.toFieldMap().entrySet()) {
            if (field.getValue() instanceof Number || field.getValue() instanceof String) {
                md.append("| ").append(field.getKey()).append(" | ").append(field.getValue()).append(" |\n");
            }
        }
        md.append("\n");

        md.append("## Additional Loads\n\n");
        if (result.getLoadCases().isEmpty()) {
            md.append("No additional loads were applied.\n\n");
        } else {
            md.append("| Description | Value | Type | Distribution | Material |\n");
            md.append("|-------------|-------|------|--------------|----------|\n");
            for (LoadCase load : result.getLoadCases()) {
                md.append("| ").append(load.description())
                        .append(" | ").append(format(load.magnitude())).append(" ").append(load.distribution().getUnit())
                        .append(" | ").append(load.type().name().toLowerCase(Locale.ROOT))
                        .append(" | ").append(load.distribution().name().toLowerCase(Locale.ROOT))
                        .append(" | ").append(load.loadMaterial()).append(" |\n");
            }
            md.append("\n");
        }

        md.append("## Calculation Process\n\n");
        int stepNum = 1;
        for (CalculationStep step : result.getSteps()) {
            md.append(stepNum++).append(". ").append(step.format()).append("\n");
        }
        return md.toString();
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setMetadata(new ReportMetadata(timestamp, VERSION, outcome.isSuccessful()));
        report.setResults(outcome.toFieldMap());
        return report;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    // Inner classes for JSON structure
    @lombok.Data
    @JsonPropertyOrder({"metadata", "results"})
    private static class ReportData {
        private ReportMetadata metadata;
        private Map<String, Object> results;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class ReportMetadata {
        private LocalDateTime timestamp;
        private String version;
        private boolean completed;
    }
}
