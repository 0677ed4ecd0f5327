package org.carball.pvadvisor.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.pvadvisor.model.analysis.SheetScore;
import org.carball.pvadvisor.model.recommendation.DomainInsights;
import org.carball.pvadvisor.model.recommendation.FilterSuggestion;
import org.carball.pvadvisor.model.recommendation.Recommendation;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

@Slf4j
public class RecommendationReport {

    private final Recommendation recommendation;
    private final String sourceFile;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public RecommendationReport(Recommendation recommendation, String sourceFile) {
        this(recommendation, sourceFile, LocalDateTime.now());
    }

    RecommendationReport(Recommendation recommendation, String sourceFile, LocalDateTime timestamp) {
        this.recommendation = recommendation;
        this.sourceFile = sourceFile;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            ReportData reportData = new ReportData();
            reportData.setGeneratedAt(timestamp);
            reportData.setSourceFile(sourceFile);
            reportData.setRecommendation(recommendation);
            return objectMapper.writeValueAsString(reportData);
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# PV Sheet Recommendation Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        if (sourceFile != null) {
            md.append("**Source File:** ").append(sourceFile).append("  \n");
        }
        md.append("\n");

        if (recommendation.isEmpty()) {
            md.append("**No sheets were found in the input, so no recommendation is available.**\n");
            return md.toString();
        }

        md.append("## ").append(recommendation.getTitle()).append("\n\n");
        md.append(recommendation.getDescription()).append("\n\n");

        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Selected Sheet | ").append(recommendation.getSelectedSheet()).append(" |\n");
        md.append("| Confidence | ").append(Math.round(recommendation.getConfidence() * 100)).append("% |\n");
        md.append("| Category | ").append(recommendation.getCategory()).append(" |\n");
        md.append("| Source | ").append(recommendation.getSource()).append(" |\n");
        md.append("| Structure | ").append(recommendation.getStructure()).append(" |\n\n");

        md.append("## Recommended Fields\n\n");
        for (String field : recommendation.getRecommendedFields()) {
            md.append("- `").append(field).append("`\n");
        }
        md.append("\n");

        List<FilterSuggestion> filters = recommendation.getSuggestedFilters();
        if (!filters.isEmpty()) {
            md.append("## Suggested Filters\n\n");
            md.append("| Type | Column | Description |\n");
            md.append("|------|--------|-------------|\n");
            for (FilterSuggestion filter : filters) {
                md.append("| ").append(filter.type().getWireName())
                        .append(" | `").append(filter.column())
                        .append("` | ").append(filter.description()).append(" |\n");
            }
            md.append("\n");
        }

        if (!recommendation.getInsights().isEmpty()) {
            md.append("## Insights\n\n");
            recommendation.getInsights().forEach(insight -> md.append("- ").append(insight).append("\n"));
            md.append("\n");
        }

        appendDomainInsights(md, recommendation.getDomainInsights());

        List<SheetScore> scores = recommendation.getSheetScores();
        if (!scores.isEmpty()) {
            md.append("## Sheet Scores\n\n");
            md.append("| Sheet | Score |\n");
            md.append("|-------|-------|\n");
            for (SheetScore score : scores) {
                md.append("| ").append(score.sheetName()).append(" | ").append(score.score()).append(" |\n");
            }
            md.append("\n");
        }

        return md.toString();
    }

    private void appendDomainInsights(StringBuilder md, DomainInsights insights) {
        if (insights == null) {
            return;
        }

        StringBuilder section = new StringBuilder();
        appendList(section, "Peak Production Times", insights.getPeakProductionTimes());
        appendList(section, "Weather Factors", insights.getWeatherFactors());
        appendList(section, "Maintenance Patterns", insights.getMaintenancePatterns());
        appendList(section, "Performance Metrics", insights.getPerformanceMetrics());

        if (!section.isEmpty()) {
            md.append("## PV Domain Insights\n\n").append(section).append("\n");
        }
    }

    private void appendList(StringBuilder md, String label, List<String> values) {
        if (values != null && !values.isEmpty()) {
            md.append("- **").append(label).append(":** ").append(String.join(", ", values)).append("\n");
        }
    }

    @lombok.Data
    private static class ReportData {
        private LocalDateTime generatedAt;
        private String sourceFile;
        private Recommendation recommendation;
    }
}
