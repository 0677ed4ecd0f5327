package org.carball.pvadvisor.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.pvadvisor.model.analysis.DataCategory;
import org.carball.pvadvisor.model.analysis.SheetScore;
import org.carball.pvadvisor.model.recommendation.DomainInsights;
import org.carball.pvadvisor.model.recommendation.FilterSuggestion;
import org.carball.pvadvisor.model.recommendation.FilterType;
import org.carball.pvadvisor.model.recommendation.Recommendation;
import org.carball.pvadvisor.model.recommendation.RecommendationSource;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationReportTest {

    private static final LocalDateTime GENERATED = LocalDateTime.of(2024, 6, 1, 9, 30, 15);

    @Test
    void shouldSerializeRecommendationWithWireNames() throws Exception {
        // Given
        RecommendationReport report = new RecommendationReport(sampleRecommendation(), "plant.json", GENERATED);

        // When
        JsonNode json = new ObjectMapper().readTree(report.toJson());

        // Then
        assertThat(json.path("generatedAt").asText()).isEqualTo("2024-06-01T09:30:15");
        assertThat(json.path("sourceFile").asText()).isEqualTo("plant.json");

        JsonNode rec = json.path("recommendation");
        assertThat(rec.path("selectedSheet").asText()).isEqualTo("Hourly");
        assertThat(rec.path("confidence").asDouble()).isEqualTo(0.85);
        assertThat(rec.path("category").asText()).isEqualTo("GENERATION");
        assertThat(rec.path("source").asText()).isEqualTo("RULE_BASED");
        assertThat(rec.path("recommendedFields").size()).isEqualTo(2);
        assertThat(rec.path("suggestedFilters").get(0).path("type").asText()).isEqualTo("date_range");
        assertThat(rec.path("suggestedFilters").get(0).path("column").asText()).isEqualTo("Timestamp");
        assertThat(rec.path("domainInsights").path("weatherFactors").get(0).asText()).isEqualTo("irradiance");
        assertThat(rec.path("sheetScores").get(1).path("score").asInt()).isEqualTo(85);
        assertThat(rec.has("empty")).isFalse();
    }

    @Test
    void shouldRenderMarkdownSections() {
        // Given
        RecommendationReport report = new RecommendationReport(sampleRecommendation(), "plant.json", GENERATED);

        // When
        String markdown = report.toMarkdown();

        // Then
        assertThat(markdown)
                .contains("# PV Sheet Recommendation Report")
                .contains("**Generated:** 2024-06-01T09:30:15")
                .contains("## PV Solar Generation Data")
                .contains("| Selected Sheet | Hourly |")
                .contains("| Confidence | 85% |")
                .contains("- `Power_kW`")
                .contains("| date_range | `Timestamp` | Filter by Timestamp to prioritise recent data |")
                .contains("- **Weather Factors:** irradiance, temperature")
                .contains("| Hourly | 85 |")
                .doesNotContain("Maintenance Patterns");
    }

    @Test
    void shouldExplainEmptyRecommendation() {
        RecommendationReport report = new RecommendationReport(Recommendation.empty(), "empty.json", GENERATED);

        assertThat(report.toMarkdown()).contains("no recommendation is available");
        assertThat(report.toJson()).contains("\"selectedSheet\" : \"\"");
    }

    private Recommendation sampleRecommendation() {
        return Recommendation.builder()
                .selectedSheet("Hourly")
                .confidence(0.85)
                .recommendedFields(List.of("Power_kW", "Timestamp"))
                .title("PV Solar Generation Data")
                .description("8760 records of PV solar data across 3 fields.")
                .category(DataCategory.GENERATION)
                .insights(List.of("Time-series trend analysis possible"))
                .domainInsights(DomainInsights.builder()
                        .weatherFactors(List.of("irradiance", "temperature"))
                        .build())
                .suggestedFilters(List.of(new FilterSuggestion(FilterType.DATE_RANGE, "Timestamp",
                        "Filter by Timestamp to prioritise recent data")))
                .source(RecommendationSource.RULE_BASED)
                .structure("PV Solar data (8760 rows x 3 columns)")
                .recordCount(8760)
                .columnCount(3)
                .sheetScores(List.of(new SheetScore("Summary", 45), new SheetScore("Hourly", 85)))
                .build();
    }
}
