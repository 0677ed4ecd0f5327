package org.carball.pvadvisor.ai;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AIResponseParserTest {

    private AIResponseParser parser;

    @BeforeEach
    void setUp() {
        parser = new AIResponseParser();
    }

    @Test
    void shouldParsePlainJson() {
        // Given
        String text = """
            {
              "title": "Plant A",
              "description": "Hourly output",
              "insights": ["Peak at noon"],
              "recommendedFields": ["Date", "Power"],
              "pvSolarInsights": {
                "peakProductionTimes": ["11:00-13:00"],
                "weatherFactors": ["irradiance"],
                "maintenancePatterns": [],
                "performanceMetrics": ["PR"]
              }
            }
            """;

        // When
        AIResult result = parser.parse(text);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getResponse().getTitle()).isEqualTo("Plant A");
        assertThat(result.getResponse().getRecommendedFields()).containsExactly("Date", "Power");
        assertThat(result.getResponse().getPvSolarInsights().getPerformanceMetrics()).containsExactly("PR");
    }

    @Test
    void shouldParseFencedJsonBlock() {
        AIResult result = parser.parse("Sure!\n```json\n{\"recommendedFields\":[\"X\"]}\n```\nDone.");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getResponse().getRecommendedFields()).containsExactly("X");
    }

    @Test
    void shouldParseBraceSpanInsideProse() {
        AIResult result = parser.parse("Analysis: {\"title\": \"Rooftop\", \"unknownField\": 3} hope this helps");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getResponse().getTitle()).isEqualTo("Rooftop");
        assertThat(result.getResponse().getRecommendedFields()).isNull();
    }

    @Test
    void shouldCoerceScalarListEntriesToText() {
        AIResult result = parser.parse("{\"insights\": [\"a\", 42, true]}");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getResponse().getInsights()).containsExactly("a", "42", "true");
    }

    @Test
    void shouldRejectStructuredListEntries() {
        AIResult result = parser.parse("{\"recommendedFields\": [{\"name\": \"Date\"}]}");

        assertThat(result.isSuccess()).isFalse();
    }

    @Test
    void shouldFailOnEmptyText() {
        assertThat(parser.parse(null).getFailureReason()).isEqualTo("Empty AI response");
        assertThat(parser.parse("   ").getFailureReason()).isEqualTo("Empty AI response");
    }

    @Test
    void shouldFailWhenNoJsonPresent() {
        AIResult result = parser.parse("I could not analyse this sheet.");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureReason()).isEqualTo("No valid JSON found in AI response");
    }

    @Test
    void shouldRejectTopLevelArray() {
        assertThat(parser.parse("[\"Date\", \"Power\"]").isSuccess()).isFalse();
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThat(parser.parse("{\"title\": \"unterminated}").isSuccess()).isFalse();
    }
}
