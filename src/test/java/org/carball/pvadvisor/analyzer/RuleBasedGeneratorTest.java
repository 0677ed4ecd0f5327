package org.carball.pvadvisor.analyzer;

import org.carball.pvadvisor.model.analysis.ColumnType;
import org.carball.pvadvisor.model.analysis.DataCategory;
import org.carball.pvadvisor.model.analysis.PatternProfile;
import org.carball.pvadvisor.narrative.DataFeature;
import org.carball.pvadvisor.narrative.InsightType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedGeneratorTest {

    private RuleBasedGenerator generator;
    private PatternAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        generator = new RuleBasedGenerator();
        analyzer = new PatternAnalyzer();
    }

    @Test
    void shouldRecommendFieldsInPriorityOrder() {
        // Given
        List<String> headers = List.of("Date", "Energy_kWh", "Temperature");
        PatternProfile profile = analyzer.analyze(headers, List.of(List.of("Date", "Energy_kWh", "Temperature")), null);

        // When
        RuleBasedAnalysis analysis = generator.generate("Daily", headers, profile, headers.size());

        // Then
        assertThat(analysis.recommendedFields()).containsExactly("Energy_kWh", "Date", "Temperature");
        assertThat(analysis.category()).isEqualTo(DataCategory.GENERATION);
        assertThat(analysis.correlationSupported()).isTrue();
        assertThat(analysis.features())
                .containsExactlyInAnyOrder(DataFeature.ENERGY, DataFeature.WEATHER, DataFeature.TIME);
    }

    @Test
    void shouldLimitEnergyFieldsToTwo() {
        List<String> headers = List.of("Power_AC", "Power_DC", "Energy_Total", "Timestamp");

        List<String> fields = generator.recommendFields(headers, profile(true, false, true, false, 10, 0));

        assertThat(fields).containsExactly("Power_AC", "Power_DC", "Timestamp");
    }

    @Test
    void shouldTakeOneFieldFromEachSecondaryGroup() {
        List<String> headers = List.of(
                "Power_AC", "Power_DC", "Timestamp", "Irradiance", "Efficiency", "Performance_Ratio");

        List<String> fields = generator.recommendFields(headers, profile(true, true, true, true, 10, 0));

        assertThat(fields).containsExactly("Power_AC", "Power_DC", "Timestamp", "Irradiance", "Efficiency");
    }

    @Test
    void shouldNotDuplicateHeadersMatchingSeveralGroups() {
        // "Production Time" is both an energy and a time field
        List<String> headers = List.of("Production Time", "Output");

        List<String> fields = generator.recommendFields(headers, profile(true, false, true, false, 10, 0));

        assertThat(fields).containsExactly("Production Time", "Output");
    }

    @Test
    void shouldSkipGroupsWithoutFlag() {
        List<String> headers = List.of("Temperature", "Date");

        List<String> fields = generator.recommendFields(headers, profile(false, false, false, false, 10, 0));

        assertThat(fields).isEmpty();
    }

    @Test
    void shouldRequireMoreThanFiftyRecordsForDegradationInsight() {
        assertThat(generator.insights(profile(false, false, false, true, 40, 0)))
                .doesNotContain(InsightType.PERFORMANCE_DEGRADATION);
        assertThat(generator.insights(profile(false, false, false, true, 50, 0)))
                .doesNotContain(InsightType.PERFORMANCE_DEGRADATION);
        assertThat(generator.insights(profile(false, false, false, true, 51, 0)))
                .contains(InsightType.PERFORMANCE_DEGRADATION);
    }

    @Test
    void shouldRequireMoreThanOneHundredRecordsForTrendInsight() {
        assertThat(generator.insights(profile(true, false, true, false, 100, 0)))
                .doesNotContain(InsightType.TIME_SERIES_TREND);
        assertThat(generator.insights(profile(true, false, true, false, 101, 0)))
                .containsExactly(InsightType.TIME_SERIES_TREND);
    }

    @Test
    void shouldOrderInsights() {
        List<InsightType> insights = generator.insights(profile(true, true, true, true, 500, 3));

        assertThat(insights).containsExactly(
                InsightType.TIME_SERIES_TREND,
                InsightType.WEATHER_CORRELATION,
                InsightType.PERFORMANCE_DEGRADATION,
                InsightType.STATISTICAL_MODELING);
    }

    @Test
    void shouldRequireMoreThanTwoNumericColumnsForModeling() {
        assertThat(generator.insights(profile(false, false, false, false, 10, 2))).isEmpty();
        assertThat(generator.insights(profile(false, false, false, false, 10, 3)))
                .containsExactly(InsightType.STATISTICAL_MODELING);
    }

    @Test
    void shouldClassifyCategoryByPriority() {
        assertThat(DataCategory.classify(profile(true, true, true, true, 1, 0))).isEqualTo(DataCategory.GENERATION);
        assertThat(DataCategory.classify(profile(true, true, false, true, 1, 0))).isEqualTo(DataCategory.PERFORMANCE);
        assertThat(DataCategory.classify(profile(true, true, false, false, 1, 0))).isEqualTo(DataCategory.ENVIRONMENTAL);
        assertThat(DataCategory.classify(profile(true, false, false, false, 1, 0))).isEqualTo(DataCategory.GENERIC);
        assertThat(DataCategory.classify(profile(false, false, false, false, 1, 0))).isEqualTo(DataCategory.GENERIC);
    }

    @Test
    void shouldDeriveDomainInsightsFromFlags() {
        assertThat(generator.domainInsights(profile(true, true, true, false, 1, 0)).getPeakProductionTimes())
                .containsExactly("08:00-16:00", "12:00-14:00 (peak)");
        assertThat(generator.domainInsights(profile(false, false, true, false, 1, 0)).getPeakProductionTimes())
                .containsExactly("10:00-14:00");
        assertThat(generator.domainInsights(profile(false, true, false, false, 1, 0)).getWeatherFactors())
                .containsExactly("irradiance", "temperature", "cloud cover");
        assertThat(generator.domainInsights(profile(false, false, false, false, 1, 0)).getPeakProductionTimes())
                .isEmpty();
    }

    @Test
    void shouldBeDeterministic() {
        List<String> headers = List.of("Date", "Energy_kWh", "Temperature", "Efficiency");
        PatternProfile profile = profile(true, true, true, true, 200, 3);

        RuleBasedAnalysis first = generator.generate("Plant", headers, profile, 4);
        RuleBasedAnalysis second = generator.generate("Plant", headers, profile, 4);

        assertThat(first).isEqualTo(second);
    }

    private PatternProfile profile(boolean energy, boolean weather, boolean time, boolean performance,
                                   int records, int numericColumns) {
        Map<String, ColumnType> types = new LinkedHashMap<>();
        for (int i = 0; i < numericColumns; i++) {
            types.put("n" + i, ColumnType.NUMERIC);
        }
        types.put("label", ColumnType.TEXT);
        return new PatternProfile(energy, false, weather, time, false, performance,
                Set.of(), Set.of(), types, records);
    }
}
