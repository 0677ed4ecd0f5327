package org.carball.pvadvisor.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.pvadvisor.model.analysis.DataCategory;
import org.carball.pvadvisor.model.analysis.PatternProfile;
import org.carball.pvadvisor.model.recommendation.DomainInsights;
import org.carball.pvadvisor.narrative.DataFeature;
import org.carball.pvadvisor.narrative.InsightType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deterministic fallback used whenever the AI path fails. Output depends only on
 * the pattern profile, the sheet name and the header list.
 */
@Slf4j
public class RuleBasedGenerator {

    static final int TREND_RECORD_THRESHOLD = 100;
    static final int DEGRADATION_RECORD_THRESHOLD = 50;
    static final int MODELING_NUMERIC_COLUMN_THRESHOLD = 2;
    static final int MAX_FIELDS = 5;

    private static final int ENERGY_FIELD_QUOTA = 2;
    private static final int TIME_FIELD_QUOTA = 1;
    private static final int WEATHER_FIELD_QUOTA = 1;
    private static final int PERFORMANCE_FIELD_QUOTA = 1;

    static final List<String> PEAK_WINDOW = List.of("10:00-14:00");
    static final List<String> WIDE_PEAK_WINDOW = List.of("08:00-16:00", "12:00-14:00 (peak)");
    static final List<String> WEATHER_FACTORS = List.of("irradiance", "temperature", "cloud cover");

    public RuleBasedAnalysis generate(String sheetName, List<String> headers, PatternProfile profile, int columnCount) {
        List<String> safeHeaders = headers != null ? headers : List.of();

        RuleBasedAnalysis analysis = new RuleBasedAnalysis(
                DataCategory.classify(profile),
                sheetName,
                profile.recordCount(),
                columnCount,
                features(profile),
                profile.hasEnergyData() && profile.hasWeatherData(),
                insights(profile),
                recommendFields(safeHeaders, profile),
                domainInsights(profile)
        );

        log.debug("Rule-based analysis for '{}': category={}, fields={}, insights={}",
                sheetName, analysis.category(), analysis.recommendedFields(), analysis.insights());
        return analysis;
    }

    Set<DataFeature> features(PatternProfile profile) {
        Set<DataFeature> features = EnumSet.noneOf(DataFeature.class);
        if (profile.hasEnergyData()) features.add(DataFeature.ENERGY);
        if (profile.hasWeatherData()) features.add(DataFeature.WEATHER);
        if (profile.hasTimeData()) features.add(DataFeature.TIME);
        if (profile.hasLocationData()) features.add(DataFeature.LOCATION);
        if (profile.hasPerformanceData()) features.add(DataFeature.PERFORMANCE);
        return Collections.unmodifiableSet(features);
    }

    List<InsightType> insights(PatternProfile profile) {
        List<InsightType> insights = new ArrayList<>();
        int records = profile.recordCount();

        if (profile.hasEnergyData() && profile.hasTimeData() && records > TREND_RECORD_THRESHOLD) {
            insights.add(InsightType.TIME_SERIES_TREND);
        }

        if (profile.hasEnergyData() && profile.hasWeatherData()) {
            insights.add(InsightType.WEATHER_CORRELATION);
        }

        if (profile.hasPerformanceData() && records > DEGRADATION_RECORD_THRESHOLD) {
            insights.add(InsightType.PERFORMANCE_DEGRADATION);
        }

        if (profile.numericColumnCount() > MODELING_NUMERIC_COLUMN_THRESHOLD) {
            insights.add(InsightType.STATISTICAL_MODELING);
        }

        return insights;
    }

    /**
     * Priority pool: energy (2), time (1), weather (1), performance (1); deduplicated, capped at five.
     */
    List<String> recommendFields(List<String> headers, PatternProfile profile) {
        Set<String> recommended = new LinkedHashSet<>();

        if (profile.hasEnergyData()) {
            recommended.addAll(matching(headers, KeywordFamily.ENERGY, ENERGY_FIELD_QUOTA));
        }
        if (profile.hasTimeData()) {
            recommended.addAll(matching(headers, KeywordFamily.TIME_FIELD, TIME_FIELD_QUOTA));
        }
        if (profile.hasWeatherData()) {
            recommended.addAll(matching(headers, KeywordFamily.WEATHER_FIELD, WEATHER_FIELD_QUOTA));
        }
        if (profile.hasPerformanceData()) {
            recommended.addAll(matching(headers, KeywordFamily.PERFORMANCE, PERFORMANCE_FIELD_QUOTA));
        }

        return recommended.stream()
                .limit(MAX_FIELDS)
                .toList();
    }

    DomainInsights domainInsights(PatternProfile profile) {
        List<String> peak = new ArrayList<>();
        if (profile.hasEnergyData() && profile.hasTimeData()) {
            peak.addAll(WIDE_PEAK_WINDOW);
        } else if (profile.hasTimeData()) {
            peak.addAll(PEAK_WINDOW);
        }

        List<String> weather = new ArrayList<>();
        if (profile.hasWeatherData()) {
            weather.addAll(WEATHER_FACTORS);
        }

        // TODO: derive maintenance patterns and performance metrics once rated-capacity columns are ingested
        return DomainInsights.builder()
                .peakProductionTimes(peak)
                .weatherFactors(weather)
                .maintenancePatterns(new ArrayList<>())
                .performanceMetrics(new ArrayList<>())
                .build();
    }

    private List<String> matching(List<String> headers, KeywordFamily family, int quota) {
        return headers.stream()
                .filter(family::matches)
                .limit(quota)
                .toList();
    }
}
