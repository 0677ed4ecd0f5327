package org.carball.pvadvisor.narrative;

import org.carball.pvadvisor.model.analysis.DataCategory;
import org.carball.pvadvisor.model.recommendation.FilterType;

import java.util.Set;
import java.util.stream.Collectors;

public class EnglishNarrativeTemplates implements NarrativeTemplates {

    @Override
    public String title(DataCategory category, String sheetName) {
        return switch (category) {
            case GENERATION -> "PV Solar Generation Data";
            case PERFORMANCE -> "PV Solar Performance Monitoring Data";
            case ENVIRONMENTAL -> "PV Solar Environmental Data";
            case GENERIC -> "PV Solar " + sheetName + " Data";
        };
    }

    @Override
    public String description(int recordCount, int columnCount, Set<DataFeature> features, boolean correlationSupported) {
        StringBuilder description = new StringBuilder();
        description.append(recordCount).append(" records of PV solar data across ")
                .append(columnCount).append(" fields.");

        if (!features.isEmpty()) {
            description.append(" Includes ")
                    .append(features.stream().map(this::featureLabel).collect(Collectors.joining(", ")))
                    .append(" data for PV system analysis.");
        }

        if (correlationSupported) {
            description.append(" Supports weather-factor vs. generation correlation analysis.");
        }

        return description.toString();
    }

    @Override
    public String insight(InsightType insight) {
        return switch (insight) {
            case TIME_SERIES_TREND -> "Time-series trend analysis possible";
            case WEATHER_CORRELATION -> "Weather-to-generation correlation analysis possible";
            case PERFORMANCE_DEGRADATION -> "Performance-degradation analysis possible";
            case STATISTICAL_MODELING -> "Statistical/predictive modeling possible";
        };
    }

    @Override
    public String structure(int recordCount, int columnCount) {
        return String.format("PV Solar data (%d rows x %d columns)", recordCount, columnCount);
    }

    @Override
    public String filterDescription(FilterType type, String column) {
        return switch (type) {
            case DATE_RANGE -> "Filter by " + column + " to prioritise recent data";
            case NUMERIC_RANGE -> "Filter " + column + " to a valid value range for energy data quality";
            case WEATHER_RANGE -> "Filter by " + column + " to analyse weather influence";
        };
    }

    private String featureLabel(DataFeature feature) {
        return switch (feature) {
            case ENERGY -> "energy production";
            case WEATHER -> "weather/environment";
            case TIME -> "time";
            case LOCATION -> "location";
            case PERFORMANCE -> "performance monitoring";
        };
    }
}
