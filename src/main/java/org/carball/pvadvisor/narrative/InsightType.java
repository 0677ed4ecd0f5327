package org.carball.pvadvisor.narrative;

public enum InsightType {
    TIME_SERIES_TREND,
    WEATHER_CORRELATION,
    PERFORMANCE_DEGRADATION,
    STATISTICAL_MODELING
}
